package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.ObservationField;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ValueSource;

import java.util.List;

// TODO: replace the name heuristics with an explicit 'role' property on generated column definitions
/**
 * Decides whether a generated column drives row cardinality (backbone) or is broadcast per key (attribute), from the target name
 * and the size of its item filter.
 */
public class BackboneClassifier {

    public enum Role {
        BACKBONE,
        ATTRIBUTE
    }

    static final String TEST_CODE_SUFFIX = "TESTCD";

    private static final List<String> RESULT_FRAGMENTS = List.of("ORRES", "STRES", "STAT", "REASND", "TERM", "DECOD", "VISIT", "DTC");

    public Role classify(String targetName, ValueSource.Generated generated) {
        return isTopicOrResult(targetName) && generated.itemOids().size() > 1 ? Role.BACKBONE : Role.ATTRIBUTE;
    }

    public boolean isTopicOrResult(String targetName) {
        return isTestCode(targetName) || targetName.endsWith("OBJ") || RESULT_FRAGMENTS.stream().anyMatch(targetName::contains);
    }

    public boolean isTestCode(String targetName) {
        return targetName.endsWith(TEST_CODE_SUFFIX);
    }

    /**
     * Test-code columns carry the item identifier; everything else carries the value.
     */
    public ObservationField returnedField(String targetName, ValueSource.Generated generated) {
        if (generated.returns() != null) {
            return generated.returns();
        }
        return isTestCode(targetName) ? ObservationField.ITEM_OID : ObservationField.VALUE;
    }
}
