package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.Observation;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;

import java.util.Arrays;
import java.util.List;

import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;

final class ObservationFixtures {

    static final String STUDY = "STUDY01";

    private ObservationFixtures() {
    }

    static Observation observation(String subject, String form, String itemOid, String value) {
        return observation(subject, "SE_BASELINE", form, "IG_" + form, "1", itemOid, value);
    }

    static Observation observation(
        String subject, String event, String form, String itemGroup, String repeatKey, String itemOid, String value
    ) {
        return new Observation(STUDY, subject, "SSID-" + subject, event, form, itemGroup, repeatKey, itemOid, value);
    }

    static List<Object> list(Object... values) {
        return Arrays.asList(values);
    }

    // the five-argument warn delegates to warn(AssemblyWarning), so either form can be verified
    static AssemblyDiagnostics diagnostics() {
        return mock(AssemblyDiagnostics.class, CALLS_REAL_METHODS);
    }
}
