package edu.harvard.hms.dbmi.avillach.sdtm.data.spec;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Functions that generate a column's record subset in the functional strategy.
 */
public enum GeneratingFunction {
    /** Selects observations by form and item filters and returns one field of each. */
    EXTRACT_VALUE("extract_value", "func_fa");

    private final List<String> configNames;

    GeneratingFunction(String... configNames) {
        this.configNames = List.of(configNames);
    }

    public static Optional<GeneratingFunction> fromConfig(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(f -> f.configNames.contains(name.trim())).findFirst();
    }
}
