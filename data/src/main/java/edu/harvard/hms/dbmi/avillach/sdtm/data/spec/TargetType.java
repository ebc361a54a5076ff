package edu.harvard.hms.dbmi.avillach.sdtm.data.spec;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum TargetType {
    STRING("str", "string"),
    INTEGER("int", "integer"),
    FLOAT("float", "double"),
    BOOLEAN("bool", "boolean");

    private final List<String> configNames;

    TargetType(String... configNames) {
        this.configNames = List.of(configNames);
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public static Optional<TargetType> fromConfig(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.configNames.contains(normalized)).findFirst();
    }
}
