package edu.harvard.hms.dbmi.avillach.sdtm.data.spec;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

public record MappingSpecification(Map<String, TableSpecification> tables) {

    public MappingSpecification {
        tables = ImmutableMap.copyOf(tables);
    }

    public Optional<TableSpecification> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }
}
