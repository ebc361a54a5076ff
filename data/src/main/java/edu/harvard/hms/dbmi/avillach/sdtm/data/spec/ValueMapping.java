package edu.harvard.hms.dbmi.avillach.sdtm.data.spec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Code list translation. With a default literal or default source the mapping is strict and every unmapped value falls back to
 * the default; without one it is partial and unmapped values pass through unchanged.
 */
public record ValueMapping(Map<String, Object> table, Object defaultLiteral, String defaultSource) {

    public ValueMapping {
        table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    public boolean isStrict() {
        return defaultLiteral != null || defaultSource != null;
    }

    public boolean contains(Object value) {
        return value != null && table.containsKey(value.toString());
    }

    public Object lookup(Object value) {
        return value == null ? null : table.get(value.toString());
    }
}
