package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ColumnDefinition;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.TargetType;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ValueMapping;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import edu.harvard.hms.dbmi.avillach.sdtm.util.NullSentinelDetector;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column-level value transforms shared by the strategies. Every transform returns a new list and keeps nulls as nulls.
 */
public class ColumnTransforms {

    private static final NullSentinelDetector TEXT_ARTIFACTS = NullSentinelDetector.textArtifacts();

    private final AssemblyDiagnostics diagnostics;

    public ColumnTransforms(AssemblyDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Applies, in order and where configured: substring, regex extraction, value mapping, prefix and type coercion, then checks the
     * missing-value threshold.
     *
     * @param fallbackColumn resolves a strict mapping's default source column, returning {@code null} when it does not exist
     */
    public List<Object> apply(
        String table, int block, ColumnDefinition column, List<Object> values, Function<String, List<Object>> fallbackColumn
    ) {
        List<Object> result = values;
        if (column.hasSubstring()) {
            result = substring(result, column.substringStart(), column.substringLength());
        }
        if (column.regexExtract() != null) {
            result = regexExtract(result, column.regexExtract());
        }
        ValueMapping mapping = column.valueMapping();
        if (mapping != null) {
            List<Object> fallback = null;
            if (mapping.defaultLiteral() == null && mapping.defaultSource() != null) {
                fallback = fallbackColumn.apply(mapping.defaultSource());
                if (fallback == null) {
                    diagnostics.warn(WarningReason.MISSING_DEFAULT_SOURCE, table, block, column.name(),
                        "Default source '" + mapping.defaultSource() + "' not found; unmapped values become null");
                }
            }
            result = mapValues(result, mapping, fallback);
        }
        if (column.prefix() != null && !column.prefix().isEmpty()) {
            result = prefix(result, column.prefix());
        }
        if (column.type() != null) {
            result = coerce(result, column.type());
        }
        if (column.maxMissingPct() != null) {
            checkMissing(table, block, column, result);
        }
        return result;
    }

    /**
     * 0-based start, clamped to the value's length.
     */
    public static List<Object> substring(List<Object> values, int start, int length) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                result.add(null);
                continue;
            }
            String text = value.toString();
            int from = Math.min(start, text.length());
            int to = (int) Math.min((long) start + length, text.length());
            result.add(text.substring(from, to));
        }
        return result;
    }

    /**
     * First capture group of the first match, or null when nothing matches.
     */
    public static List<Object> regexExtract(List<Object> values, Pattern pattern) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                result.add(null);
                continue;
            }
            Matcher matcher = pattern.matcher(value.toString());
            result.add(matcher.find() ? matcher.group(1) : null);
        }
        return result;
    }

    /**
     * Strict mappings replace every unmapped (or null-mapped) value with the default literal, or with the fallback column's value at
     * the same row. Partial mappings leave unmapped values untouched.
     */
    public static List<Object> mapValues(List<Object> values, ValueMapping mapping, List<Object> fallback) {
        List<Object> result = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!mapping.isStrict()) {
                result.add(mapping.contains(value) ? mapping.lookup(value) : value);
                continue;
            }
            Object mapped = mapping.lookup(value);
            if (mapped == null) {
                if (mapping.defaultLiteral() != null) {
                    mapped = mapping.defaultLiteral();
                } else if (fallback != null) {
                    mapped = fallback.get(i);
                }
            }
            result.add(mapped);
        }
        return result;
    }

    public static List<Object> prefix(List<Object> values, String prefix) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(value == null ? null : prefix + value);
        }
        return result;
    }

    public static List<Object> coerce(List<Object> values, TargetType type) {
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(coerce(value, type));
        }
        return result;
    }

    public static Object coerce(Object value, TargetType type) {
        return switch (type) {
            case INTEGER -> toLong(value);
            case FLOAT -> toDouble(value);
            case STRING -> value == null ? null : value.toString();
            case BOOLEAN -> toBoolean(value);
        };
    }

    /**
     * Numeric types are coerced; everything else becomes its string form with stringified-null artifacts collapsed to null.
     */
    public static List<Object> enforce(List<Object> values, TargetType type) {
        if (type.isNumeric()) {
            return coerce(values, type);
        }
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(value == null ? null : TEXT_ARTIFACTS.collapse(value.toString()));
        }
        return result;
    }

    /**
     * Percentage of missing cells. For columns declared as strings, stringified nulls count as missing too.
     *
     * @param type the declared type, or {@code null} when none was declared
     */
    public static double missingPercentage(List<Object> values, TargetType type) {
        if (values.isEmpty()) {
            return 0.0;
        }
        long missing = values.stream()
            .filter(v -> v == null || (type == TargetType.STRING && TEXT_ARTIFACTS.isNullSentinel(v)))
            .count();
        return missing * 100.0 / values.size();
    }

    private void checkMissing(String table, int block, ColumnDefinition column, List<Object> values) {
        if (values.isEmpty()) {
            return;
        }
        double pct = missingPercentage(values, column.type());
        if (pct > column.maxMissingPct()) {
            diagnostics.warn(WarningReason.MISSING_VALUES_ABOVE_THRESHOLD, table, block, column.name(),
                String.format(Locale.ROOT, "missing %.2f%% (limit: %s)", pct, column.maxMissingPct()));
        }
    }

    private static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        BigDecimal decimal = toDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        BigDecimal decimal = toDecimal(value);
        return decimal == null ? null : decimal.doubleValue();
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value == null) {
            return Boolean.FALSE;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        return !value.toString().isEmpty();
    }
}
