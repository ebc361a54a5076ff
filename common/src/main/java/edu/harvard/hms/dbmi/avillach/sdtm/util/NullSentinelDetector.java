package edu.harvard.hms.dbmi.avillach.sdtm.util;

import java.util.Locale;
import java.util.Set;

/**
 * Detects text that stands in for a missing value.
 *
 * <p>Matching is case-insensitive and whitespace is trimmed before comparison. Non-string values are never sentinels, except
 * {@code null} itself.</p>
 *
 * <p>Two presets exist. {@link #NullSentinelDetector()} recognises the broad set of delimited-file null markers ("", "nan", "na",
 * "n/a", "null", "none", "\N"). {@link #textArtifacts()} recognises only the tokens produced by stringifying a null ("nan",
 * "none", "null"), so that legitimate answers such as "NA" survive string normalisation and missing-value counts.</p>
 */
public class NullSentinelDetector {

    private static final Set<String> DEFAULT_NULL_SENTINELS = Set.of(
        "",
        "nan",
        "na",
        "n/a",
        "null",
        "none",
        "\\n"
    );

    private static final Set<String> TEXT_ARTIFACTS = Set.of("nan", "none", "null");

    private final Set<String> nullSentinels;

    public NullSentinelDetector() {
        this.nullSentinels = DEFAULT_NULL_SENTINELS;
    }

    /**
     * @param customSentinels lowercase sentinel strings; {@code null} falls back to the defaults
     */
    public NullSentinelDetector(Set<String> customSentinels) {
        this.nullSentinels = customSentinels != null ? customSentinels : DEFAULT_NULL_SENTINELS;
    }

    public static NullSentinelDetector textArtifacts() {
        return new NullSentinelDetector(TEXT_ARTIFACTS);
    }

    public boolean isNullSentinel(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            String str = ((String) value).trim().toLowerCase(Locale.ROOT);
            return nullSentinels.contains(str);
        }
        return false;
    }

    /**
     * Returns {@code null} for sentinels and the value unchanged otherwise.
     */
    public Object collapse(Object value) {
        return isNullSentinel(value) ? null : value;
    }

    public Set<String> getNullSentinels() {
        return Set.copyOf(nullSentinels);
    }
}
