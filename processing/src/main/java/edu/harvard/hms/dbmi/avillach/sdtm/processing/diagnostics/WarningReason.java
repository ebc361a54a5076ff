package edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics;

import static edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningCategory.*;

/**
 * Stable codes for every recoverable anomaly raised during assembly.
 */
public enum WarningReason {
    MISSING_FORM_FILTER(CONFIGURATION, "Block declares no form filter"),
    MISSING_SOURCE_COLUMN(CONFIGURATION, "Source column not found"),
    NO_SOURCE_DECLARED(CONFIGURATION, "No source or literal declared"),
    UNSUPPORTED_SOURCE(CONFIGURATION, "Source kind not supported by this strategy"),
    MISSING_DEFAULT_SOURCE(CONFIGURATION, "Mapping default source column not found"),
    MISSING_JOIN_KEY(CONFIGURATION, "Key column is not a record column"),
    MISSING_METADATA_KEY(CONFIGURATION, "Metadata lookup key column missing"),
    MISSING_GROUP_COLUMN(CONFIGURATION, "Sequence group column missing"),
    MISSING_SORT_COLUMN(CONFIGURATION, "Sequence sort column missing"),
    MIXED_PROCESSING_TYPES(CONFIGURATION, "Blocks of one table declare different processing types"),
    MISSING_VALUES_ABOVE_THRESHOLD(DATA_QUALITY, "Missing-value percentage above threshold"),
    EMPTY_RECORD_SET(PROCESSING_SKIP, "No records match the block filters"),
    PIVOT_FAILED(PROCESSING_SKIP, "Pivot index could not be built"),
    EMPTY_GENERATED_COLUMN(PROCESSING_SKIP, "Generating function returned no rows"),
    NO_BACKBONE(PROCESSING_SKIP, "No backbone rows generated"),
    NO_OUTPUT(PROCESSING_SKIP, "Table produced no rows"),
    TABLE_FAILED(PROCESSING_SKIP, "Table assembly failed");

    private final WarningCategory category;
    private final String description;

    WarningReason(WarningCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public WarningCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }
}
