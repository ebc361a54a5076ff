package edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics;

public enum WarningCategory {
    /** Missing form filter, missing source, group, join or sort column, unresolved source expression. */
    CONFIGURATION,
    /** Missing-value percentage above a configured threshold. */
    DATA_QUALITY,
    /** A block, column or table was skipped. */
    PROCESSING_SKIP
}
