package edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One non-fatal anomaly, scoped to the smallest affected unit. {@code block} and {@code column} are null when the warning
 * concerns a whole table or block.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssemblyWarning(
    WarningCategory category,
    WarningReason reasonCode,
    String table,
    Integer block,
    String column,
    String reasonDetail
) {

    public static AssemblyWarning of(WarningReason reason, String table, Integer block, String column, String detail) {
        return new AssemblyWarning(reason.getCategory(), reason, table, block, column, detail);
    }

    public String location() {
        StringBuilder sb = new StringBuilder(table == null ? "?" : table);
        if (block != null) {
            sb.append("[block ").append(block).append(']');
        }
        if (column != null) {
            sb.append('.').append(column);
        }
        return sb.toString();
    }
}
