package edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics;

/**
 * Receives the warning stream of an assembly run. Implementations must be thread-safe when tables are assembled in parallel.
 */
public interface AssemblyDiagnostics {

    void warn(AssemblyWarning warning);

    default void warn(WarningReason reason, String table, Integer block, String column, String detail) {
        warn(AssemblyWarning.of(reason, table, block, column, detail));
    }
}
