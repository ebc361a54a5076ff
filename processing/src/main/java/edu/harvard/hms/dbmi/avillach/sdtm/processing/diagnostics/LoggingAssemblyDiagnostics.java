package edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAssemblyDiagnostics implements AssemblyDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(LoggingAssemblyDiagnostics.class);

    @Override
    public void warn(AssemblyWarning warning) {
        log.warn("[{}] {} {}: {}", warning.category(), warning.reasonCode(), warning.location(), warning.reasonDetail());
    }
}
