package edu.harvard.hms.dbmi.avillach.sdtm.builder.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyWarning;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSONL warning sink. Every warning is logged and written as one JSON object per line; a per-table rollup is appended on close.
 *
 * Thread-safe.
 */
public class JsonlWarningSink implements AssemblyDiagnostics, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JsonlWarningSink.class);

    private final Path outputFile;
    private final BufferedWriter writer;
    private final ObjectMapper mapper = new ObjectMapper();

    // Rollup counters
    private final ConcurrentSkipListMap<String, ConcurrentHashMap<WarningReason, AtomicLong>> rollupCounters = new ConcurrentSkipListMap<>();
    private final AtomicLong totalWarnings = new AtomicLong(0);

    public JsonlWarningSink(Path outputFile) throws IOException {
        this.outputFile = outputFile;
        if (outputFile.getParent() != null) {
            Files.createDirectories(outputFile.getParent());
        }
        this.writer = Files.newBufferedWriter(outputFile,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);

        log.info("Initialized warning sink: {}", outputFile);
    }

    @Override
    public synchronized void warn(AssemblyWarning warning) {
        log.warn("[{}] {} {}: {}", warning.category(), warning.reasonCode(), warning.location(), warning.reasonDetail());
        try {
            writer.write(mapper.writeValueAsString(warning));
            writer.newLine();
        } catch (IOException e) {
            log.error("Failed to write warning record", e);
        }

        rollupCounters
            .computeIfAbsent(warning.table() == null ? "(none)" : warning.table(), k -> new ConcurrentHashMap<>())
            .computeIfAbsent(warning.reasonCode(), k -> new AtomicLong(0))
            .incrementAndGet();
        totalWarnings.incrementAndGet();
    }

    /**
     * Writes rollup summary at end of run.
     */
    public synchronized void writeRollup() throws IOException {
        writer.write("\n--- ROLLUP SUMMARY ---\n");

        for (Map.Entry<String, ConcurrentHashMap<WarningReason, AtomicLong>> tableEntry : rollupCounters.entrySet()) {
            writer.write(String.format("Table: %s\n", tableEntry.getKey()));
            for (Map.Entry<WarningReason, AtomicLong> reasonEntry : tableEntry.getValue().entrySet()) {
                writer.write(String.format("  %s: %d\n", reasonEntry.getKey(), reasonEntry.getValue().get()));
            }
        }

        writer.write(String.format("Total Warnings: %d\n", totalWarnings.get()));
        writer.flush();

        log.info("Wrote rollup summary: {} total warnings", totalWarnings.get());
    }

    public long getTotalWarnings() {
        return totalWarnings.get();
    }

    public long getWarningCount(String table, WarningReason reason) {
        Map<WarningReason, AtomicLong> counters = rollupCounters.get(table);
        AtomicLong count = counters == null ? null : counters.get(reason);
        return count == null ? 0 : count.get();
    }

    @Override
    public void close() throws IOException {
        writeRollup();
        writer.close();
        log.info("Closed warning sink: {}", outputFile);
    }
}
