package edu.harvard.hms.dbmi.avillach.sdtm.builder;

import edu.harvard.hms.dbmi.avillach.sdtm.builder.output.DomainWriter;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.MappingSpecification;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.TableSpecification;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.DomainAssembler;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Assembles and writes every selected table on a fixed thread pool, one task per table. A failing table is reported and skipped;
 * the other tables still complete.
 */
public class DomainBuildRunner {
    private static final Logger log = LoggerFactory.getLogger(DomainBuildRunner.class);

    private final DomainAssembler assembler;
    private final DomainWriter writer;
    private final AssemblyDiagnostics diagnostics;
    private final int threadCount;

    public DomainBuildRunner(DomainAssembler assembler, DomainWriter writer, AssemblyDiagnostics diagnostics, int threadCount) {
        this.assembler = assembler;
        this.writer = writer;
        this.diagnostics = diagnostics;
        this.threadCount = threadCount;
    }

    public enum Outcome {
        BUILT,
        SKIPPED,
        FAILED
    }

    public record TableResult(String table, Outcome outcome, int rowCount, Exception error) {
    }

    public record BuildSummary(List<TableResult> results) {

        public BuildSummary {
            results = List.copyOf(results);
        }

        public List<String> tables(Outcome outcome) {
            return results.stream().filter(r -> r.outcome() == outcome).map(TableResult::table).toList();
        }
    }

    /**
     * @param selected table names to build; empty builds every table of the specification
     */
    public BuildSummary run(MappingSpecification specification, RecordStore records, List<String> defaultKeys, List<String> selected) {
        List<TableSpecification> tables = selectTables(specification, selected);
        ExecutorService tablePool = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, tables.size())));

        log.info("Building {} tables with {} threads", tables.size(), threadCount);

        List<Future<TableResult>> futures = new ArrayList<>();
        for (TableSpecification table : tables) {
            futures.add(tablePool.submit(() -> buildTable(table, records, defaultKeys)));
        }

        List<TableResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String tableName = tables.get(i).name();
            try {
                TableResult result = futures.get(i).get();
                results.add(result);
                if (result.error() != null) {
                    log.error("Table {} failed", tableName, result.error());
                }
            } catch (InterruptedException e) {
                log.error("Interrupted while waiting for table {}", tableName, e);
                Thread.currentThread().interrupt();
                results.add(new TableResult(tableName, Outcome.FAILED, 0, e));
            } catch (ExecutionException e) {
                log.error("Failed to retrieve result for table {}", tableName, e);
                results.add(new TableResult(tableName, Outcome.FAILED, 0, e));
            }
        }

        tablePool.shutdown();
        try {
            if (!tablePool.awaitTermination(1, TimeUnit.HOURS)) {
                log.warn("Table pool did not terminate within 1 hour, forcing shutdown");
                tablePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for table pool to terminate", e);
            tablePool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        BuildSummary summary = new BuildSummary(results);
        log.info("Completed {} tables: built={}, skipped={}, failed={}", results.size(), summary.tables(Outcome.BUILT),
            summary.tables(Outcome.SKIPPED), summary.tables(Outcome.FAILED));
        return summary;
    }

    private TableResult buildTable(TableSpecification table, RecordStore records, List<String> defaultKeys) {
        try {
            log.info("Assembling table {} ({} blocks, {})", table.name(), table.blocks().size(), table.processingType());
            Optional<DataTable> assembled = assembler.assemble(table, records, defaultKeys);
            if (assembled.isEmpty()) {
                return new TableResult(table.name(), Outcome.SKIPPED, 0, null);
            }
            writer.write(table.name(), assembled.get());
            return new TableResult(table.name(), Outcome.BUILT, assembled.get().rowCount(), null);
        } catch (Exception e) {
            diagnostics.warn(WarningReason.TABLE_FAILED, table.name(), null, null, e.getClass().getSimpleName() + ": " + e.getMessage());
            return new TableResult(table.name(), Outcome.FAILED, 0, e);
        }
    }

    private static List<TableSpecification> selectTables(MappingSpecification specification, List<String> selected) {
        if (selected == null || selected.isEmpty()) {
            return List.copyOf(specification.tables().values());
        }
        List<TableSpecification> tables = new ArrayList<>();
        for (String name : selected) {
            Optional<TableSpecification> table = specification.table(name);
            if (table.isPresent()) {
                tables.add(table.get());
            } else {
                log.warn("Table {} is not declared in the specification; skipping", name);
            }
        }
        return tables;
    }
}
