package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.metadata.MetadataStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.Block;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ProcessingType;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.TableSpecification;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one domain table: dispatches the table's blocks to the strategy of the first block's processing type, concatenates the
 * partial tables in block order and generates the requested sequence columns.
 *
 * <p>Safe to share between threads assembling different tables.</p>
 */
public class DomainAssembler {

    private static final Logger log = LoggerFactory.getLogger(DomainAssembler.class);

    private final Map<ProcessingType, AssemblyStrategy> strategies;
    private final SequenceGenerator sequenceGenerator;
    private final AssemblyDiagnostics diagnostics;

    public DomainAssembler(MetadataStore metadata, AssemblyDiagnostics diagnostics) {
        this(defaultStrategies(metadata, diagnostics), new SequenceGenerator(diagnostics), diagnostics);
    }

    public DomainAssembler(
        Map<ProcessingType, AssemblyStrategy> strategies, SequenceGenerator sequenceGenerator, AssemblyDiagnostics diagnostics
    ) {
        this.strategies = new EnumMap<>(strategies);
        this.sequenceGenerator = sequenceGenerator;
        this.diagnostics = diagnostics;
    }

    private static Map<ProcessingType, AssemblyStrategy> defaultStrategies(MetadataStore metadata, AssemblyDiagnostics diagnostics) {
        Map<ProcessingType, AssemblyStrategy> strategies = new EnumMap<>(ProcessingType.class);
        strategies.put(ProcessingType.PIVOT, new PivotStrategyProcessor(diagnostics));
        strategies.put(ProcessingType.FUNCTIONAL, new FunctionalStrategyProcessor(metadata, diagnostics));
        strategies.put(ProcessingType.RECORD, new RecordStrategyProcessor(diagnostics));
        return strategies;
    }

    public Optional<DataTable> assemble(TableSpecification table, RecordStore records, List<String> defaultKeys) {
        return assemble(table.name(), table.blocks(), records, defaultKeys);
    }

    public Optional<DataTable> assemble(String tableName, Block block, RecordStore records, List<String> defaultKeys) {
        return assemble(tableName, List.of(block), records, defaultKeys);
    }

    /**
     * @return the finished table, or empty when no block produced rows
     */
    public Optional<DataTable> assemble(String tableName, List<Block> blocks, RecordStore records, List<String> defaultKeys) {
        if (blocks.isEmpty()) {
            diagnostics.warn(WarningReason.NO_OUTPUT, tableName, null, null, "no blocks declared");
            return Optional.empty();
        }
        ProcessingType type = blocks.get(0).type();
        List<ProcessingType> others = blocks.stream().map(Block::type).filter(t -> t != type).distinct().toList();
        if (!others.isEmpty()) {
            diagnostics.warn(WarningReason.MIXED_PROCESSING_TYPES, tableName, null, null,
                "processing all blocks as " + type + "; also declared: " + others);
        }
        AssemblyStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalStateException("No strategy registered for processing type " + type);
        }

        StrategyResult result = strategy.process(tableName, blocks, records, defaultKeys);
        DataTable combined = DataTable.concat(result.partialTables());
        if (result.partialTables().isEmpty() || combined.isEmpty()) {
            diagnostics.warn(WarningReason.NO_OUTPUT, tableName, null, null, "no block produced rows; nothing to write");
            return Optional.empty();
        }

        Map<String, SequenceRequest> requests = new LinkedHashMap<>();
        result.sequenceRequests().forEach(r -> requests.put(r.targetColumn(), r));
        sequenceGenerator.apply(tableName, combined, List.copyOf(requests.values()));

        log.info("{}: assembled {} rows x {} columns from {} of {} blocks", tableName, combined.rowCount(),
            combined.columnNames().size(), result.partialTables().size(), blocks.size());
        return Optional.of(combined);
    }
}
