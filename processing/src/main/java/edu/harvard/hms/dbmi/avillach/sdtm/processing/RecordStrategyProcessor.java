package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.Observation;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.ObservationField;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.Block;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ColumnDefinition;
import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.ValueSource;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One row per observation. Records are filtered by form, item group and item identifier, and each row carries the block keys
 * together with the item identifier and value it was captured under.
 */
public class RecordStrategyProcessor implements AssemblyStrategy {

    private static final Logger log = LoggerFactory.getLogger(RecordStrategyProcessor.class);

    private final AssemblyDiagnostics diagnostics;
    private final ColumnTransforms transforms;

    public RecordStrategyProcessor(AssemblyDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.transforms = new ColumnTransforms(diagnostics);
    }

    @Override
    public StrategyResult process(String tableName, List<Block> blocks, RecordStore records, List<String> defaultKeys) {
        List<DataTable> tables = new ArrayList<>();
        List<SequenceRequest> sequenceRequests = new ArrayList<>();
        for (Block block : blocks) {
            sequenceRequests.addAll(SequenceRequest.fromBlock(block));

            RecordStore filtered = records.filter(filter(block));
            if (filtered.isEmpty()) {
                diagnostics.warn(WarningReason.EMPTY_RECORD_SET, tableName, block.index(), null,
                    "no records match forms " + block.formOids() + ", item group '" + block.itemGroupRegex() + "', item '"
                        + block.itemOidRegex() + "'");
                continue;
            }
            Optional<DataTable> base = baseTable(tableName, block, filtered, block.keysOr(defaultKeys));
            if (base.isEmpty()) {
                continue;
            }
            DataTable table = resolveColumns(tableName, block, base.get(), filtered);
            log.debug("{} block {}: {} rows", tableName, block.index(), table.rowCount());
            tables.add(table);
        }
        return new StrategyResult(tables, sequenceRequests);
    }

    static Predicate<Observation> filter(Block block) {
        Set<String> forms = Set.copyOf(block.formOids());
        Pattern itemGroup = block.itemGroupRegex() == null ? null : Pattern.compile(block.itemGroupRegex());
        Pattern item = block.itemOidRegex() == null ? null : Pattern.compile(block.itemOidRegex());
        return o -> (forms.isEmpty() || forms.contains(o.formOid()))
            && matchesFromStart(itemGroup, o.itemGroupOid())
            && matchesFromStart(item, o.itemOid());
    }

    private static boolean matchesFromStart(Pattern pattern, String value) {
        if (pattern == null) {
            return true;
        }
        return value != null && pattern.matcher(value).lookingAt();
    }

    /**
     * Block keys, then ItemOID and Value.
     */
    private Optional<DataTable> baseTable(String tableName, Block block, RecordStore records, List<String> keys) {
        Set<String> columns = new LinkedHashSet<>(keys);
        columns.add(ObservationField.ITEM_OID.columnName());
        columns.add(ObservationField.VALUE.columnName());

        DataTable base = new DataTable(records.size());
        for (String column : columns) {
            Optional<ObservationField> field = RecordStore.field(column);
            if (field.isEmpty()) {
                diagnostics.warn(WarningReason.MISSING_JOIN_KEY, tableName, block.index(), null,
                    "key column '" + column + "' is not a record column; skipping block");
                return Optional.empty();
            }
            base.putColumn(column, fieldValues(records, field.get()));
        }
        return Optional.of(base);
    }

    private DataTable resolveColumns(String tableName, Block block, DataTable base, RecordStore records) {
        DataTable result = new DataTable(base.rowCount());
        Map<String, String> labels = new LinkedHashMap<>();
        for (ColumnDefinition column : block.columns()) {
            List<Object> values = resolveSource(tableName, block.index(), column, base, records, result);
            values = transforms.apply(tableName, block.index(), column, values, name -> lookup(name, result, base, records));
            result.putColumn(column.name(), values);
            if (column.label() != null) {
                labels.put(column.name(), column.label());
            }
        }
        result.putLabels(labels);
        return result;
    }

    private List<Object> resolveSource(
        String tableName, int blockIndex, ColumnDefinition column, DataTable base, RecordStore records, DataTable resolved
    ) {
        int rows = base.rowCount();
        ValueSource source = column.source();
        if (source instanceof ValueSource.Literal literal) {
            return Collections.nCopies(rows, literal.value());
        }
        if (source instanceof ValueSource.SourceReference reference) {
            List<Object> values = lookup(reference.columnName(), resolved, base, records);
            if (values != null) {
                return values;
            }
            diagnostics.warn(WarningReason.MISSING_SOURCE_COLUMN, tableName, blockIndex, column.name(),
                "source column '" + reference.columnName() + "' not found; filling with nulls");
            return Collections.nCopies(rows, null);
        }
        if (source instanceof ValueSource.Unassigned) {
            if (column.sequence() == null) {
                diagnostics.warn(WarningReason.NO_SOURCE_DECLARED, tableName, blockIndex, column.name(), "filling with nulls");
            }
            return Collections.nCopies(rows, null);
        }
        diagnostics.warn(WarningReason.UNSUPPORTED_SOURCE, tableName, blockIndex, column.name(),
            source.getClass().getSimpleName() + " sources are not supported by record blocks; filling with nulls");
        return Collections.nCopies(rows, null);
    }

    /**
     * The base table, then any record field, then already resolved target columns.
     */
    private static List<Object> lookup(String name, DataTable resolved, DataTable base, RecordStore records) {
        if (base.hasColumn(name)) {
            return base.column(name);
        }
        Optional<ObservationField> field = RecordStore.field(name);
        if (field.isPresent()) {
            return fieldValues(records, field.get());
        }
        return resolved.hasColumn(name) ? resolved.column(name) : null;
    }

    private static List<Object> fieldValues(RecordStore records, ObservationField field) {
        List<Object> values = new ArrayList<>(records.size());
        for (Observation observation : records.observations()) {
            values.add(field.valueOf(observation));
        }
        return values;
    }
}
