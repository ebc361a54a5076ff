package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import com.google.common.collect.Ordering;
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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One row per key combination. Each block's records are filtered by form, pivoted on item identifier against the block's keys, and
 * the declared target columns are resolved from the pivoted table.
 */
public class PivotStrategyProcessor implements AssemblyStrategy {

    private static final Logger log = LoggerFactory.getLogger(PivotStrategyProcessor.class);

    private static final Ordering<Iterable<String>> KEY_ORDER = Ordering.<String>natural().lexicographical();

    private final AssemblyDiagnostics diagnostics;
    private final ColumnTransforms transforms;

    public PivotStrategyProcessor(AssemblyDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.transforms = new ColumnTransforms(diagnostics);
    }

    @Override
    public StrategyResult process(String tableName, List<Block> blocks, RecordStore records, List<String> defaultKeys) {
        List<DataTable> tables = new ArrayList<>();
        List<SequenceRequest> sequenceRequests = new ArrayList<>();

        for (Block block : blocks) {
            sequenceRequests.addAll(SequenceRequest.fromBlock(block));

            if (!block.hasFormFilter()) {
                diagnostics.warn(WarningReason.MISSING_FORM_FILTER, tableName, block.index(), null, "pivot blocks must filter by form");
                continue;
            }
            Set<String> forms = Set.copyOf(block.formOids());
            RecordStore filtered = records.filter(o -> forms.contains(o.formOid()));
            if (filtered.isEmpty()) {
                diagnostics.warn(WarningReason.EMPTY_RECORD_SET, tableName, block.index(), null, "no records for forms " + forms);
                continue;
            }

            List<String> keys = block.keysOr(defaultKeys);
            Optional<DataTable> pivoted = pivot(tableName, block.index(), filtered, keys);
            if (pivoted.isEmpty()) {
                continue;
            }
            DataTable table = resolveColumns(tableName, block, pivoted.get());
            log.debug("{} block {}: {} rows from {} records", tableName, block.index(), table.rowCount(), filtered.size());
            tables.add(table);
        }
        return new StrategyResult(tables, sequenceRequests);
    }

    /**
     * Pivots on item identifier, keeping the first non-null value per (key, item). Rows are ordered by key; records with a null key
     * cell are dropped.
     */
    Optional<DataTable> pivot(String tableName, int blockIndex, RecordStore records, List<String> keys) {
        if (keys.isEmpty()) {
            diagnostics.warn(WarningReason.PIVOT_FAILED, tableName, blockIndex, null, "no key columns declared");
            return Optional.empty();
        }
        List<ObservationField> keyFields = new ArrayList<>();
        for (String key : keys) {
            Optional<ObservationField> field = RecordStore.field(key);
            if (field.isEmpty()) {
                diagnostics.warn(WarningReason.PIVOT_FAILED, tableName, blockIndex, null, "key column '" + key + "' is not a record column");
                return Optional.empty();
            }
            if (field.get() == ObservationField.ITEM_OID || field.get() == ObservationField.VALUE) {
                diagnostics.warn(WarningReason.PIVOT_FAILED, tableName, blockIndex, null, "key column '" + key + "' is the pivoted column");
                return Optional.empty();
            }
            keyFields.add(field.get());
        }

        TreeMap<List<String>, Map<String, String>> rows = new TreeMap<>(KEY_ORDER);
        Set<String> items = new LinkedHashSet<>();
        int dropped = 0;
        for (Observation observation : records.observations()) {
            List<String> key = new ArrayList<>(keyFields.size());
            for (ObservationField field : keyFields) {
                key.add(field.valueOf(observation));
            }
            if (key.contains(null)) {
                dropped++;
                continue;
            }
            Map<String, String> cells = rows.computeIfAbsent(key, k -> new HashMap<>());
            if (observation.value() != null) {
                cells.putIfAbsent(observation.itemOid(), observation.value());
                items.add(observation.itemOid());
            }
        }
        if (dropped > 0) {
            log.debug("{} block {}: dropped {} records with null key cells", tableName, blockIndex, dropped);
        }
        if (rows.isEmpty()) {
            diagnostics.warn(WarningReason.EMPTY_RECORD_SET, tableName, blockIndex, null, "every record has a null key cell");
            return Optional.empty();
        }

        DataTable pivoted = new DataTable(rows.size());
        List<List<String>> keyTuples = new ArrayList<>(rows.keySet());
        for (int k = 0; k < keys.size(); k++) {
            int position = k;
            pivoted.putColumn(keys.get(k), keyTuples.stream().map(t -> (Object) t.get(position)).toList());
        }
        for (String item : items) {
            if (pivoted.hasColumn(item)) {
                continue;
            }
            List<Object> values = new ArrayList<>(rows.size());
            rows.values().forEach(cells -> values.add(cells.get(item)));
            pivoted.putColumn(item, values);
        }
        return Optional.of(pivoted);
    }

    private DataTable resolveColumns(String tableName, Block block, DataTable pivoted) {
        DataTable result = new DataTable(pivoted.rowCount());
        Map<String, String> labels = new LinkedHashMap<>();

        for (ColumnDefinition column : block.columns()) {
            List<Object> values = resolveSource(tableName, block.index(), column, pivoted, result);
            values = transforms.apply(tableName, block.index(), column, values, name -> lookup(name, result, pivoted));
            result.putColumn(column.name(), values);
            if (column.label() != null) {
                labels.put(column.name(), column.label());
            }
        }
        result.putLabels(labels);
        return result;
    }

    private List<Object> resolveSource(String tableName, int blockIndex, ColumnDefinition column, DataTable pivoted, DataTable resolved) {
        int rows = pivoted.rowCount();
        ValueSource source = column.source();

        if (source instanceof ValueSource.Literal literal) {
            return Collections.nCopies(rows, literal.value());
        }
        if (source instanceof ValueSource.SourceReference reference) {
            String name = reference.columnName();
            if (pivoted.hasColumn(name)) {
                return pivoted.column(name);
            }
            if (resolved.hasColumn(name)) {
                return resolved.column(name);
            }
            diagnostics.warn(WarningReason.MISSING_SOURCE_COLUMN, tableName, blockIndex, column.name(),
                "source column '" + name + "' not found; filling with nulls");
            return Collections.nCopies(rows, null);
        }
        if (source instanceof ValueSource.Unassigned) {
            if (column.sequence() == null) {
                diagnostics.warn(WarningReason.NO_SOURCE_DECLARED, tableName, blockIndex, column.name(), "filling with nulls");
            }
            return Collections.nCopies(rows, null);
        }
        diagnostics.warn(WarningReason.UNSUPPORTED_SOURCE, tableName, blockIndex, column.name(),
            source.getClass().getSimpleName() + " sources are not supported by pivot blocks; filling with nulls");
        return Collections.nCopies(rows, null);
    }

    /**
     * Already resolved target columns first, then the pivoted table.
     */
    private static List<Object> lookup(String name, DataTable resolved, DataTable pivoted) {
        if (resolved.hasColumn(name)) {
            return resolved.column(name);
        }
        return pivoted.hasColumn(name) ? pivoted.column(name) : null;
    }
}
