package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.metadata.MetadataStore;
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

/**
 * One row per finding. Generated columns are split into backbone columns, which are outer-joined on the join keys plus the item
 * identifier and so decide the row count, and attribute columns, which hold one value per join key and are broadcast onto every
 * backbone row sharing that key. Remaining columns are filled from sources, literals, built-in defaults and metadata lookups.
 */
public class FunctionalStrategyProcessor implements AssemblyStrategy {

    private static final Logger log = LoggerFactory.getLogger(FunctionalStrategyProcessor.class);

    static final String FORM_KEY = ObservationField.FORM_OID.columnName();
    static final String ITEM_KEY = ObservationField.ITEM_OID.columnName();

    private final MetadataStore metadata;
    private final AssemblyDiagnostics diagnostics;
    private final BackboneClassifier classifier;

    public FunctionalStrategyProcessor(MetadataStore metadata, AssemblyDiagnostics diagnostics) {
        this(metadata, diagnostics, new BackboneClassifier());
    }

    public FunctionalStrategyProcessor(MetadataStore metadata, AssemblyDiagnostics diagnostics, BackboneClassifier classifier) {
        this.metadata = metadata;
        this.diagnostics = diagnostics;
        this.classifier = classifier;
    }

    @Override
    public StrategyResult process(String tableName, List<Block> blocks, RecordStore records, List<String> defaultKeys) {
        List<DataTable> tables = new ArrayList<>();
        List<SequenceRequest> sequenceRequests = new ArrayList<>();
        for (Block block : blocks) {
            sequenceRequests.addAll(SequenceRequest.fromBlock(block));
            processBlock(tableName, block, records, defaultKeys).ifPresent(tables::add);
        }
        return new StrategyResult(tables, sequenceRequests);
    }

    Optional<DataTable> processBlock(String tableName, Block block, RecordStore records, List<String> defaultKeys) {
        List<String> joinKeys = joinKeys(block.keysOr(defaultKeys));
        for (String key : joinKeys) {
            if (!RecordStore.hasField(key)) {
                diagnostics.warn(WarningReason.MISSING_JOIN_KEY, tableName, block.index(), null,
                    "join key '" + key + "' is not a record column; skipping block");
                return Optional.empty();
            }
        }
        List<String> backboneKeys = new ArrayList<>(new LinkedHashSet<>(withItemKey(joinKeys)));

        DataTable backbone = null;
        List<String> backboneColumns = new ArrayList<>();
        Map<String, DataTable> attributes = new LinkedHashMap<>();
        for (ColumnDefinition column : block.columns()) {
            if (!(column.source() instanceof ValueSource.Generated generated)) {
                continue;
            }
            BackboneClassifier.Role role = classifier.classify(column.name(), generated);
            List<String> groupKeys = role == BackboneClassifier.Role.BACKBONE ? backboneKeys : joinKeys;
            DataTable generatedTable = generate(block, column.name(), generated, records, groupKeys);
            if (generatedTable.isEmpty()) {
                diagnostics.warn(WarningReason.EMPTY_GENERATED_COLUMN, tableName, block.index(), column.name(),
                    "no records match forms " + generated.formOids() + " and items " + generated.itemOids());
                continue;
            }
            log.debug("{} block {}: {} column {} generated {} rows", tableName, block.index(), role, column.name(),
                generatedTable.rowCount());
            if (role == BackboneClassifier.Role.BACKBONE) {
                backbone = backbone == null ? generatedTable : TableJoins.fullOuterJoin(backbone, generatedTable, backboneKeys);
                backboneColumns.add(column.name());
            } else {
                attributes.put(column.name(), generatedTable);
            }
        }
        if (backbone == null) {
            diagnostics.warn(WarningReason.NO_BACKBONE, tableName, block.index(), null,
                "no backbone column produced rows; skipping block");
            return Optional.empty();
        }

        DataTable assembled = backbone;
        for (DataTable attribute : attributes.values()) {
            assembled = TableJoins.leftJoin(assembled, attribute, joinKeys);
        }

        Set<String> generatedColumns = new LinkedHashSet<>(backboneColumns);
        generatedColumns.addAll(attributes.keySet());
        fillRemaining(tableName, block, joinKeys, backboneColumns, generatedColumns, assembled);

        Map<String, String> labels = new LinkedHashMap<>();
        for (ColumnDefinition column : block.columns()) {
            assembled.putColumn(column.name(), ColumnTransforms.enforce(assembled.column(column.name()), column.effectiveType()));
            if (column.label() != null) {
                labels.put(column.name(), column.label());
            }
        }
        DataTable result = assembled.select(block.columnNames());
        result.putLabels(labels);
        log.debug("{} block {}: {} rows, {} backbone and {} attribute columns", tableName, block.index(), result.rowCount(),
            backboneColumns.size(), attributes.size());
        return Optional.of(result);
    }

    /**
     * Declared keys plus the form identifier, so rows from unrelated forms never join.
     */
    static List<String> joinKeys(List<String> declaredKeys) {
        List<String> keys = new ArrayList<>(declaredKeys);
        if (!keys.contains(FORM_KEY)) {
            keys.add(FORM_KEY);
        }
        return keys;
    }

    private static List<String> withItemKey(List<String> joinKeys) {
        List<String> keys = new ArrayList<>(joinKeys);
        keys.add(ITEM_KEY);
        return keys;
    }

    /**
     * Extracts the generated record subset and groups it by {@code groupKeys}, keeping the first non-null returned value per group.
     * Groups appear in first-seen record order.
     */
    DataTable generate(Block block, String targetName, ValueSource.Generated generated, RecordStore records, List<String> groupKeys) {
        RecordStore subset = switch (generated.function()) {
            case EXTRACT_VALUE -> records.filter(generatedFilter(block, generated));
        };
        ObservationField returned = classifier.returnedField(targetName, generated);
        List<ObservationField> keyFields = groupKeys.stream().map(k -> RecordStore.field(k).orElseThrow()).toList();

        Map<List<String>, String> groups = new LinkedHashMap<>();
        for (Observation observation : subset.observations()) {
            List<String> key = new ArrayList<>(keyFields.size());
            for (ObservationField field : keyFields) {
                key.add(field.valueOf(observation));
            }
            String value = returned.valueOf(observation);
            if (groups.get(key) == null) {
                groups.put(key, value);
            }
        }

        DataTable table = new DataTable(groups.size());
        List<List<String>> keys = new ArrayList<>(groups.keySet());
        for (int k = 0; k < groupKeys.size(); k++) {
            int position = k;
            table.putColumn(groupKeys.get(k), keys.stream().map(key -> (Object) key.get(position)).toList());
        }
        table.putColumn(targetName, new ArrayList<Object>(groups.values()));
        return table;
    }

    private static Predicate<Observation> generatedFilter(Block block, ValueSource.Generated generated) {
        Set<String> forms = Set.copyOf(generated.formOids().isEmpty() ? block.formOids() : generated.formOids());
        Set<String> items = Set.copyOf(generated.itemOids());
        return o -> (forms.isEmpty() || forms.contains(o.formOid())) && (items.isEmpty() || items.contains(o.itemOid()));
    }

    private void fillRemaining(
        String tableName, Block block, List<String> joinKeys, List<String> backboneColumns, Set<String> generatedColumns,
        DataTable table
    ) {
        int rows = table.rowCount();
        for (ColumnDefinition column : block.columns()) {
            String name = column.name();
            ValueSource source = column.source();
            boolean populated = generatedColumns.contains(name) && table.hasColumn(name);

            ValueSource.SourceReference copyFrom = null;
            if (source instanceof ValueSource.SourceReference reference) {
                copyFrom = reference;
            } else if (source instanceof ValueSource.Generated generated) {
                copyFrom = generated.override();
            }
            if (copyFrom != null) {
                String sourceColumn = copyFrom.columnName();
                if (table.hasColumn(sourceColumn)) {
                    if (!sourceColumn.equals(name)) {
                        table.putColumn(name, table.column(sourceColumn));
                    }
                    continue;
                }
                diagnostics.warn(WarningReason.MISSING_SOURCE_COLUMN, tableName, block.index(), name,
                    "source column '" + sourceColumn + "' not found" + (populated ? "; keeping generated values" : "; filling with nulls"));
            }
            if (populated) {
                continue;
            }

            if (source instanceof ValueSource.Literal literal) {
                table.putConstant(name, literal.value());
            } else if (source instanceof ValueSource.Unassigned) {
                Optional<List<Object>> builtin = builtinDefault(tableName, name, joinKeys, table);
                if (builtin.isPresent()) {
                    table.putColumn(name, builtin.get());
                } else {
                    if (column.sequence() == null) {
                        diagnostics.warn(WarningReason.NO_SOURCE_DECLARED, tableName, block.index(), name, "filling with nulls");
                    }
                    table.putNulls(name);
                }
            } else if (source instanceof ValueSource.MetadataLookup lookup) {
                table.putColumn(name, metadataValues(tableName, block.index(), name, lookup, backboneColumns, table));
            } else {
                table.putColumn(name, Collections.nCopies(rows, null));
            }
        }
    }

    /**
     * Study and subject identifiers from declared keys, the table's sequence placeholder from the repeat key, and the table name.
     */
    private static Optional<List<Object>> builtinDefault(String tableName, String columnName, List<String> joinKeys, DataTable table) {
        String sourceColumn = null;
        if (columnName.equals("STUDYID") && joinKeys.contains(ObservationField.STUDY_OID.columnName())) {
            sourceColumn = ObservationField.STUDY_OID.columnName();
        } else if (columnName.equals("USUBJID")) {
            if (table.hasColumn(ObservationField.STUDY_SUBJECT_ID.columnName())) {
                sourceColumn = ObservationField.STUDY_SUBJECT_ID.columnName();
            } else if (table.hasColumn(ObservationField.SUBJECT_KEY.columnName())) {
                sourceColumn = ObservationField.SUBJECT_KEY.columnName();
            }
        } else if (columnName.equals(tableName + "SEQ") && joinKeys.contains(ObservationField.ITEM_GROUP_REPEAT_KEY.columnName())) {
            sourceColumn = ObservationField.ITEM_GROUP_REPEAT_KEY.columnName();
        } else if (columnName.equals("DOMAIN")) {
            return Optional.of(Collections.nCopies(table.rowCount(), tableName));
        }
        if (sourceColumn == null || !table.hasColumn(sourceColumn)) {
            return Optional.empty();
        }
        return Optional.of(table.column(sourceColumn));
    }

    private List<Object> metadataValues(
        String tableName, int blockIndex, String columnName, ValueSource.MetadataLookup lookup, List<String> backboneColumns,
        DataTable table
    ) {
        String keyColumn = lookup.keyColumn();
        if (keyColumn == null) {
            keyColumn = backboneColumns.stream().filter(classifier::isTestCode).findFirst().orElse(null);
        }
        if (keyColumn == null || !table.hasColumn(keyColumn)) {
            diagnostics.warn(WarningReason.MISSING_METADATA_KEY, tableName, blockIndex, columnName,
                keyColumn == null ? "no backbone test-code column to look up" : "key column '" + keyColumn + "' not found");
            return Collections.nCopies(table.rowCount(), null);
        }
        List<Object> codes = table.column(keyColumn);
        List<Object> values = new ArrayList<>(codes.size());
        for (Object code : codes) {
            values.add(metadata.lookup(code, lookup.attribute()));
        }
        return values;
    }
}
