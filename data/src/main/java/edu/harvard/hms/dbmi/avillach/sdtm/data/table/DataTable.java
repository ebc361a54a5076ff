package edu.harvard.hms.dbmi.avillach.sdtm.data.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented table of nullable cells. Column order is insertion order. Cell values are {@link String}, {@link Long},
 * {@link Double}, {@link Boolean} or {@code null}.
 *
 * <p>Display labels travel with the table as metadata and are not row data.</p>
 */
public class DataTable {

    private final int rowCount;
    private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
    private final LinkedHashMap<String, String> labels = new LinkedHashMap<>();

    public DataTable(int rowCount) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative: " + rowCount);
        }
        this.rowCount = rowCount;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @return an unmodifiable view, or {@code null} if the column does not exist
     */
    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        return values == null ? null : Collections.unmodifiableList(values);
    }

    public Object get(String column, int row) {
        List<Object> values = columns.get(column);
        if (values == null) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        return values.get(row);
    }

    /**
     * Adds or replaces a column. A replaced column keeps its position.
     */
    public DataTable putColumn(String name, List<?> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException(
                "Column " + name + " has " + values.size() + " values but the table has " + rowCount + " rows"
            );
        }
        columns.put(name, new ArrayList<>(values));
        return this;
    }

    public DataTable putConstant(String name, Object value) {
        return putColumn(name, Collections.nCopies(rowCount, value));
    }

    public DataTable putNulls(String name) {
        return putConstant(name, null);
    }

    public void removeColumn(String name) {
        columns.remove(name);
    }

    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        columns.forEach((name, values) -> row.put(name, values.get(index)));
        return row;
    }

    public Map<String, String> labels() {
        return Collections.unmodifiableMap(labels);
    }

    public void putLabels(Map<String, String> newLabels) {
        labels.putAll(newLabels);
    }

    /**
     * Returns a new table with only the named columns, in the given order. Names that do not exist are ignored.
     */
    public DataTable select(List<String> names) {
        DataTable selected = new DataTable(rowCount);
        for (String name : names) {
            if (columns.containsKey(name)) {
                selected.columns.put(name, new ArrayList<>(columns.get(name)));
            }
        }
        labels.forEach((column, label) -> {
            if (selected.hasColumn(column)) {
                selected.labels.put(column, label);
            }
        });
        return selected;
    }

    /**
     * Stacks tables vertically. Columns appear in first-declared order across the inputs and are null-filled where an input
     * lacks them.
     */
    public static DataTable concat(List<DataTable> tables) {
        Set<String> names = new LinkedHashSet<>();
        int total = 0;
        for (DataTable table : tables) {
            names.addAll(table.columns.keySet());
            total += table.rowCount;
        }
        DataTable combined = new DataTable(total);
        for (String name : names) {
            List<Object> values = new ArrayList<>(total);
            for (DataTable table : tables) {
                List<Object> source = table.columns.get(name);
                if (source == null) {
                    values.addAll(Collections.nCopies(table.rowCount, null));
                } else {
                    values.addAll(source);
                }
            }
            combined.columns.put(name, values);
        }
        tables.forEach(t -> t.labels.forEach(combined.labels::putIfAbsent));
        return combined;
    }

    @Override
    public String toString() {
        return "DataTable[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
    }
}
