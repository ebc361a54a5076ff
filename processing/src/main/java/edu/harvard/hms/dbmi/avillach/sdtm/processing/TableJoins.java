package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Equality joins on a list of key columns. Null key cells match other null key cells. Output rows follow the left table's order;
 * a full outer join appends unmatched right rows afterwards in their own order.
 *
 * <p>Non-key columns present on both sides are coalesced, preferring the left value.</p>
 */
public final class TableJoins {

    private TableJoins() {
    }

    public static DataTable leftJoin(DataTable left, DataTable right, List<String> keys) {
        return join(left, right, keys, false);
    }

    public static DataTable fullOuterJoin(DataTable left, DataTable right, List<String> keys) {
        return join(left, right, keys, true);
    }

    private static DataTable join(DataTable left, DataTable right, List<String> keys, boolean keepUnmatchedRight) {
        Map<List<Object>, List<Integer>> rightIndex = new LinkedHashMap<>();
        for (int r = 0; r < right.rowCount(); r++) {
            rightIndex.computeIfAbsent(keyOf(right, keys, r), k -> new ArrayList<>()).add(r);
        }

        List<int[]> pairs = new ArrayList<>();
        BitSet matchedRight = new BitSet(right.rowCount());
        for (int l = 0; l < left.rowCount(); l++) {
            List<Integer> matches = rightIndex.get(keyOf(left, keys, l));
            if (matches == null) {
                pairs.add(new int[] {l, -1});
            } else {
                for (int r : matches) {
                    pairs.add(new int[] {l, r});
                    matchedRight.set(r);
                }
            }
        }
        if (keepUnmatchedRight) {
            for (int r = 0; r < right.rowCount(); r++) {
                if (!matchedRight.get(r)) {
                    pairs.add(new int[] {-1, r});
                }
            }
        }

        Set<String> columns = new LinkedHashSet<>(left.columnNames());
        columns.addAll(right.columnNames());
        DataTable joined = new DataTable(pairs.size());
        for (String column : columns) {
            boolean inLeft = left.hasColumn(column);
            boolean inRight = right.hasColumn(column);
            List<Object> values = new ArrayList<>(pairs.size());
            for (int[] pair : pairs) {
                Object value = inLeft && pair[0] >= 0 ? left.get(column, pair[0]) : null;
                if (value == null && inRight && pair[1] >= 0) {
                    value = right.get(column, pair[1]);
                }
                values.add(value);
            }
            joined.putColumn(column, values);
        }
        joined.putLabels(left.labels());
        return joined;
    }

    private static List<Object> keyOf(DataTable table, List<String> keys, int row) {
        Object[] key = new Object[keys.size()];
        for (int i = 0; i < key.length; i++) {
            key[i] = table.get(keys.get(i), row);
        }
        return Arrays.asList(key);
    }
}
