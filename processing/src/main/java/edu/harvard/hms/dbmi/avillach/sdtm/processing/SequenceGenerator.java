package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import com.google.common.collect.ComparisonChain;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.AssemblyDiagnostics;
import edu.harvard.hms.dbmi.avillach.sdtm.processing.diagnostics.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Numbers rows 1..n within each group, in (group, sort) order, and writes each row's rank back at its original position.
 */
public class SequenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceGenerator.class);

    /** Nulls last; numbers numerically; everything else by string form. */
    static final Comparator<Object> CELL_ORDER = Comparator.nullsLast(SequenceGenerator::compareCells);

    private final AssemblyDiagnostics diagnostics;

    public SequenceGenerator(AssemblyDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public DataTable apply(String tableName, DataTable table, List<SequenceRequest> requests) {
        for (SequenceRequest request : requests) {
            List<String> missingGroups = request.groupBy().stream().filter(c -> !table.hasColumn(c)).toList();
            if (!missingGroups.isEmpty()) {
                diagnostics.warn(WarningReason.MISSING_GROUP_COLUMN, tableName, null, request.targetColumn(),
                    "group columns " + missingGroups + " not found; sequence not generated");
                continue;
            }
            List<String> sortBy = request.sortBy();
            List<String> missingSorts = sortBy.stream().filter(c -> !table.hasColumn(c)).toList();
            if (!missingSorts.isEmpty()) {
                diagnostics.warn(WarningReason.MISSING_SORT_COLUMN, tableName, null, request.targetColumn(),
                    "sort columns " + missingSorts + " not found; using group order only");
                sortBy = List.of();
            }
            table.putColumn(request.targetColumn(), sequence(table, request.groupBy(), sortBy));
            log.debug("{}: generated {} grouped by {} sorted by {}", tableName, request.targetColumn(), request.groupBy(), sortBy);
        }
        return table;
    }

    /**
     * Rows with a null group cell get no number.
     */
    static List<Object> sequence(DataTable table, List<String> groupBy, List<String> sortBy) {
        int rows = table.rowCount();
        List<String> orderColumns = new ArrayList<>(groupBy);
        orderColumns.addAll(sortBy);

        // List.sort is stable, so ties keep their original row order
        List<Integer> order = new ArrayList<>(IntStream.range(0, rows).boxed().toList());
        order.sort((a, b) -> {
            for (String column : orderColumns) {
                int result = CELL_ORDER.compare(table.get(column, a), table.get(column, b));
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        });

        Object[] values = new Object[rows];
        Map<List<Object>, Long> counters = new HashMap<>();
        for (int row : order) {
            List<Object> group = new ArrayList<>(groupBy.size());
            for (String column : groupBy) {
                group.add(table.get(column, row));
            }
            if (group.contains(null)) {
                continue;
            }
            values[row] = counters.merge(group, 1L, Long::sum);
        }
        return Arrays.asList(values);
    }

    private static int compareCells(Object left, Object right) {
        BigDecimal leftNumber = asNumber(left);
        BigDecimal rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber);
        }
        return ComparisonChain.start()
            .compareFalseFirst(leftNumber == null, rightNumber == null)
            .compare(left.toString(), right.toString())
            .result();
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
