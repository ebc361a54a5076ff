package edu.harvard.hms.dbmi.avillach.sdtm.data.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DataTableTest {

    @Test
    void shouldConcatInFirstDeclaredColumnOrder() {
        DataTable first = new DataTable(2).putColumn("A", List.of("a1", "a2")).putColumn("B", List.of("b1", "b2"));
        DataTable second = new DataTable(1).putColumn("C", List.of("c1")).putColumn("A", List.of("a3"));
        second.putLabels(Map.of("C", "Column C"));

        DataTable combined = DataTable.concat(List.of(first, second));

        assertEquals(3, combined.rowCount());
        assertEquals(List.of("A", "B", "C"), combined.columnNames());
        assertEquals(List.of("a1", "a2", "a3"), combined.column("A"));
        assertEquals(Arrays.asList("b1", "b2", null), combined.column("B"));
        assertEquals(Arrays.asList(null, null, "c1"), combined.column("C"));
        assertEquals("Column C", combined.labels().get("C"));
    }

    @Test
    void shouldRejectColumnOfWrongLength() {
        DataTable table = new DataTable(2);
        assertThrows(IllegalArgumentException.class, () -> table.putColumn("A", List.of("only one")));
    }

    @Test
    void shouldKeepPositionWhenReplacingColumn() {
        DataTable table = new DataTable(1).putConstant("A", "x").putConstant("B", "y");
        table.putConstant("A", "z");

        assertEquals(List.of("A", "B"), table.columnNames());
        assertEquals("z", table.get("A", 0));
    }

    @Test
    void shouldSelectDeclaredColumnsOnly() {
        DataTable table = new DataTable(1).putConstant("ItemOID", "I1").putConstant("TESTCD", "WEIGHT");
        table.putLabels(Map.of("TESTCD", "Test Code", "ItemOID", "internal"));

        DataTable selected = table.select(List.of("TESTCD", "MISSING"));

        assertEquals(List.of("TESTCD"), selected.columnNames());
        assertEquals(Map.of("TESTCD", "Test Code"), selected.labels());
    }
}
