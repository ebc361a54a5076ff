package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static edu.harvard.hms.dbmi.avillach.sdtm.processing.ObservationFixtures.list;
import static org.junit.jupiter.api.Assertions.*;

public class TableJoinsTest {

    @Test
    public void leftJoin_broadcastsRightValueAcrossMatchingRows() {
        DataTable left = new DataTable(3)
            .putColumn("USUBJID", list("S1", "S1", "S2"))
            .putColumn("TESTCD", list("WEIGHT", "HEIGHT", "WEIGHT"));
        DataTable right = new DataTable(1)
            .putColumn("USUBJID", list("S1"))
            .putColumn("EVAL", list("INVESTIGATOR"));

        DataTable joined = TableJoins.leftJoin(left, right, List.of("USUBJID"));

        assertEquals(3, joined.rowCount());
        assertEquals(List.of("USUBJID", "TESTCD", "EVAL"), joined.columnNames());
        assertEquals(list("INVESTIGATOR", "INVESTIGATOR", null), joined.column("EVAL"));
    }

    @Test
    public void fullOuterJoin_appendsUnmatchedRightRows() {
        DataTable left = new DataTable(1)
            .putColumn("USUBJID", list("S1"))
            .putColumn("A", list("a1"));
        DataTable right = new DataTable(2)
            .putColumn("USUBJID", list("S2", "S1"))
            .putColumn("B", list("b2", "b1"));

        DataTable joined = TableJoins.fullOuterJoin(left, right, List.of("USUBJID"));

        assertEquals(list("S1", "S2"), joined.column("USUBJID"));
        assertEquals(list("a1", null), joined.column("A"));
        assertEquals(list("b1", "b2"), joined.column("B"));
    }

    @Test
    public void join_nullKeysMatchEachOther() {
        DataTable left = new DataTable(1).putColumn("K", list((Object) null)).putColumn("A", list("a"));
        DataTable right = new DataTable(1).putColumn("K", list((Object) null)).putColumn("B", list("b"));

        DataTable joined = TableJoins.fullOuterJoin(left, right, List.of("K"));

        assertEquals(1, joined.rowCount());
        assertEquals("b", joined.get("B", 0));
    }

    @Test
    public void join_sharedColumnsPreferLeftAndKeepLeftLabels() {
        DataTable left = new DataTable(2).putColumn("K", list("1", "2")).putColumn("V", list(null, "left"));
        left.putLabels(Map.of("V", "Value"));
        DataTable right = new DataTable(2).putColumn("K", list("1", "2")).putColumn("V", list("right1", "right2"));

        DataTable joined = TableJoins.leftJoin(left, right, List.of("K"));

        assertEquals(list("right1", "left"), joined.column("V"));
        assertEquals(Map.of("V", "Value"), joined.labels());
    }
}
