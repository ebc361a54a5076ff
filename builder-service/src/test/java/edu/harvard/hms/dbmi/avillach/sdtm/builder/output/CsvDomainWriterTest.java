package edu.harvard.hms.dbmi.avillach.sdtm.builder.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CsvDomainWriterTest {

    @TempDir
    Path outputDir;

    @Test
    public void write_headerInColumnOrder_nullsAsEmptyCells() throws Exception {
        DataTable table = new DataTable(2)
            .putConstant("DOMAIN", "AE")
            .putColumn("AESEQ", List.of(1L, 2L))
            .putColumn("AETERM", Arrays.asList("Headache, mild", null));

        Path csv = new CsvDomainWriter(outputDir).write("AE", table);

        assertEquals(outputDir.resolve("AE.csv"), csv);
        assertEquals(List.of(
            "DOMAIN,AESEQ,AETERM",
            "AE,1,\"Headache, mild\"",
            "AE,2,"
        ), Files.readAllLines(csv));
        assertFalse(Files.exists(outputDir.resolve("AE.labels.json")));
    }

    @Test
    public void write_labelsNextToTable() throws Exception {
        DataTable table = new DataTable(1).putConstant("USUBJID", "S-1");
        table.putLabels(Map.of("USUBJID", "Unique Subject Identifier"));

        new CsvDomainWriter(outputDir).write("DM", table);

        Map<String, String> labels = new ObjectMapper().readValue(outputDir.resolve("DM.labels.json").toFile(),
            new TypeReference<Map<String, String>>() {
            });
        assertEquals(Map.of("USUBJID", "Unique Subject Identifier"), labels);
    }

    @Test
    public void write_overwritesPreviousRun() throws Exception {
        CsvDomainWriter writer = new CsvDomainWriter(outputDir);
        DataTable labelled = new DataTable(3).putConstant("X", "a");
        labelled.putLabels(Map.of("X", "Ex"));
        writer.write("T", labelled);

        writer.write("T", new DataTable(1).putConstant("X", "b"));

        assertEquals(List.of("X", "b"), Files.readAllLines(outputDir.resolve("T.csv")));
        assertFalse(Files.exists(outputDir.resolve("T.labels.json")));
    }
}
