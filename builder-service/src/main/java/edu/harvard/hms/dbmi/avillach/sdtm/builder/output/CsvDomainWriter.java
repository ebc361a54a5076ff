package edu.harvard.hms.dbmi.avillach.sdtm.builder.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code <TABLE>.csv} with a header row in declared column order; null cells are written empty. Column labels, when the
 * table has any, go to {@code <TABLE>.labels.json} next to it.
 */
public class CsvDomainWriter implements DomainWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvDomainWriter.class);

    private final Path outputDir;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public CsvDomainWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path write(String tableName, DataTable table) throws IOException {
        Files.createDirectories(outputDir);
        Path csvFile = outputDir.resolve(tableName + ".csv");
        List<String> columns = table.columnNames();

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(new String[0]))
            .setNullString("")
            .build();
        try (BufferedWriter writer = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            List<Object> record = new ArrayList<>(columns.size());
            for (int row = 0; row < table.rowCount(); row++) {
                record.clear();
                for (String column : columns) {
                    record.add(table.get(column, row));
                }
                printer.printRecord(record);
            }
        }

        Path labelsFile = outputDir.resolve(tableName + ".labels.json");
        if (!table.labels().isEmpty()) {
            mapper.writeValue(labelsFile.toFile(), table.labels());
        } else {
            Files.deleteIfExists(labelsFile);
        }
        log.info("Wrote {} rows x {} columns to {}", table.rowCount(), columns.size(), csvFile);
        return csvFile;
    }
}
