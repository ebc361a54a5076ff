package edu.harvard.hms.dbmi.avillach.sdtm.builder.output;

import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists one finished domain table. Must be safe to call concurrently for different tables.
 */
public interface DomainWriter {

    /**
     * @return the written data file
     */
    Path write(String tableName, DataTable table) throws IOException;
}
