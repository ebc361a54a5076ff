package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.table.DataTable;

import java.util.List;

/**
 * Output of the first pass over a table's blocks: partial tables in block order and the sequence requests the blocks declared.
 */
public record StrategyResult(List<DataTable> partialTables, List<SequenceRequest> sequenceRequests) {

    public StrategyResult {
        partialTables = List.copyOf(partialTables);
        sequenceRequests = List.copyOf(sequenceRequests);
    }
}
