package edu.harvard.hms.dbmi.avillach.sdtm.processing;

import edu.harvard.hms.dbmi.avillach.sdtm.data.spec.Block;

import java.util.List;

/**
 * A per-group row numbering request discovered while processing blocks.
 */
public record SequenceRequest(String targetColumn, List<String> groupBy, List<String> sortBy) {

    public SequenceRequest {
        groupBy = List.copyOf(groupBy);
        sortBy = List.copyOf(sortBy);
    }

    public static List<SequenceRequest> fromBlock(Block block) {
        return block.columns().stream()
            .filter(c -> c.sequence() != null && !c.sequence().groupBy().isEmpty())
            .map(c -> new SequenceRequest(c.name(), c.sequence().groupBy(), c.sequence().sortBy()))
            .toList();
    }
}
