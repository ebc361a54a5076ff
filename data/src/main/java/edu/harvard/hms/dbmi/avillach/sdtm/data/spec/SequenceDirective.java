package edu.harvard.hms.dbmi.avillach.sdtm.data.spec;

import java.util.List;

/**
 * Declares that a column holds 1-based row numbers within groups.
 *
 * @param sortBy may be empty; original row order then decides
 */
public record SequenceDirective(List<String> groupBy, List<String> sortBy) {

    public SequenceDirective {
        groupBy = List.copyOf(groupBy);
        sortBy = List.copyOf(sortBy);
    }
}
