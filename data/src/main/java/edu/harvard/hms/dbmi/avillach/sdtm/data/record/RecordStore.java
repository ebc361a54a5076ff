package edu.harvard.hms.dbmi.avillach.sdtm.data.record;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-only collection of observations shared by every table of a run. Filtering returns a new store and never touches this one.
 */
public final class RecordStore {

    private static final RecordStore EMPTY = new RecordStore(ImmutableList.of());

    private final ImmutableList<Observation> observations;

    private RecordStore(ImmutableList<Observation> observations) {
        this.observations = observations;
    }

    public static RecordStore of(Collection<Observation> observations) {
        return new RecordStore(ImmutableList.copyOf(observations));
    }

    public static RecordStore empty() {
        return EMPTY;
    }

    public List<Observation> observations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public RecordStore filter(Predicate<Observation> predicate) {
        return new RecordStore(observations.stream().filter(predicate).collect(ImmutableList.toImmutableList()));
    }

    /**
     * Whether the record schema has a column of this name.
     */
    public static boolean hasField(String columnName) {
        return ObservationField.byColumnName(columnName).isPresent();
    }

    public static Optional<ObservationField> field(String columnName) {
        return ObservationField.byColumnName(columnName);
    }
}
