package edu.harvard.hms.dbmi.avillach.sdtm.data.record;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The flat record schema. Column names are the ones used by mapping specifications in {@code keys}, {@code source} and
 * {@code group} entries.
 */
public enum ObservationField {
    STUDY_OID("StudyOID", Observation::studyOid),
    SUBJECT_KEY("SubjectKey", Observation::subjectKey),
    STUDY_SUBJECT_ID("StudySubjectID", Observation::studySubjectId),
    STUDY_EVENT_OID("StudyEventOID", Observation::studyEventOid),
    FORM_OID("FormOID", Observation::formOid),
    ITEM_GROUP_OID("ItemGroupOID", Observation::itemGroupOid),
    ITEM_GROUP_REPEAT_KEY("ItemGroupRepeatKey", Observation::itemGroupRepeatKey),
    ITEM_OID("ItemOID", Observation::itemOid),
    VALUE("Value", Observation::value);

    private static final Map<String, ObservationField> BY_COLUMN =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(ObservationField::columnName, Function.identity()));

    private final String columnName;
    private final Function<Observation, String> accessor;

    ObservationField(String columnName, Function<Observation, String> accessor) {
        this.columnName = columnName;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

    public String valueOf(Observation observation) {
        return accessor.apply(observation);
    }

    public static Optional<ObservationField> byColumnName(String columnName) {
        return Optional.ofNullable(BY_COLUMN.get(columnName));
    }
}
