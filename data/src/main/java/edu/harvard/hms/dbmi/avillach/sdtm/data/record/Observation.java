package edu.harvard.hms.dbmi.avillach.sdtm.data.record;

/**
 * One captured data point with its full key path. Every field except {@code itemOid} may be null.
 */
public record Observation(
    String studyOid,
    String subjectKey,
    String studySubjectId,
    String studyEventOid,
    String formOid,
    String itemGroupOid,
    String itemGroupRepeatKey,
    String itemOid,
    String value
) {

    public String get(ObservationField field) {
        return field.valueOf(this);
    }
}
