package edu.harvard.hms.dbmi.avillach.sdtm.data.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Descriptive attributes of one test code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestMetadata(String test, String obj) {
}
