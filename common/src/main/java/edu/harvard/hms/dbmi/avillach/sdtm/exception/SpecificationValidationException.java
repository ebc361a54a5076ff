package edu.harvard.hms.dbmi.avillach.sdtm.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised when a mapping specification cannot be turned into a typed model. Errors are grouped by table name so that a single load
 * reports every problem at once.
 */
public class SpecificationValidationException extends Exception {

	private static final long serialVersionUID = 4411806522935104417L;

	private final Map<String, List<String>> result;

	public SpecificationValidationException(Map<String, List<String>> result) {
		super(describe(result));
		this.result = result;
	}

	public Map<String, List<String>> getResult() {
		return result;
	}

	private static String describe(Map<String, List<String>> result) {
		StringBuilder sb = new StringBuilder("Invalid mapping specification:");
		result.forEach((table, errors) -> errors.forEach(e -> sb.append("\n  - ").append(table).append(": ").append(e)));
		return sb.toString();
	}
}
