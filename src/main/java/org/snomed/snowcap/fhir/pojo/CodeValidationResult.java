package org.snomed.snowcap.fhir.pojo;

/**
 * Outcome of a $validate-code. A code that is not found is a negative result, not an error.
 */
public record CodeValidationResult(boolean result, String system, String version, String code, String display, String message, Boolean inactive) {

	public static CodeValidationResult valid(String system, String version, String code, String display, boolean inactive) {
		return new CodeValidationResult(true, system, version, code, display, null, inactive);
	}

	public static CodeValidationResult invalid(String system, String version, String code, String display, String message) {
		return new CodeValidationResult(false, system, version, code, display, message, null);
	}
}
