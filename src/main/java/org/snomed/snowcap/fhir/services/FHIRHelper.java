package org.snomed.snowcap.fhir.services;

import org.apache.commons.lang3.StringUtils;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.config.FHIRConstants;

import static java.lang.String.format;

public class FHIRHelper implements FHIRConstants {

	private FHIRHelper() {
	}

	public static SnowcapFHIRServerResponseException exception(String message, IssueType issueType, int theStatusCode) {
		return exception(message, issueType, theStatusCode, null);
	}

	public static SnowcapFHIRServerResponseException exception(String message, IssueType issueType, int theStatusCode, Throwable e) {
		return new SnowcapFHIRServerResponseException(theStatusCode, issueType, message, e);
	}

	public static void requireExactlyOneOf(String param1Name, Object param1, String param2Name, Object param2) {
		if (param1 == null && param2 == null) {
			throw exception(format("One of '%s' or '%s' parameters must be supplied.", param1Name, param2Name), IssueType.INVARIANT, 400);
		} else {
			mutuallyExclusive(param1Name, param1, param2Name, param2);
		}
	}

	public static void requireExactlyOneOf(String param1Name, Object param1, String param2Name, Object param2, String param3Name, Object param3) {
		if (param1 == null && param2 == null && param3 == null) {
			throw exception(format("One of '%s', '%s' or '%s' parameters must be supplied.", param1Name, param2Name, param3Name), IssueType.INVARIANT, 400);
		} else {
			mutuallyExclusive(param1Name, param1, param2Name, param2);
			mutuallyExclusive(param1Name, param1, param3Name, param3);
			mutuallyExclusive(param2Name, param2, param3Name, param3);
		}
	}

	public static void mutuallyExclusive(String param1Name, Object param1, String param2Name, Object param2) {
		if (param1 != null && param2 != null) {
			throw exception(format("Use one of '%s' or '%s' parameters.", param1Name, param2Name), IssueType.INVARIANT, 400);
		}
	}

	public static void mutuallyRequired(String param1Name, Object param1, String param2Name, Object param2) {
		if (param1 != null && param2 == null) {
			throw exception(format("Input parameter '%s' can only be used in conjunction with parameter '%s'.",
					param1Name, param2Name), IssueType.INVARIANT, 400);
		}
	}

	// Blank strings count as missing
	public static void required(String param1Name, Object param1) {
		if (param1 == null || (param1 instanceof String && StringUtils.isBlank((String) param1))) {
			throw exception(format("Parameter '%s' must be supplied", param1Name), IssueType.INVARIANT, 400);
		}
	}
}
