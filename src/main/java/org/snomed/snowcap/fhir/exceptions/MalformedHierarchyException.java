package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

import static java.lang.String.format;

/**
 * A concept declares a parent code that is not part of the same code system version.
 */
public class MalformedHierarchyException extends SnowcapFHIRServerResponseException {

	private final String code;
	private final String missingParent;

	public MalformedHierarchyException(String system, String code, String missingParent) {
		super(400, IssueType.INVALID,
				format("Concept '%s' in code system '%s' declares parent '%s' which is not in the code system.", code, system, missingParent));
		this.code = code;
		this.missingParent = missingParent;
	}

	public String getCode() {
		return code;
	}

	public String getMissingParent() {
		return missingParent;
	}
}
