package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

public class ValueSetCycleException extends SnowcapFHIRServerResponseException {

	public ValueSetCycleException(String message) {
		super(400, IssueType.PROCESSING, message);
	}
}
