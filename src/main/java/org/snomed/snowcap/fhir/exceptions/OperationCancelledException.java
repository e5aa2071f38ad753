package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

public class OperationCancelledException extends SnowcapFHIRServerResponseException {

	public OperationCancelledException(String message) {
		super(408, IssueType.TIMEOUT, message);
	}
}
