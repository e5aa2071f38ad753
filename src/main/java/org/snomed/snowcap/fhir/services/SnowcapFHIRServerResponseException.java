package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.rest.server.exceptions.BaseServerResponseException;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.hl7.fhir.r4.model.OperationOutcome.IssueSeverity;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;

/**
 * Terminology operation failure carrying an HTTP status and a single-issue OperationOutcome.
 */
public class SnowcapFHIRServerResponseException extends BaseServerResponseException {

	public SnowcapFHIRServerResponseException(int statusCode, IssueType issueType, String message) {
		this(statusCode, issueType, message, null);
	}

	public SnowcapFHIRServerResponseException(int statusCode, IssueType issueType, String message, Throwable cause) {
		super(statusCode, message, cause, singleIssue(issueType, message));
	}

	private static OperationOutcome singleIssue(IssueType issueType, String message) {
		OperationOutcome outcome = new OperationOutcome();
		outcome.addIssue()
				.setSeverity(IssueSeverity.ERROR)
				.setCode(issueType)
				.setDiagnostics(message);
		return outcome;
	}

	@Override
	public OperationOutcome getOperationOutcome() {
		return (OperationOutcome) super.getOperationOutcome();
	}

	public IssueType getIssueCode() {
		return getOperationOutcome().getIssueFirstRep().getCode();
	}

	public String getDiagnostics() {
		return getOperationOutcome().getIssueFirstRep().getDiagnostics();
	}
}
