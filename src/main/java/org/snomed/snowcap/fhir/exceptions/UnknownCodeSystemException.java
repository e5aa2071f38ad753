package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

import static java.lang.String.format;

public class UnknownCodeSystemException extends SnowcapFHIRServerResponseException {

	private final String system;
	private final String version;

	public UnknownCodeSystemException(String system, String version) {
		this(version != null ?
						format("A definition for CodeSystem '%s' version '%s' could not be found.", system, version) :
						format("A definition for CodeSystem '%s' could not be found.", system),
				system, version);
	}

	private UnknownCodeSystemException(String message, String system, String version) {
		super(404, IssueType.NOTFOUND, message);
		this.system = system;
		this.version = version;
	}

	public String getSystem() {
		return system;
	}

	public String getVersion() {
		return version;
	}
}
