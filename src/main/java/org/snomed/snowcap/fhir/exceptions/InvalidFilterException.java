package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.domain.FHIRValueSetFilter;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

import static java.lang.String.format;

public class InvalidFilterException extends SnowcapFHIRServerResponseException {

	private final FHIRValueSetFilter filter;

	public InvalidFilterException(FHIRValueSetFilter filter, String system, String reason) {
		this(format("Invalid filter '%s' for code system '%s': %s", filter, system, reason), filter, (Throwable) null);
	}

	public InvalidFilterException(FHIRValueSetFilter filter, String system, String reason, Throwable cause) {
		this(format("Invalid filter '%s' for code system '%s': %s", filter, system, reason), filter, cause);
	}

	private InvalidFilterException(String message, FHIRValueSetFilter filter, Throwable cause) {
		super(400, IssueType.INVALID, message, cause);
		this.filter = filter;
	}

	public FHIRValueSetFilter getFilter() {
		return filter;
	}
}
