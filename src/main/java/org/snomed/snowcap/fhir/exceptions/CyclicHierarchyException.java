package org.snomed.snowcap.fhir.exceptions;

import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.services.SnowcapFHIRServerResponseException;

import java.util.List;

import static java.lang.String.format;

public class CyclicHierarchyException extends SnowcapFHIRServerResponseException {

	private final List<String> cycle;

	public CyclicHierarchyException(String system, List<String> cycle) {
		super(400, IssueType.INVALID, format("Loop found in hierarchy of code system '%s': %s", system, String.join(" -> ", cycle)));
		this.cycle = List.copyOf(cycle);
	}

	/**
	 * @return codes on the loop, starting and ending with the same code.
	 */
	public List<String> getCycle() {
		return cycle;
	}
}
