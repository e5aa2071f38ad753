package org.snomed.snowcap.fhir.pojo;

import java.util.List;
import java.util.Map;

/**
 * One page of an expansion.
 * @param total number of concepts in the expansion before paging, or before truncation when tooCostly is set
 * @param identifier derived from the compose and the parameters so that repeated expansions are identical
 * @param parameters the expansion parameters in effect, in a stable order
 */
public record ValueSetExpansion(String identifier, int total, int offset, boolean tooCostly, List<ExpansionContains> contains,
		Map<String, Object> parameters) {
}
