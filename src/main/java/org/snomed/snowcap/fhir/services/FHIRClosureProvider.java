package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.rest.annotation.Operation;
import ca.uhn.fhir.rest.annotation.OperationParam;
import org.hl7.fhir.r4.model.*;
import org.snomed.snowcap.fhir.pojo.ClosureUpdate;
import org.snomed.snowcap.fhir.pojo.SystemCode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.*;

/**
 * System level $closure operation.
 * With only a name the table is initialised, with concepts the new rows are returned,
 * with a version all rows added since that version are returned.
 */
@Component
public class FHIRClosureProvider {

	@Autowired
	private FHIRClosureService closureService;

	@Autowired
	private HapiConceptMapMapper conceptMapMapper;

	@Operation(name = "$closure")
	public ConceptMap closure(
			@OperationParam(name = "name") StringType name,
			@OperationParam(name = "concept") List<Coding> concepts,
			@OperationParam(name = "version") StringType version) {

		required("name", name);
		String closureName = name.getValue();
		if (version != null) {
			mutuallyExclusive("concept", concepts != null && !concepts.isEmpty() ? concepts : null, "version", version);
			int sinceVersion;
			try {
				sinceVersion = Integer.parseInt(version.getValue());
			} catch (NumberFormatException e) {
				throw exception(format("Closure version '%s' is not a number.", version.getValue()), OperationOutcome.IssueType.INVALID, 400, e);
			}
			return conceptMapMapper.mapClosureToFHIR(closureService.getRowsSince(closureName, sinceVersion));
		}

		if (concepts == null || concepts.isEmpty()) {
			int tableVersion = closureService.initialise(closureName);
			return conceptMapMapper.mapClosureToFHIR(new ClosureUpdate(closureName, tableVersion, List.of()));
		}

		List<SystemCode> codes = new ArrayList<>();
		for (Coding coding : concepts) {
			if (coding.getSystem() == null || coding.getCode() == null) {
				throw exception("Each closure concept must have a system and a code.", OperationOutcome.IssueType.INVARIANT, 400);
			}
			codes.add(SystemCode.fromCoding(coding));
		}
		return conceptMapMapper.mapClosureToFHIR(closureService.updateClosure(closureName, codes));
	}
}
