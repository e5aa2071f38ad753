package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.OperationOutcome;
import org.snomed.snowcap.fhir.domain.*;

import java.util.*;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Lookup structures of one loaded concept map: source code to targets and, inverted, target code to sources.
 * Built once when the map is loaded and read only afterwards.
 */
public class FHIRConceptMapIndex {

	/**
	 * One target of a source code, or one source of a target code in the inverted table.
	 */
	public record MapEntry(String system, String version, String code, String display, FHIRMapEquivalence equivalence) {
	}

	private final FHIRConceptMap conceptMap;

	// System -> code -> entries
	private final Map<String, Map<String, List<MapEntry>>> forward = new HashMap<>();

	private final Map<String, Map<String, List<MapEntry>>> inverse = new HashMap<>();

	public FHIRConceptMapIndex(FHIRConceptMap conceptMap) {
		this.conceptMap = conceptMap;
		for (FHIRConceptMapGroup group : conceptMap.getGroup()) {
			if (group.getSource() == null || group.getTarget() == null) {
				throw exception(format("Each group of concept map '%s' must declare a source and a target system.", conceptMap.getCanonical()),
						OperationOutcome.IssueType.INVALID, 400);
			}
			for (FHIRMapElement element : group.getElement()) {
				List<MapEntry> targets = forward.computeIfAbsent(group.getSource(), s -> new HashMap<>())
						.computeIfAbsent(element.getCode(), c -> new ArrayList<>());
				for (FHIRMapTarget target : element.getTarget()) {
					targets.add(new MapEntry(group.getTarget(), group.getTargetVersion(), target.getCode(), target.getDisplay(), target.getEquivalence()));
					if (target.getCode() != null) {
						inverse.computeIfAbsent(group.getTarget(), s -> new HashMap<>())
								.computeIfAbsent(target.getCode(), c -> new ArrayList<>())
								.add(new MapEntry(group.getSource(), group.getSourceVersion(), element.getCode(), element.getDisplay(), target.getEquivalence()));
					}
				}
			}
		}
	}

	/**
	 * @return null when the map has no element for the code, which is different from an element with no targets
	 */
	public List<MapEntry> getTargets(String sourceSystem, String sourceCode) {
		return forward.getOrDefault(sourceSystem, Collections.emptyMap()).get(sourceCode);
	}

	public List<MapEntry> getSources(String targetSystem, String targetCode) {
		return inverse.getOrDefault(targetSystem, Collections.emptyMap()).getOrDefault(targetCode, Collections.emptyList());
	}

	public FHIRConceptMap getConceptMap() {
		return conceptMap;
	}

	public String getCanonical() {
		return conceptMap.getCanonical();
	}
}
