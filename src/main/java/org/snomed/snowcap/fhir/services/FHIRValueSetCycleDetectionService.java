package org.snomed.snowcap.fhir.services;

import org.snomed.snowcap.fhir.domain.FHIRValueSet;
import org.snomed.snowcap.fhir.domain.FHIRValueSetCriteria;
import org.snomed.snowcap.fhir.domain.ValueSetCycleElement;
import org.snomed.snowcap.fhir.exceptions.ValueSetCycleException;
import org.snomed.snowcap.fhir.services.context.ValueSetResolver;
import org.springframework.stereotype.Service;

import java.util.*;

import static java.lang.String.format;

@Service
public class FHIRValueSetCycleDetectionService {

	public void verifyNoCycles(FHIRValueSet valueSet, ValueSetResolver resolver) {
		List<ValueSetCycleElement> valueSetCycle = getValueSetIncludeExcludeCycle(valueSet, resolver);
		if (!valueSetCycle.isEmpty()) {
			throw new ValueSetCycleException(getCyclicDiagnosticMessage(valueSetCycle));
		}
	}

	/**
	 * @return the elements of the first cycle found, innermost first, or an empty list
	 */
	List<ValueSetCycleElement> getValueSetIncludeExcludeCycle(FHIRValueSet valueSet, ValueSetResolver resolver) {
		return getValueSetIncludeExcludeCycle(valueSet, resolver, new HashSet<>(), true);
	}

	private List<ValueSetCycleElement> getValueSetIncludeExcludeCycle(FHIRValueSet valueSet, ValueSetResolver resolver, Set<String> visited, boolean isIncluded) {
		if (valueSet.getCompose() == null) {
			return Collections.emptyList();
		}

		ValueSetCycleElement current = new ValueSetCycleElement(isIncluded, valueSet.getUrl(), valueSet.getVersion());
		String key = valueSet.getUrl() + "|" + valueSet.getVersion();
		if (!visited.add(key)) {
			// Cycle detected
			return new ArrayList<>(List.of(current));
		}

		var cycle = detectCycle(valueSet.getCompose().getInclude(), resolver, visited, true);
		if (cycle.isEmpty()) {
			cycle = detectCycle(valueSet.getCompose().getExclude(), resolver, visited, false);
		}
		if (!cycle.isEmpty()) {
			cycle.add(current);
			return cycle;
		}

		visited.remove(key);
		return Collections.emptyList();
	}

	private List<ValueSetCycleElement> detectCycle(List<FHIRValueSetCriteria> criteria, ValueSetResolver resolver, Set<String> visited, boolean isIncluded) {
		for (FHIRValueSetCriteria criterion : criteria) {
			for (String canonical : criterion.getValueSets()) {
				// Unknown value sets are reported by the expansion
				FHIRValueSet child = resolver.resolve(canonical);
				if (child != null) {
					var cycle = getValueSetIncludeExcludeCycle(child, resolver, visited, isIncluded);
					if (!cycle.isEmpty()) {
						return cycle;
					}
				}
			}
		}
		return new ArrayList<>();
	}

	public String getCyclicDiagnosticMessage(List<ValueSetCycleElement> valueSetCycle) {
		ValueSetCycleElement last = valueSetCycle.get(0);
		String lastConstraint = (last.include() ? "including " : "excluding ") + last.getCanonicalUrlVersion();
		StringBuilder parentPath = new StringBuilder();
		for (int i = 1; i < valueSetCycle.size(); i++) {
			parentPath.append(valueSetCycle.get(i).getCanonicalUrlVersion());
			if (i < valueSetCycle.size() - 1) {
				parentPath.append(", ");
			}
		}
		return format("Cyclic reference detected when %s via [%s]", lastConstraint, parentPath);
	}

}
