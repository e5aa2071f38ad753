package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ConceptMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FHIRMapElement {

	private final String code;

	private final String display;

	private final List<FHIRMapTarget> target = new ArrayList<>();

	public FHIRMapElement(String code) {
		this.code = code;
		display = null;
	}

	public FHIRMapElement(ConceptMap.SourceElementComponent hapiElement) {
		code = hapiElement.getCode();
		display = hapiElement.getDisplay();
		for (ConceptMap.TargetElementComponent hapiTarget : hapiElement.getTarget()) {
			target.add(new FHIRMapTarget(hapiTarget));
		}
	}

	public FHIRMapElement addTarget(FHIRMapTarget mapTarget) {
		target.add(mapTarget);
		return this;
	}

	public FHIRMapElement addTarget(String targetCode, FHIRMapEquivalence equivalence) {
		return addTarget(new FHIRMapTarget(targetCode, equivalence));
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public List<FHIRMapTarget> getTarget() {
		return Collections.unmodifiableList(target);
	}
}
