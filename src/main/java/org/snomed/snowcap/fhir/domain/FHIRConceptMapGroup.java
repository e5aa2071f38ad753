package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ConceptMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FHIRConceptMapGroup {

	private final String source;

	private final String sourceVersion;

	private final String target;

	private final String targetVersion;

	private final List<FHIRMapElement> element = new ArrayList<>();

	private FHIRConceptMapGroupUnmapped unmapped;

	public FHIRConceptMapGroup(String source, String target) {
		this.source = source;
		this.target = target;
		sourceVersion = null;
		targetVersion = null;
	}

	public FHIRConceptMapGroup(ConceptMap.ConceptMapGroupComponent hapiGroup) {
		source = hapiGroup.getSource();
		sourceVersion = hapiGroup.getSourceVersion();
		target = hapiGroup.getTarget();
		targetVersion = hapiGroup.getTargetVersion();
		for (ConceptMap.SourceElementComponent hapiElement : hapiGroup.getElement()) {
			element.add(new FHIRMapElement(hapiElement));
		}
		if (hapiGroup.hasUnmapped()) {
			unmapped = new FHIRConceptMapGroupUnmapped(hapiGroup.getUnmapped());
		}
	}

	public FHIRConceptMapGroup addElement(FHIRMapElement mapElement) {
		element.add(mapElement);
		return this;
	}

	public String getSource() {
		return source;
	}

	public String getSourceVersion() {
		return sourceVersion;
	}

	public String getTarget() {
		return target;
	}

	public String getTargetVersion() {
		return targetVersion;
	}

	public List<FHIRMapElement> getElement() {
		return Collections.unmodifiableList(element);
	}

	public FHIRConceptMapGroupUnmapped getUnmapped() {
		return unmapped;
	}

	public FHIRConceptMapGroup setUnmapped(FHIRConceptMapGroupUnmapped unmapped) {
		this.unmapped = unmapped;
		return this;
	}
}
