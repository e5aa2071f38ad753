package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ConceptMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FHIRConceptMap {

	private final String url;

	private final String version;

	private final List<FHIRConceptMapGroup> group = new ArrayList<>();

	public FHIRConceptMap(String url, String version) {
		this.url = url;
		this.version = version;
	}

	public FHIRConceptMap(ConceptMap hapiConceptMap) {
		url = hapiConceptMap.getUrl();
		version = hapiConceptMap.getVersion();
		for (ConceptMap.ConceptMapGroupComponent hapiGroup : hapiConceptMap.getGroup()) {
			group.add(new FHIRConceptMapGroup(hapiGroup));
		}
	}

	public FHIRConceptMap addGroup(FHIRConceptMapGroup mapGroup) {
		group.add(mapGroup);
		return this;
	}

	public String getCanonical() {
		return version != null ? url + "|" + version : url;
	}

	public String getUrl() {
		return url;
	}

	public String getVersion() {
		return version;
	}

	public List<FHIRConceptMapGroup> getGroup() {
		return Collections.unmodifiableList(group);
	}
}
