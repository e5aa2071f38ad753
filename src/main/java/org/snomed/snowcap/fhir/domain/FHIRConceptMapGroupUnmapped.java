package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ConceptMap;

/**
 * What a group offers for source codes it has no element for.
 */
public class FHIRConceptMapGroupUnmapped {

	public enum Mode {
		provided, fixed, other_map
	}

	private final Mode mode;

	private String code;

	private String display;

	private String url;

	public FHIRConceptMapGroupUnmapped(Mode mode) {
		this.mode = mode;
	}

	public FHIRConceptMapGroupUnmapped(ConceptMap.ConceptMapGroupUnmappedComponent hapiUnmapped) {
		ConceptMap.ConceptMapGroupUnmappedMode hapiMode = hapiUnmapped.hasMode() ? hapiUnmapped.getMode() : ConceptMap.ConceptMapGroupUnmappedMode.PROVIDED;
		switch (hapiMode) {
			case FIXED:
				mode = Mode.fixed;
				break;
			case OTHERMAP:
				mode = Mode.other_map;
				break;
			default:
				mode = Mode.provided;
		}
		code = hapiUnmapped.getCode();
		display = hapiUnmapped.getDisplay();
		url = hapiUnmapped.getUrl();
	}

	public static FHIRConceptMapGroupUnmapped fixed(String code, String display) {
		FHIRConceptMapGroupUnmapped unmapped = new FHIRConceptMapGroupUnmapped(Mode.fixed);
		unmapped.code = code;
		unmapped.display = display;
		return unmapped;
	}

	public static FHIRConceptMapGroupUnmapped otherMap(String url) {
		FHIRConceptMapGroupUnmapped unmapped = new FHIRConceptMapGroupUnmapped(Mode.other_map);
		unmapped.url = url;
		return unmapped;
	}

	public Mode getMode() {
		return mode;
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public String getUrl() {
		return url;
	}
}
