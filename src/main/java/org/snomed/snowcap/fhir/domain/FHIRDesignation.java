package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CodeSystem;
import org.hl7.fhir.r4.model.Coding;

/**
 * Additional representation of a concept, optionally with a language and a use coding.
 */
public class FHIRDesignation {

	private final String language;
	private final Coding use;
	private final String value;

	public FHIRDesignation(String language, String value) {
		this(language, null, value);
	}

	public FHIRDesignation(String language, Coding use, String value) {
		this.language = language;
		this.use = use;
		this.value = value;
	}

	public FHIRDesignation(CodeSystem.ConceptDefinitionDesignationComponent hapiDesignation) {
		this(hapiDesignation.getLanguage(), hapiDesignation.hasUse() ? hapiDesignation.getUse().copy() : null, hapiDesignation.getValue());
	}

	public String getLanguage() {
		return language;
	}

	/**
	 * @return a copy of the use coding, or null
	 */
	public Coding getUseCoding() {
		return use != null ? use.copy() : null;
	}

	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		return language != null ? value + "@" + language : value;
	}
}
