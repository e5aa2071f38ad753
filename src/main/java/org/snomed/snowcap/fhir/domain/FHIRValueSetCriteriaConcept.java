package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ValueSet;

import java.util.Objects;

public class FHIRValueSetCriteriaConcept {

	private final String code;

	private final String display;

	public FHIRValueSetCriteriaConcept(String code, String display) {
		this.code = code;
		this.display = display;
	}

	public FHIRValueSetCriteriaConcept(ValueSet.ConceptReferenceComponent hapiConcept) {
		this(hapiConcept.getCode(), hapiConcept.getDisplay());
	}

	public ValueSet.ConceptReferenceComponent getHapi() {
		ValueSet.ConceptReferenceComponent component = new ValueSet.ConceptReferenceComponent();
		component.setCode(code);
		component.setDisplay(display);
		return component;
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FHIRValueSetCriteriaConcept that = (FHIRValueSetCriteriaConcept) o;
		return Objects.equals(code, that.code) && Objects.equals(display, that.display);
	}

	@Override
	public int hashCode() {
		return Objects.hash(code, display);
	}
}
