package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ConceptMap;

import java.util.Objects;

public class FHIRMapTarget {

	private final String code;

	private String display;

	private final FHIRMapEquivalence equivalence;

	public FHIRMapTarget(String code, FHIRMapEquivalence equivalence) {
		this.code = code;
		this.equivalence = equivalence;
	}

	public FHIRMapTarget(String code, String display, FHIRMapEquivalence equivalence) {
		this(code, equivalence);
		this.display = display;
	}

	public FHIRMapTarget(ConceptMap.TargetElementComponent hapiTarget) {
		code = hapiTarget.getCode();
		display = hapiTarget.getDisplay();
		// Equivalence is required by FHIR, a missing one is read as the loosest mapping grade
		FHIRMapEquivalence hapiEquivalence = FHIRMapEquivalence.fromHapi(hapiTarget.getEquivalence());
		equivalence = hapiEquivalence != null ? hapiEquivalence : FHIRMapEquivalence.relatedto;
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public FHIRMapEquivalence getEquivalence() {
		return equivalence;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FHIRMapTarget that = (FHIRMapTarget) o;
		return Objects.equals(code, that.code) && equivalence == that.equivalence;
	}

	@Override
	public int hashCode() {
		return Objects.hash(code, equivalence);
	}
}
