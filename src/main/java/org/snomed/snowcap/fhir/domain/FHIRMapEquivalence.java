package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.Enumerations;

/**
 * Concept map equivalence, declared from most to least precise.
 */
public enum FHIRMapEquivalence {

	equivalent("equivalent"),
	equal("equal"),
	wider("wider"),
	subsumes("subsumes"),
	narrower("narrower"),
	specializes("specializes"),
	relatedto("relatedto"),
	inexact("inexact"),
	unmatched("unmatched"),
	disjoint("disjoint");

	private final String code;

	FHIRMapEquivalence(String code) {
		this.code = code;
	}

	public static FHIRMapEquivalence fromCode(String code) {
		if (code == null) {
			return null;
		}
		if ("related-to".equals(code)) {
			return relatedto;
		}
		for (FHIRMapEquivalence value : values()) {
			if (value.code.equals(code)) {
				return value;
			}
		}
		throw new IllegalArgumentException("Unknown concept map equivalence '" + code + "'");
	}

	public static FHIRMapEquivalence fromHapi(Enumerations.ConceptMapEquivalence hapiEquivalence) {
		return hapiEquivalence != null && hapiEquivalence != Enumerations.ConceptMapEquivalence.NULL ? fromCode(hapiEquivalence.toCode()) : null;
	}

	public Enumerations.ConceptMapEquivalence toHapi() {
		return Enumerations.ConceptMapEquivalence.fromCode(code);
	}

	/**
	 * The less precise of the two. Used when composing the hops of a chained translation.
	 */
	public FHIRMapEquivalence weaker(FHIRMapEquivalence other) {
		return other != null && other.ordinal() > ordinal() ? other : this;
	}

	/**
	 * Whether a target with this equivalence is an actual mapping rather than a statement that none exists.
	 */
	public boolean isMapping() {
		return this != unmatched && this != disjoint;
	}

	public String getCode() {
		return code;
	}
}
