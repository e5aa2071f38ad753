package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CodeType;

/**
 * Outcome of comparing code A with code B, coded as in the FHIR concept-subsumption-outcome value set.
 */
public enum SubsumesResult {

	equivalent,
	subsumes,
	subsumed_by,
	not_subsumed;

	/**
	 * @param aSubsumesB code B is a descendant of code A
	 * @param bSubsumesA code A is a descendant of code B
	 */
	public static SubsumesResult fromHierarchy(boolean aSubsumesB, boolean bSubsumesA) {
		if (aSubsumesB) {
			return subsumes;
		}
		return bSubsumesA ? subsumed_by : not_subsumed;
	}

	public CodeType toCodeType() {
		return new CodeType(name().replace('_', '-'));
	}
}
