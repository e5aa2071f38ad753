package org.snomed.snowcap.fhir.pojo;

import org.snomed.snowcap.fhir.domain.FHIRMapEquivalence;

/**
 * @param source canonical of the concept map, or maps joined by " > " for chained translations.
 */
public record TranslationMatch(String targetSystem, String targetCode, String targetDisplay, FHIRMapEquivalence equivalence, String source) {

	public TranslationMatch withDisplay(String display) {
		return new TranslationMatch(targetSystem, targetCode, display, equivalence, source);
	}
}
