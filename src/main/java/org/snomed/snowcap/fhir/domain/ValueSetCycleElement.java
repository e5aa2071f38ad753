package org.snomed.snowcap.fhir.domain;

public record ValueSetCycleElement(boolean include, String valueSetUrl, String valueSetVersion) {

	public String getCanonicalUrlVersion() {
		if (valueSetUrl == null) {
			return "inline value set";
		}
		return valueSetVersion != null ? valueSetUrl + "|" + valueSetVersion : valueSetUrl;
	}
}
