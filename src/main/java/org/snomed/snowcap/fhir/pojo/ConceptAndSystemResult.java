package org.snomed.snowcap.fhir.pojo;

import org.snomed.snowcap.fhir.domain.FHIRCodeSystemVersion;
import org.snomed.snowcap.fhir.domain.FHIRConcept;

import java.util.Collection;

public record ConceptAndSystemResult(FHIRConcept concept, FHIRCodeSystemVersion codeSystemVersion, Collection<String> children) {
}
