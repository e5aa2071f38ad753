package org.snomed.snowcap.fhir.pojo;

import org.snomed.snowcap.fhir.domain.FHIRMapEquivalence;

/**
 * Closure table row read as "concept2 {equivalence} concept1". For subsumption rows concept1 is the more specific concept.
 */
public record ClosureRow(SystemCode concept1, SystemCode concept2, FHIRMapEquivalence equivalence) {
}
