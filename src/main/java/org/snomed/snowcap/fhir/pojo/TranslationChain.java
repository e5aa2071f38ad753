package org.snomed.snowcap.fhir.pojo;

/**
 * Translation route used when no map goes directly from the source system to the target system.
 */
public record TranslationChain(String sourceSystem, String intermediateSystem, String targetSystem) {
}
