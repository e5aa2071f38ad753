package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.ConceptMap;
import org.junit.jupiter.api.Test;
import org.snomed.snowcap.AbstractTest;
import org.snomed.snowcap.fhir.domain.*;
import org.snomed.snowcap.fhir.exceptions.OperationCancelledException;
import org.snomed.snowcap.fhir.pojo.TranslationMatch;
import org.snomed.snowcap.fhir.services.context.CancellationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.snomed.snowcap.TestTerminology.*;

class FHIRConceptMapServiceTest extends AbstractTest {

	@Test
	void testTranslate() {
		List<TranslationMatch> matches = conceptMapService.translate(SYS1, "A", null);
		assertEquals(1, matches.size());
		TranslationMatch match = matches.get(0);
		assertEquals(SYS2, match.targetSystem());
		assertEquals("X", match.targetCode());
		assertEquals(FHIRMapEquivalence.equivalent, match.equivalence());
		assertEquals(MAP_SYS1_SYS2 + "|1", match.source());
		// Display from the target code system
		assertEquals("Concept X", match.targetDisplay());

		assertEquals(FHIRMapEquivalence.narrower, conceptMapService.translate(SYS1, "B", SYS2).get(0).equivalence());
	}

	@Test
	void testNoMapping() {
		assertTrue(conceptMapService.translate(SYS3, "Q", null).isEmpty());
		assertTrue(conceptMapService.translate(SYS1, "D", null).isEmpty());
		assertTrue(conceptMapService.translate(SYS1, "A", SYS3).isEmpty());

		// An explicit statement that there is no mapping
		List<TranslationMatch> unmatched = conceptMapService.translate(SYS1, "C", null);
		assertEquals(1, unmatched.size());
		assertEquals(FHIRMapEquivalence.unmatched, unmatched.get(0).equivalence());
		assertNull(unmatched.get(0).targetCode());
	}

	@Test
	void testTranslateWithMapUrl() {
		assertEquals("X", conceptMapService.translate(MAP_SYS1_SYS2, SYS1, "A", null, null).get(0).targetCode());
		assertEquals("X", conceptMapService.translate(MAP_SYS1_SYS2 + "|1", SYS1, "A", null, null).get(0).targetCode());
		assertTrue(conceptMapService.translate(MAP_SYS2_SYS4, SYS1, "A", null, null).isEmpty());

		SnowcapFHIRServerResponseException exception = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				conceptMapService.translate("http://example.org/fhir/ConceptMap/unknown", SYS1, "A", null, null));
		assertEquals(404, exception.getStatusCode());
	}

	@Test
	void testChainedTranslation() {
		List<TranslationMatch> matches = conceptMapService.translate(SYS1, "A", SYS4);
		assertEquals(1, matches.size());
		TranslationMatch match = matches.get(0);
		assertEquals(SYS4, match.targetSystem());
		assertEquals("P", match.targetCode());
		assertEquals("Concept P", match.targetDisplay());
		// Weaker of equivalent and wider
		assertEquals(FHIRMapEquivalence.wider, match.equivalence());
		assertEquals(MAP_SYS1_SYS2 + "|1 > " + MAP_SYS2_SYS4 + "|1", match.source());

		// No second hop for Y
		assertTrue(conceptMapService.translate(SYS1, "B", SYS4).isEmpty());
	}

	@Test
	void testReverseTranslate() {
		List<TranslationMatch> matches = conceptMapService.reverseTranslate(null, SYS2, "X", null);
		assertEquals(1, matches.size());
		assertEquals(SYS1, matches.get(0).targetSystem());
		assertEquals("A", matches.get(0).targetCode());
		assertEquals("Concept A", matches.get(0).targetDisplay());
		assertEquals(FHIRMapEquivalence.equivalent, matches.get(0).equivalence());

		assertTrue(conceptMapService.reverseTranslate(null, SYS2, "X", SYS3).isEmpty());
		assertTrue(conceptMapService.reverseTranslate(null, SYS2, "Z", null).isEmpty());
	}

	@Test
	void testUnmappedProvided() {
		String url = "http://example.org/fhir/ConceptMap/provided";
		conceptMapService.load(new FHIRConceptMap(url, null)
				.addGroup(new FHIRConceptMapGroup(SYS1, SYS3)
						.setUnmapped(new FHIRConceptMapGroupUnmapped(FHIRConceptMapGroupUnmapped.Mode.provided))));

		List<TranslationMatch> matches = conceptMapService.translate(url, SYS1, "D", null, null);
		assertEquals(1, matches.size());
		assertEquals(SYS3, matches.get(0).targetSystem());
		assertEquals("D", matches.get(0).targetCode());
		assertEquals(FHIRMapEquivalence.equal, matches.get(0).equivalence());
	}

	@Test
	void testUnmappedOtherMap() {
		String url = "http://example.org/fhir/ConceptMap/other";
		conceptMapService.load(new FHIRConceptMap(url, "1")
				.addGroup(new FHIRConceptMapGroup(SYS1, SYS2)
						.addElement(new FHIRMapElement("E").addTarget("Z", FHIRMapEquivalence.inexact))
						.setUnmapped(FHIRConceptMapGroupUnmapped.otherMap(MAP_SYS1_SYS2))));

		assertEquals("Z", conceptMapService.translate(url, SYS1, "E", SYS2, null).get(0).targetCode());
		List<TranslationMatch> delegated = conceptMapService.translate(url, SYS1, "A", SYS2, null);
		assertEquals(1, delegated.size());
		assertEquals("X", delegated.get(0).targetCode());
		assertEquals(MAP_SYS1_SYS2 + "|1", delegated.get(0).source());
	}

	@Test
	void testLoadConceptMapResource() {
		codeSystemService.load(readResource(org.hl7.fhir.r4.model.CodeSystem.class, "/fhir/CodeSystem-body-site.json"));
		conceptMapService.load(readResource(ConceptMap.class, "/fhir/ConceptMap-body-site-to-sys2.json"));

		List<TranslationMatch> arm = conceptMapService.translate(BODY_SITE, "arm", SYS2);
		assertEquals(FHIRMapEquivalence.relatedto, arm.get(0).equivalence());
		assertEquals("X", arm.get(0).targetCode());

		// Fixed code for unmapped source codes
		List<TranslationMatch> leg = conceptMapService.translate(BODY_SITE, "leg", SYS2);
		assertEquals(1, leg.size());
		assertEquals("Z", leg.get(0).targetCode());
		assertEquals("Concept Z", leg.get(0).targetDisplay());
		assertEquals(FHIRMapEquivalence.inexact, leg.get(0).equivalence());

		// Element with an unmatched target is not unmapped
		List<TranslationMatch> head = conceptMapService.translate(BODY_SITE, "head", SYS2);
		assertEquals(1, head.size());
		assertEquals(FHIRMapEquivalence.unmatched, head.get(0).equivalence());

		// Display carried by the map's source element
		assertEquals("Arm", conceptMapService.reverseTranslate(BODY_SITE_MAP, SYS2, "X", null).get(0).targetDisplay());
	}

	@Test
	void testRegistry() {
		assertEquals(2, conceptMapService.findAll().size());
		assertTrue(conceptMapService.find(MAP_SYS1_SYS2).isPresent());
		assertTrue(conceptMapService.find(MAP_SYS1_SYS2 + "|2").isEmpty());
		assertTrue(conceptMapService.remove(MAP_SYS1_SYS2, "1"));
		assertTrue(conceptMapService.translate(SYS1, "A", null).isEmpty());

		FHIRConceptMap noTarget = new FHIRConceptMap("http://example.org/fhir/ConceptMap/invalid", null)
				.addGroup(new FHIRConceptMapGroup(SYS1, null));
		assertThrows(SnowcapFHIRServerResponseException.class, () -> conceptMapService.load(noTarget));
	}

	@Test
	void testValidate() {
		assertEquals(List.of(), conceptMapService.validate(MAP_SYS1_SYS2));
		assertEquals(List.of(), conceptMapService.validate(MAP_SYS2_SYS4 + "|1"));

		String url = "http://example.org/fhir/ConceptMap/broken";
		conceptMapService.load(new FHIRConceptMap(url, null)
				.addGroup(new FHIRConceptMapGroup(SYS1, SYS2)
						.addElement(new FHIRMapElement("A").addTarget(null, FHIRMapEquivalence.wider))
						.addElement(new FHIRMapElement("B").addTarget("Y", null))
						.addElement(new FHIRMapElement((String) null).addTarget("Z", FHIRMapEquivalence.equivalent))
						.addElement(new FHIRMapElement("C").addTarget(null, FHIRMapEquivalence.unmatched)))
				.addGroup(new FHIRConceptMapGroup(SYS1, SYS3))
				.addGroup(new FHIRConceptMapGroup(SYS1, SYS4)
						.setUnmapped(FHIRConceptMapGroupUnmapped.otherMap("http://example.org/fhir/ConceptMap/missing")))
				.addGroup(new FHIRConceptMapGroup(SYS2, SYS3)
						.setUnmapped(FHIRConceptMapGroupUnmapped.fixed(null, null))));

		assertEquals(List.of(
				"group[0].element[0].target[0] has no code, one is required for equivalence 'wider'.",
				"group[0].element[1].target[0] has no equivalence.",
				"group[0].element[2] has no code.",
				"group[1] has no elements.",
				"group[2].unmapped references concept map 'http://example.org/fhir/ConceptMap/missing' which is not loaded.",
				"group[3].unmapped has mode 'fixed' but no code."
		), conceptMapService.validate(url));

		assertEquals(List.of("Concept map has no groups."),
				conceptMapService.validate(loadEmptyMap("http://example.org/fhir/ConceptMap/empty")));

		SnowcapFHIRServerResponseException exception = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				conceptMapService.validate("http://example.org/fhir/ConceptMap/unknown"));
		assertEquals(404, exception.getStatusCode());
	}

	private String loadEmptyMap(String url) {
		conceptMapService.load(new FHIRConceptMap(url, null));
		return url;
	}

	@Test
	void testCancellation() {
		CancellationContext cancellation = CancellationContext.create();
		cancellation.cancel();
		assertThrows(OperationCancelledException.class, () -> conceptMapService.translate(null, SYS1, "A", null, cancellation));
	}

}
