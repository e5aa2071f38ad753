package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.*;
import org.junit.jupiter.api.Test;
import org.snomed.snowcap.AbstractTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.INVARIANT;
import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.NOTSUPPORTED;
import static org.junit.jupiter.api.Assertions.*;
import static org.snomed.snowcap.TestTerminology.*;

class FHIRConceptMapProviderTest extends AbstractTest {

	@Autowired
	private FHIRConceptMapProvider conceptMapProvider;

	@Test
	void testTranslate() {
		Parameters parameters = conceptMapProvider.translate(null, null, new CodeType("A"), new UriType(SYS1), null, null, null, null, null);
		assertEquals("true", getPropertyString(parameters, "result"));
		List<Parameters.ParametersParameterComponent> matches = getParameters(parameters, "match");
		assertEquals(1, matches.size());
		Parameters.ParametersParameterComponent match = matches.get(0);
		assertEquals("equivalent", toString(getPart(match, "equivalence")));
		Coding concept = (Coding) getPart(match, "concept");
		assertEquals(SYS2, concept.getSystem());
		assertEquals("X", concept.getCode());
		assertEquals("Concept X", concept.getDisplay());
		assertEquals(MAP_SYS1_SYS2 + "|1", toString(getPart(match, "source")));
	}

	@Test
	void testTranslateUnmatched() {
		Parameters parameters = conceptMapProvider.translate(null, null, null, null, null, new Coding(SYS1, "C", null), null, null, null);
		assertEquals("false", getPropertyString(parameters, "result"));
		assertNotNull(getPropertyString(parameters, "message"));
		List<Parameters.ParametersParameterComponent> matches = getParameters(parameters, "match");
		assertEquals(1, matches.size());
		assertEquals("unmatched", toString(getPart(matches.get(0), "equivalence")));
		assertNull(getPart(matches.get(0), "concept"));

		parameters = conceptMapProvider.translate(null, null, new CodeType("Q"), new UriType(SYS3), null, null, null, null, null);
		assertEquals("false", getPropertyString(parameters, "result"));
		assertTrue(getParameters(parameters, "match").isEmpty());
	}

	@Test
	void testTranslateWithMapAndTarget() {
		Parameters parameters = conceptMapProvider.translate(new UriType(MAP_SYS1_SYS2), "1", new CodeType("B"), new UriType(SYS1), null, null, null,
				new UriType(SYS2), null);
		assertEquals("narrower", toString(getPart(getParameters(parameters, "match").get(0), "equivalence")));

		CodeableConcept codeableConcept = new CodeableConcept().addCoding(new Coding(SYS1, "A", null));
		parameters = conceptMapProvider.translate(null, null, null, null, null, null, codeableConcept, new UriType(SYS4), null);
		Parameters.ParametersParameterComponent chained = getParameters(parameters, "match").get(0);
		assertEquals("wider", toString(getPart(chained, "equivalence")));
		assertEquals("P", ((Coding) getPart(chained, "concept")).getCode());
		assertEquals(MAP_SYS1_SYS2 + "|1 > " + MAP_SYS2_SYS4 + "|1", toString(getPart(chained, "source")));
	}

	@Test
	void testReverseTranslate() {
		Parameters parameters = conceptMapProvider.translate(null, null, new CodeType("X"), new UriType(SYS2), null, null, null, null,
				new BooleanType(true));
		assertEquals("true", getPropertyString(parameters, "result"));
		Coding concept = (Coding) getPart(getParameters(parameters, "match").get(0), "concept");
		assertEquals(SYS1, concept.getSystem());
		assertEquals("A", concept.getCode());
	}

	@Test
	void testParameterErrors() {
		try {
			conceptMapProvider.translate(null, "1", new CodeType("A"), new UriType(SYS1), null, null, null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(INVARIANT, e.getIssueCode());
		}

		try {
			conceptMapProvider.translate(null, null, new CodeType("A"), null, null, null, null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(INVARIANT, e.getIssueCode());
		}

		CodeableConcept twoCodings = new CodeableConcept()
				.addCoding(new Coding(SYS1, "A", null))
				.addCoding(new Coding(SYS1, "B", null));
		try {
			conceptMapProvider.translate(null, null, null, null, null, null, twoCodings, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(NOTSUPPORTED, e.getIssueCode());
		}

		try {
			conceptMapProvider.translate(new UriType("http://example.org/fhir/ConceptMap/unknown"), null, new CodeType("A"), new UriType(SYS1), null,
					null, null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(404, e.getStatusCode());
		}
	}

}
