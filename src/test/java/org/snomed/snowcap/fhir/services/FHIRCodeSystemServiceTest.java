package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.CodeSystem;
import org.junit.jupiter.api.Test;
import org.snomed.snowcap.AbstractTest;
import org.snomed.snowcap.fhir.domain.FHIRCodeSystemVersion;
import org.snomed.snowcap.fhir.domain.FHIRConcept;
import org.snomed.snowcap.fhir.domain.SubsumesResult;
import org.snomed.snowcap.fhir.exceptions.UnknownCodeSystemException;
import org.snomed.snowcap.fhir.pojo.CodeValidationResult;
import org.snomed.snowcap.fhir.pojo.ConceptAndSystemResult;

import java.util.List;
import java.util.Set;

import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.NOTFOUND;
import static org.junit.jupiter.api.Assertions.*;
import static org.snomed.snowcap.TestTerminology.*;

class FHIRCodeSystemServiceTest extends AbstractTest {

	@Test
	void testLookup() {
		ConceptAndSystemResult result = codeSystemService.lookup(CLINICAL, null, VIRAL_INFECTION).orElseThrow();
		assertEquals("Viral infection", result.concept().getDisplay());
		assertEquals(CLINICAL_VERSION, result.codeSystemVersion().getVersion());
		assertEquals(Set.of(FLU, COLD, OLD_FLU), Set.copyOf(result.children()));

		assertTrue(codeSystemService.lookup(CLINICAL, CLINICAL_VERSION, "unknown").isEmpty());
		try {
			codeSystemService.lookup("http://example.org/fhir/CodeSystem/unknown", null, FLU);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (UnknownCodeSystemException e) {
			assertEquals(404, e.getStatusCode());
			assertEquals(NOTFOUND, e.getIssueCode());
			assertTrue(e.getMessage().contains("http://example.org/fhir/CodeSystem/unknown"));
		}
	}

	@Test
	void testVersionResolution() {
		codeSystemService.load(new FHIRCodeSystemVersion(CLINICAL, "2025"), List.of(new FHIRConcept("covid", "COVID-19")));

		assertEquals("2025", codeSystemService.getIndex(CLINICAL, null).getCodeSystemVersion().getVersion());
		assertTrue(codeSystemService.getIndex(CLINICAL, null).contains("covid"));
		assertFalse(codeSystemService.getIndex(CLINICAL, CLINICAL_VERSION).contains("covid"));
		assertTrue(codeSystemService.findIndex(CLINICAL, "2023").isEmpty());

		assertTrue(codeSystemService.remove(CLINICAL, "2025"));
		assertEquals(CLINICAL_VERSION, codeSystemService.getIndex(CLINICAL, null).getCodeSystemVersion().getVersion());
		assertFalse(codeSystemService.remove(CLINICAL, "2025"));
	}

	@Test
	void testContentGeneration() {
		long generation = codeSystemService.getContentGeneration();
		codeSystemService.load(new FHIRCodeSystemVersion("http://example.org/fhir/CodeSystem/tmp", null), List.of(new FHIRConcept("a", "A")));
		assertTrue(codeSystemService.getContentGeneration() > generation);
	}

	@Test
	void testSubsumes() {
		assertEquals(SubsumesResult.subsumes, codeSystemService.subsumes(CLINICAL, null, DISEASE, FLU));
		assertEquals(SubsumesResult.subsumed_by, codeSystemService.subsumes(CLINICAL, null, FLU, DISEASE));
		assertEquals(SubsumesResult.equivalent, codeSystemService.subsumes(CLINICAL, null, FLU, FLU));
		assertEquals(SubsumesResult.not_subsumed, codeSystemService.subsumes(CLINICAL, null, FLU, COLD));

		SnowcapFHIRServerResponseException exception = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				codeSystemService.subsumes(CLINICAL, null, FLU, "unknown"));
		assertEquals(404, exception.getStatusCode());
	}

	@Test
	void testSubsumesGroupedByHierarchy() {
		FHIRCodeSystemVersion grouped = new FHIRCodeSystemVersion("http://example.org/fhir/CodeSystem/grouped", null);
		grouped.setHierarchyMeaning("grouped-by");
		codeSystemService.load(grouped, List.of(new FHIRConcept("group", "Group"), new FHIRConcept("member", "Member").addParent("group")));
		assertEquals(SubsumesResult.not_subsumed, codeSystemService.subsumes(grouped.getUrl(), null, "group", "member"));
	}

	@Test
	void testValidateCode() {
		CodeValidationResult valid = codeSystemService.validateCode(CLINICAL, null, FLU, null);
		assertTrue(valid.result());
		assertEquals("Influenza", valid.display());
		assertEquals(CLINICAL_VERSION, valid.version());
		assertFalse(valid.inactive());

		// Designation is an accepted display
		assertTrue(codeSystemService.validateCode(CLINICAL, null, FLU, "Flu").result());

		CodeValidationResult wrongDisplay = codeSystemService.validateCode(CLINICAL, null, FLU, "Cold");
		assertFalse(wrongDisplay.result());
		assertEquals("The code exists but the display is not valid", wrongDisplay.message());
		assertEquals("Influenza", wrongDisplay.display());

		CodeValidationResult unknownCode = codeSystemService.validateCode(CLINICAL, null, "unknown", null);
		assertFalse(unknownCode.result());
		assertEquals("Code 'unknown' not found in code system '" + CLINICAL + "|" + CLINICAL_VERSION + "'", unknownCode.message());

		assertFalse(codeSystemService.validateCode("http://example.org/fhir/CodeSystem/unknown", null, FLU, null).result());

		CodeValidationResult inactive = codeSystemService.validateCode(CLINICAL, null, OLD_FLU, null);
		assertTrue(inactive.result());
		assertTrue(inactive.inactive());
	}

	@Test
	void testLoadCodeSystemResource() {
		FHIRConceptIndex index = codeSystemService.load(readResource(CodeSystem.class, "/fhir/CodeSystem-body-site.json"));

		assertEquals("1.0.0", index.getCodeSystemVersion().getVersion());
		assertEquals("BodySite", index.getCodeSystemVersion().getName());
		assertEquals(7, index.size());

		// Nested concepts
		assertEquals(Set.of("limb", "body"), index.ancestorsOf("arm"));
		// Parent property
		assertTrue(index.isA("left-arm", "limb"));
		assertEquals(Set.of("left-arm"), index.descendantsOf("arm"));

		FHIRConcept arm = index.lookup("arm").orElseThrow();
		assertEquals("Upper limb.", arm.getDefinition());
		assertEquals("Oberarm", arm.getDesignations().get(0).getValue());
		assertEquals("left", index.lookup("left-arm").orElseThrow().getProperty("laterality").get(0).getValue());
		assertFalse(index.lookup("tail").orElseThrow().isActive());
		assertTrue(index.lookup("head").orElseThrow().isActive());
	}

}
