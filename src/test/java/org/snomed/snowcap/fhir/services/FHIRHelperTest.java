package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.OperationOutcome;
import org.junit.jupiter.api.Test;

import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.*;
import static org.junit.jupiter.api.Assertions.*;

class FHIRHelperTest {

	@Test
	void testException() {
		SnowcapFHIRServerResponseException exception = FHIRHelper.exception("Not here.", NOTFOUND, 404);
		assertEquals(404, exception.getStatusCode());
		assertEquals(NOTFOUND, exception.getIssueCode());
		OperationOutcome.OperationOutcomeIssueComponent issue = exception.getOperationOutcome().getIssueFirstRep();
		assertEquals(OperationOutcome.IssueSeverity.ERROR, issue.getSeverity());
		assertEquals("Not here.", issue.getDiagnostics());
	}

	@Test
	void testRequireExactlyOneOf() {
		FHIRHelper.requireExactlyOneOf("code", "a", "coding", null);
		SnowcapFHIRServerResponseException none = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				FHIRHelper.requireExactlyOneOf("code", null, "coding", null, "codeableConcept", null));
		assertEquals("One of 'code', 'coding' or 'codeableConcept' parameters must be supplied.", none.getMessage());
		SnowcapFHIRServerResponseException both = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				FHIRHelper.requireExactlyOneOf("code", "a", "coding", null, "codeableConcept", "b"));
		assertEquals(INVARIANT, both.getIssueCode());
	}

	@Test
	void testMutuallyRequired() {
		FHIRHelper.mutuallyRequired("code", null, "system", null);
		FHIRHelper.mutuallyRequired("code", "a", "system", "b");
		assertThrows(SnowcapFHIRServerResponseException.class, () -> FHIRHelper.mutuallyRequired("code", "a", "system", null));
	}

	@Test
	void testRequired() {
		FHIRHelper.required("name", "closure");
		SnowcapFHIRServerResponseException exception = assertThrows(SnowcapFHIRServerResponseException.class, () ->
				FHIRHelper.required("name", null));
		assertEquals(INVARIANT, exception.getIssueCode());
		assertEquals("Parameter 'name' must be supplied", exception.getMessage());
		assertEquals("Parameter 'name' must be supplied", exception.getDiagnostics());

		assertThrows(SnowcapFHIRServerResponseException.class, () -> FHIRHelper.required("name", "  "));
	}

}
