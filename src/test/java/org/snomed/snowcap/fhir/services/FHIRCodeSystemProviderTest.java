package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.*;
import org.junit.jupiter.api.Test;
import org.snomed.snowcap.AbstractTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.INVARIANT;
import static org.hl7.fhir.r4.model.OperationOutcome.IssueType.NOTFOUND;
import static org.junit.jupiter.api.Assertions.*;
import static org.snomed.snowcap.TestTerminology.*;

class FHIRCodeSystemProviderTest extends AbstractTest {

	@Autowired
	private FHIRCodeSystemProvider codeSystemProvider;

	@Test
	void testLookup() {
		Parameters parameters = codeSystemProvider.lookup(new CodeType(FLU), new UriType(CLINICAL), null, null);
		assertEquals("Clinical", getPropertyString(parameters, "name"));
		assertEquals(CLINICAL, getPropertyString(parameters, "system"));
		assertEquals(CLINICAL_VERSION, getPropertyString(parameters, "version"));
		assertEquals("Influenza", getPropertyString(parameters, "display"));
		assertEquals("false", getPropertyString(parameters, "inactive"));
		assertEquals(VIRAL_INFECTION, getPropertyString(parameters, "parent"));
		assertEquals("moderate", getPropertyString(parameters, SEVERITY));
		assertEquals("2", getPropertyString(parameters, ONSET_DAYS));

		List<Parameters.ParametersParameterComponent> designations = getParameters(parameters, "designation");
		assertEquals(1, designations.size());
		assertEquals("en", toString(getPart(designations.get(0), "language")));
		assertEquals("Flu", toString(getPart(designations.get(0), "value")));
	}

	@Test
	void testLookupChildrenAndDefinition() {
		Parameters parameters = codeSystemProvider.lookup(null, null, new StringType(CLINICAL_VERSION), new Coding(CLINICAL, DISEASE, null));
		long children = getParameters(parameters, "property").stream()
				.filter(property -> "child".equals(toString(getPart(property, "code"))))
				.count();
		assertEquals(2, children);

		parameters = codeSystemProvider.lookup(new CodeType(FRACTURE), new UriType(CLINICAL), null, null);
		assertEquals("A break in a bone.", getPropertyString(parameters, "definition"));
	}

	@Test
	void testLookupErrors() {
		try {
			codeSystemProvider.lookup(new CodeType("unknown"), new UriType(CLINICAL), null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(NOTFOUND, e.getIssueCode());
			assertEquals(404, e.getStatusCode());
		}

		try {
			codeSystemProvider.lookup(null, null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(INVARIANT, e.getIssueCode());
		}

		try {
			codeSystemProvider.lookup(new CodeType(FLU), null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(INVARIANT, e.getIssueCode());
		}

		try {
			codeSystemProvider.lookup(new CodeType(FLU), new UriType("http://example.org/fhir/CodeSystem/unknown"), null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(404, e.getStatusCode());
		}
	}

	@Test
	void testValidateCode() {
		Parameters parameters = codeSystemProvider.validateCode(new UriType(CLINICAL), new CodeType(FLU), null, "Flu", null, null);
		assertEquals("true", getPropertyString(parameters, "result"));
		assertEquals("Influenza", getPropertyString(parameters, "display"));

		parameters = codeSystemProvider.validateCode(null, null, null, null, new Coding(CLINICAL, FLU, "Common cold"), null);
		assertEquals("false", getPropertyString(parameters, "result"));
		assertEquals("The code exists but the display is not valid", getPropertyString(parameters, "message"));

		parameters = codeSystemProvider.validateCode(new UriType(CLINICAL), new CodeType("unknown"), null, null, null, null);
		assertEquals("false", getPropertyString(parameters, "result"));
		assertNotNull(getPropertyString(parameters, "message"));

		parameters = codeSystemProvider.validateCode(new UriType(CLINICAL), new CodeType(OLD_FLU), null, null, null, null);
		assertEquals("true", getPropertyString(parameters, "result"));
		assertEquals("true", getPropertyString(parameters, "inactive"));
	}

	@Test
	void testValidateCodeAgainstValueSet() {
		ValueSet valueSet = new ValueSet();
		valueSet.getCompose().addInclude().setSystem(CLINICAL).addFilter()
				.setProperty("concept")
				.setOp(ValueSet.FilterOperator.ISA)
				.setValue(VIRAL_INFECTION);

		Parameters parameters = codeSystemProvider.validateCode(new UriType(CLINICAL), new CodeType(COLD), null, null, null, valueSet);
		assertEquals("true", getPropertyString(parameters, "result"));

		parameters = codeSystemProvider.validateCode(new UriType(CLINICAL), new CodeType(FRACTURE), null, null, null, valueSet);
		assertEquals("false", getPropertyString(parameters, "result"));
		assertEquals("Code 'fracture' is not in the value set", getPropertyString(parameters, "message"));
	}

	@Test
	void testSubsumes() {
		Parameters parameters = codeSystemProvider.subsumes(new CodeType(VIRAL_INFECTION), new CodeType(FLU), new UriType(CLINICAL), null, null, null);
		assertEquals("subsumes", getPropertyString(parameters, "outcome"));

		parameters = codeSystemProvider.subsumes(null, null, null, null, new Coding(CLINICAL, FLU, null), new Coding(CLINICAL, DISEASE, null));
		assertEquals("subsumed-by", getPropertyString(parameters, "outcome"));

		parameters = codeSystemProvider.subsumes(new CodeType(FLU), new CodeType(FLU), new UriType(CLINICAL), null, null, null);
		assertEquals("equivalent", getPropertyString(parameters, "outcome"));

		parameters = codeSystemProvider.subsumes(new CodeType(FLU), new CodeType(FRACTURE), new UriType(CLINICAL), null, null, null);
		assertEquals("not-subsumed", getPropertyString(parameters, "outcome"));

		try {
			codeSystemProvider.subsumes(null, null, null, null, new Coding(CLINICAL, FLU, null), new Coding(SYS1, "A", null));
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(INVARIANT, e.getIssueCode());
		}

		try {
			codeSystemProvider.subsumes(new CodeType(FLU), new CodeType("unknown"), new UriType(CLINICAL), null, null, null);
			fail(SHOULD_HAVE_THROWN_EXCEPTION_BEFORE_THIS_LINE);
		} catch (SnowcapFHIRServerResponseException e) {
			assertEquals(NOTFOUND, e.getIssueCode());
		}
	}

}
