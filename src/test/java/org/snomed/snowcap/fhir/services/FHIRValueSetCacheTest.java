package org.snomed.snowcap.fhir.services;

import org.junit.jupiter.api.Test;
import org.snomed.snowcap.AbstractTest;
import org.snomed.snowcap.fhir.domain.FHIRCodeSystemVersion;
import org.snomed.snowcap.fhir.domain.FHIRValueSet;
import org.snomed.snowcap.fhir.domain.FHIRValueSetCompose;
import org.snomed.snowcap.fhir.domain.FHIRValueSetCriteria;
import org.snomed.snowcap.fhir.exceptions.InvalidFilterException;
import org.snomed.snowcap.fhir.pojo.ExpansionContains;
import org.snomed.snowcap.fhir.pojo.ValueSetExpansion;
import org.snomed.snowcap.fhir.pojo.ValueSetExpansionParameters;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.snomed.snowcap.TestTerminology.*;

@TestPropertySource(properties = "fhir.terminology.expansion.cache-enabled=true")
class FHIRValueSetCacheTest extends AbstractTest {

	private static final String SYS1_VS = "http://example.org/fhir/ValueSet/sys1-all";
	private static final String BAD_FILTER_VS = "http://example.org/fhir/ValueSet/bad-filter";

	@Test
	void testRepeatedExpansionServedFromCache() {
		valueSetService.register(new FHIRValueSet(SYS1_VS, "1", new FHIRValueSetCompose().addInclude(new FHIRValueSetCriteria(SYS1))));

		ValueSetExpansion first = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());
		ValueSetExpansion second = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());
		assertSame(first, second);

		ValueSetExpansion otherPage = valueSetService.expand(SYS1_VS, new ValueSetExpansionParameters(1, 2, null));
		assertNotSame(first, otherPage);
		assertEquals(List.of("B", "C"), codes(otherPage));
	}

	@Test
	void testRegisterInvalidatesCache() {
		valueSetService.register(new FHIRValueSet(SYS1_VS, "1", new FHIRValueSetCompose().addInclude(new FHIRValueSetCriteria(SYS1))));
		ValueSetExpansion before = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());

		valueSetService.register(new FHIRValueSet(SYS1_VS, "1", new FHIRValueSetCompose()
				.addInclude(new FHIRValueSetCriteria(SYS1).addCode("A"))));
		ValueSetExpansion after = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());
		assertNotSame(before, after);
		assertEquals(List.of("A"), codes(after));
	}

	@Test
	void testCodeSystemLoadInvalidatesCache() {
		valueSetService.register(new FHIRValueSet(SYS1_VS, "1", new FHIRValueSetCompose().addInclude(new FHIRValueSetCriteria(SYS1))));
		ValueSetExpansion before = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());
		assertEquals(List.of("A", "B", "C", "D", "E"), codes(before));

		codeSystemService.load(new FHIRCodeSystemVersion(SYS1, null), flatConcepts("A", "B", "C", "D", "E", "F"));
		ValueSetExpansion after = valueSetService.expand(SYS1_VS, ValueSetExpansionParameters.defaults());
		assertNotSame(before, after);
		assertEquals(List.of("A", "B", "C", "D", "E", "F"), codes(after));
	}

	@Test
	void testInvalidFilterNotWrappedByCache() {
		valueSetService.register(new FHIRValueSet(BAD_FILTER_VS, null, new FHIRValueSetCompose()
				.addInclude(new FHIRValueSetCriteria(CLINICAL).addFilter("colour", "=", "red"))));

		InvalidFilterException exception = assertThrows(InvalidFilterException.class, () ->
				valueSetService.expand(BAD_FILTER_VS, ValueSetExpansionParameters.defaults()));
		assertEquals("colour", exception.getFilter().getProperty());

		// Failed loads are not cached
		assertThrows(InvalidFilterException.class, () -> valueSetService.expand(BAD_FILTER_VS, ValueSetExpansionParameters.defaults()));
	}

	private static List<String> codes(ValueSetExpansion expansion) {
		return expansion.contains().stream().map(ExpansionContains::code).collect(Collectors.toList());
	}

}
