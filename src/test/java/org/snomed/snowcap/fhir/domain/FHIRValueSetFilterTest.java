package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ValueSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FHIRValueSetFilterTest {

	@Test
	void testOperatorParsing() {
		assertEquals(ValueSet.FilterOperator.ISA, new FHIRValueSetFilter("concept", "is-a", "a").getOperator());
		assertEquals(ValueSet.FilterOperator.DESCENDENTOF, new FHIRValueSetFilter("concept", "descendant-of", "a").getOperator());
		assertEquals(ValueSet.FilterOperator.EQUAL, new FHIRValueSetFilter("display", "eq", "a").getOperator());
		assertEquals(ValueSet.FilterOperator.NOTIN, new FHIRValueSetFilter("display", "not-in", "a,b").getOperator());
		assertNull(new FHIRValueSetFilter("concept", "sounds-like", "a").getOperator());
	}

	@Test
	void testHapiConversion() {
		FHIRValueSetFilter filter = new FHIRValueSetFilter("concept", "generalizes", "flu");
		FHIRValueSetFilter copy = new FHIRValueSetFilter(filter.getHapi());
		assertEquals(filter, copy);
		assertEquals(ValueSet.FilterOperator.GENERALIZES, copy.getOperator());
	}

}
