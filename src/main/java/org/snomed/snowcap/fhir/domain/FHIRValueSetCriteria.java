package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CanonicalType;
import org.hl7.fhir.r4.model.ValueSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single include or exclude rule of a value set compose.
 */
public class FHIRValueSetCriteria {

	private String system;

	private String version;

	private final List<FHIRValueSetCriteriaConcept> codes = new ArrayList<>();

	private final List<FHIRValueSetFilter> filter = new ArrayList<>();

	private final List<String> valueSets = new ArrayList<>();

	public FHIRValueSetCriteria() {
	}

	public FHIRValueSetCriteria(String system) {
		this.system = system;
	}

	public FHIRValueSetCriteria(ValueSet.ConceptSetComponent hapiCriteria) {
		system = hapiCriteria.getSystem();
		version = hapiCriteria.getVersion();
		for (ValueSet.ConceptReferenceComponent code : hapiCriteria.getConcept()) {
			addCode(new FHIRValueSetCriteriaConcept(code));
		}
		for (ValueSet.ConceptSetFilterComponent hapiFilter : hapiCriteria.getFilter()) {
			addFilter(new FHIRValueSetFilter(hapiFilter));
		}
		for (CanonicalType canonical : hapiCriteria.getValueSet()) {
			addValueSet(canonical.getValueAsString());
		}
	}

	public ValueSet.ConceptSetComponent getHapi() {
		ValueSet.ConceptSetComponent hapiConceptSet = new ValueSet.ConceptSetComponent();
		hapiConceptSet.setSystem(system);
		hapiConceptSet.setVersion(version);
		for (FHIRValueSetCriteriaConcept code : codes) {
			hapiConceptSet.addConcept(code.getHapi());
		}
		for (FHIRValueSetFilter valueSetFilter : filter) {
			hapiConceptSet.addFilter(valueSetFilter.getHapi());
		}
		for (String valueSet : valueSets) {
			hapiConceptSet.addValueSet(valueSet);
		}
		return hapiConceptSet;
	}

	public FHIRValueSetCriteria addCode(FHIRValueSetCriteriaConcept code) {
		codes.add(code);
		return this;
	}

	public FHIRValueSetCriteria addCode(String code) {
		return addCode(new FHIRValueSetCriteriaConcept(code, null));
	}

	public FHIRValueSetCriteria addFilter(FHIRValueSetFilter valueSetFilter) {
		filter.add(valueSetFilter);
		return this;
	}

	public FHIRValueSetCriteria addFilter(String property, String op, String value) {
		return addFilter(new FHIRValueSetFilter(property, op, value));
	}

	public FHIRValueSetCriteria addValueSet(String valueSetCanonical) {
		valueSets.add(valueSetCanonical);
		return this;
	}

	public String getSystem() {
		return system;
	}

	public void setSystem(String system) {
		this.system = system;
	}

	public String getVersion() {
		return version;
	}

	public FHIRValueSetCriteria setVersion(String version) {
		this.version = version;
		return this;
	}

	public List<FHIRValueSetCriteriaConcept> getCodes() {
		return codes;
	}

	public List<FHIRValueSetFilter> getFilter() {
		return filter;
	}

	public List<String> getValueSets() {
		return valueSets;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FHIRValueSetCriteria that = (FHIRValueSetCriteria) o;
		return Objects.equals(system, that.system) && Objects.equals(version, that.version) && codes.equals(that.codes)
				&& filter.equals(that.filter) && valueSets.equals(that.valueSets);
	}

	@Override
	public int hashCode() {
		return Objects.hash(system, version, codes, filter, valueSets);
	}
}
