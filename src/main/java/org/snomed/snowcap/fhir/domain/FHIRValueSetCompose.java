package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ValueSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class FHIRValueSetCompose {

	private final List<FHIRValueSetCriteria> include = new ArrayList<>();

	private final List<FHIRValueSetCriteria> exclude = new ArrayList<>();

	private Boolean inactive;

	public FHIRValueSetCompose() {
	}

	public FHIRValueSetCompose(ValueSet.ValueSetComposeComponent hapiCompose) {
		if (hapiCompose.hasInactive()) {
			setInactive(hapiCompose.getInactive());
		}
		for (ValueSet.ConceptSetComponent hapiInclude : hapiCompose.getInclude()) {
			addInclude(new FHIRValueSetCriteria(hapiInclude));
		}
		for (ValueSet.ConceptSetComponent hapiExclude : hapiCompose.getExclude()) {
			addExclude(new FHIRValueSetCriteria(hapiExclude));
		}
	}

	public ValueSet.ValueSetComposeComponent getHapi() {
		ValueSet.ValueSetComposeComponent hapiCompose = new ValueSet.ValueSetComposeComponent();
		if (inactive != null) {
			hapiCompose.setInactive(inactive);
		}
		for (FHIRValueSetCriteria criteria : include) {
			hapiCompose.addInclude(criteria.getHapi());
		}
		for (FHIRValueSetCriteria criteria : exclude) {
			hapiCompose.addExclude(criteria.getHapi());
		}
		return hapiCompose;
	}

	public FHIRValueSetCompose addInclude(FHIRValueSetCriteria criteria) {
		include.add(criteria);
		return this;
	}

	public FHIRValueSetCompose addExclude(FHIRValueSetCriteria criteria) {
		exclude.add(criteria);
		return this;
	}

	public List<FHIRValueSetCriteria> getInclude() {
		return include;
	}

	public List<FHIRValueSetCriteria> getExclude() {
		return exclude;
	}

	public void setInactive(Boolean inactive) {
		this.inactive = inactive;
	}

	public Boolean isInactive() {
		return inactive;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FHIRValueSetCompose that = (FHIRValueSetCompose) o;
		return include.equals(that.include) && exclude.equals(that.exclude)
				&& Objects.equals(inactive, that.inactive);
	}

	@Override
	public int hashCode() {
		return Objects.hash(include, exclude, inactive);
	}
}
