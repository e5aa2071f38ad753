package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.ValueSet;

/**
 * A registered value set definition, the target of value set references in other composes.
 */
public class FHIRValueSet {

	private final String url;

	private final String version;

	private String name;

	private final FHIRValueSetCompose compose;

	public FHIRValueSet(String url, String version, FHIRValueSetCompose compose) {
		this.url = url;
		this.version = version;
		this.compose = compose;
	}

	public FHIRValueSet(ValueSet hapiValueSet) {
		this(hapiValueSet.getUrl(), hapiValueSet.getVersion(),
				hapiValueSet.hasCompose() ? new FHIRValueSetCompose(hapiValueSet.getCompose()) : new FHIRValueSetCompose());
		name = hapiValueSet.getName();
	}

	public ValueSet getHapi() {
		ValueSet valueSet = new ValueSet();
		valueSet.setUrl(url);
		valueSet.setVersion(version);
		valueSet.setName(name);
		valueSet.setCompose(compose.getHapi());
		return valueSet;
	}

	public String getCanonical() {
		return version != null ? url + "|" + version : url;
	}

	public String getUrl() {
		return url;
	}

	public String getVersion() {
		return version;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public FHIRValueSetCompose getCompose() {
		return compose;
	}
}
