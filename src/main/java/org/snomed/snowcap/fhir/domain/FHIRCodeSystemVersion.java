package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CodeSystem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.snomed.snowcap.fhir.config.FHIRConstants.HIERARCHY_IS_A;

/**
 * Header of a loaded code system version. Concepts are held by the version's concept index.
 */
public class FHIRCodeSystemVersion {

	private String url;

	private String version;

	private String name;

	private String status;

	private String hierarchyMeaning = HIERARCHY_IS_A;

	private final Map<String, FHIRPropertyType> propertyTypes = new LinkedHashMap<>();

	public FHIRCodeSystemVersion(String url, String version) {
		this.url = url;
		this.version = version;
	}

	public FHIRCodeSystemVersion(CodeSystem codeSystem) {
		url = codeSystem.getUrl();
		version = codeSystem.getVersion();
		name = codeSystem.getName();
		status = codeSystem.getStatus() != null ? codeSystem.getStatus().toCode() : null;
		if (codeSystem.hasHierarchyMeaning()) {
			hierarchyMeaning = codeSystem.getHierarchyMeaning().toCode();
		}
		for (CodeSystem.PropertyComponent property : codeSystem.getProperty()) {
			propertyTypes.put(property.getCode(), FHIRPropertyType.of(property.getType()));
		}
	}

	public FHIRCodeSystemVersion declareProperty(String code, FHIRPropertyType type) {
		propertyTypes.put(code, type);
		return this;
	}

	public String getCanonical() {
		return version != null ? url + "|" + version : url;
	}

	public boolean isIsAHierarchy() {
		return hierarchyMeaning == null || HIERARCHY_IS_A.equals(hierarchyMeaning);
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public String getHierarchyMeaning() {
		return hierarchyMeaning;
	}

	public void setHierarchyMeaning(String hierarchyMeaning) {
		this.hierarchyMeaning = hierarchyMeaning;
	}

	public Map<String, FHIRPropertyType> getPropertyTypes() {
		return Collections.unmodifiableMap(propertyTypes);
	}

	@Override
	public String toString() {
		return getCanonical();
	}
}
