package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CodeSystem;

import java.util.*;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.config.FHIRConstants.*;

public class FHIRConcept {

	private final String code;

	private String display;

	private String definition;

	private boolean active = true;

	private final Set<String> parents = new LinkedHashSet<>();

	private final List<FHIRDesignation> designations = new ArrayList<>();

	private final Map<String, List<FHIRProperty>> properties = new LinkedHashMap<>();

	// Set on the copy held by a concept index
	private boolean readOnly;

	public FHIRConcept(String code, String display) {
		this.code = code;
		this.display = display;
	}

	/**
	 * @param parentCode code of the enclosing concept when concepts are nested in the code system definition, otherwise null.
	 */
	public FHIRConcept(CodeSystem.ConceptDefinitionComponent definitionConcept, String parentCode) {
		this(definitionConcept.getCode(), definitionConcept.getDisplay());
		definition = definitionConcept.getDefinition();
		if (parentCode != null) {
			parents.add(parentCode);
		}
		for (CodeSystem.ConceptDefinitionDesignationComponent designation : definitionConcept.getDesignation()) {
			designations.add(new FHIRDesignation(designation));
		}
		for (CodeSystem.ConceptPropertyComponent propertyComponent : definitionConcept.getProperty()) {
			if (isPropertyInactive(propertyComponent)) {
				active = false;
			}
			String propertyCode = propertyComponent.getCode();
			if (PARENT.equals(propertyCode) || SUBSUMED_BY.equals(propertyCode)) {
				parents.add(propertyComponent.hasValueCoding() ? propertyComponent.getValueCoding().getCode() : propertyComponent.getValue().primitiveValue());
			} else {
				addProperty(new FHIRProperty(propertyComponent));
			}
		}
	}

	private static boolean isPropertyInactive(CodeSystem.ConceptPropertyComponent x) {
		if (x.getCode().equals(INACTIVE)) {
			if (x.hasValueBooleanType() && !Boolean.FALSE.equals(x.getValueBooleanType().getValue())) return true;
			if (x.hasValueCodeType() && Boolean.parseBoolean(x.getValueCodeType().getValueAsString())) return true;
		}
		return x.getCode().equals(STATUS) && x.hasValueCodeType() &&
				(RETIRED.equals(x.getValueCodeType().getCode()) || INACTIVE.equals(x.getValueCodeType().getCode()));
	}

	/**
	 * Copy that rejects all changes. Concept indexes hold and hand out only these copies.
	 */
	public FHIRConcept readOnlyCopy() {
		FHIRConcept copy = new FHIRConcept(code, display);
		copy.definition = definition;
		copy.active = active;
		copy.parents.addAll(parents);
		copy.designations.addAll(designations);
		properties.forEach((propertyCode, values) -> copy.properties.put(propertyCode, List.copyOf(values)));
		copy.readOnly = true;
		return copy;
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	private void checkWritable() {
		if (readOnly) {
			throw new UnsupportedOperationException(format("Concept '%s' belongs to a concept index and can not be changed.", code));
		}
	}

	public FHIRConcept addParent(String parentCode) {
		checkWritable();
		parents.add(parentCode);
		return this;
	}

	public FHIRConcept addDesignation(FHIRDesignation designation) {
		checkWritable();
		designations.add(designation);
		return this;
	}

	public FHIRConcept addProperty(FHIRProperty property) {
		checkWritable();
		properties.computeIfAbsent(property.getCode(), k -> new ArrayList<>()).add(property);
		return this;
	}

	public FHIRConcept setActive(boolean active) {
		checkWritable();
		this.active = active;
		return this;
	}

	public FHIRConcept setDefinition(String definition) {
		checkWritable();
		this.definition = definition;
		return this;
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public void setDisplay(String display) {
		checkWritable();
		this.display = display;
	}

	public String getDefinition() {
		return definition;
	}

	public boolean isActive() {
		return active;
	}

	public Set<String> getParents() {
		return Collections.unmodifiableSet(parents);
	}

	public List<FHIRDesignation> getDesignations() {
		return Collections.unmodifiableList(designations);
	}

	public Map<String, List<FHIRProperty>> getProperties() {
		return Collections.unmodifiableMap(properties);
	}

	public List<FHIRProperty> getProperty(String propertyCode) {
		return properties.getOrDefault(propertyCode, Collections.emptyList());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return code.equals(((FHIRConcept) o).code);
	}

	@Override
	public int hashCode() {
		return code.hashCode();
	}

	@Override
	public String toString() {
		return code + " |" + display + "|";
	}
}
