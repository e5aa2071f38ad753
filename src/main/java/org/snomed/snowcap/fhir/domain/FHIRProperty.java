package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.CodeSystem;
import org.hl7.fhir.r4.model.Type;

import java.util.Objects;

/**
 * Concept property value. The raw value is parsed into its typed form once, when the property is created.
 */
public class FHIRProperty {

	private final String code;
	private final String display;
	private final String value;
	private final FHIRPropertyType type;
	private final Object typedValue;

	public FHIRProperty(String code, String display, String value, FHIRPropertyType type) {
		this.code = code;
		this.display = display;
		this.value = value;
		this.type = type != null ? type : FHIRPropertyType.STRING;
		this.typedValue = value != null ? this.type.parse(value) : null;
	}

	public FHIRProperty(CodeSystem.ConceptPropertyComponent hapiProperty) {
		this(hapiProperty.getCode(),
				hapiProperty.hasValueCoding() ? hapiProperty.getValueCoding().getDisplay() : null,
				hapiProperty.hasValueCoding() ? hapiProperty.getValueCoding().getCode() : hapiProperty.getValue().primitiveValue(),
				FHIRPropertyType.of(hapiProperty.getValue()));
	}

	/**
	 * @param system used as the system of CODING values
	 */
	public Type toHapiValue(String system) {
		return type.toHapi(value, system, display);
	}

	public String getCode() {
		return code;
	}

	public String getDisplay() {
		return display;
	}

	public String getValue() {
		return value;
	}

	public FHIRPropertyType getType() {
		return type;
	}

	public Object getTypedValue() {
		return typedValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FHIRProperty)) return false;
		FHIRProperty other = (FHIRProperty) o;
		return code.equals(other.code) && Objects.equals(typedValue, other.typedValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(code, typedValue);
	}

	@Override
	public String toString() {
		return code + "=" + value;
	}
}
