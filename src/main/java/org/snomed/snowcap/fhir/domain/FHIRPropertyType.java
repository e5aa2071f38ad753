package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.r4.model.*;

import java.math.BigDecimal;

/**
 * Value type of a concept property. Each type knows how to parse a raw value for comparison
 * and how to render it as a HAPI value.
 */
public enum FHIRPropertyType {

	STRING {
		@Override
		public Type toHapi(String value, String system, String display) {
			return new StringType(value);
		}
	},
	CODE {
		@Override
		public Type toHapi(String value, String system, String display) {
			return new CodeType(value);
		}
	},
	CODING {
		@Override
		public Type toHapi(String value, String system, String display) {
			return new Coding(system, value, display);
		}
	},
	BOOLEAN {
		@Override
		public Object parse(String value) {
			if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
				throw new IllegalArgumentException("Value '" + value + "' is not a boolean.");
			}
			return Boolean.parseBoolean(value);
		}

		@Override
		public Type toHapi(String value, String system, String display) {
			return new BooleanType(value);
		}
	},
	INTEGER {
		@Override
		public Object parse(String value) {
			return Integer.parseInt(value.trim());
		}

		@Override
		public Type toHapi(String value, String system, String display) {
			return new IntegerType(value);
		}
	},
	DECIMAL {
		// Scale is ignored so that 1.0 matches 1
		@Override
		public Object parse(String value) {
			return new BigDecimal(value.trim()).stripTrailingZeros();
		}

		@Override
		public Type toHapi(String value, String system, String display) {
			return new DecimalType(value);
		}
	};

	/**
	 * @throws IllegalArgumentException if the value is not valid for this type
	 */
	public Object parse(String value) {
		return value;
	}

	public abstract Type toHapi(String value, String system, String display);

	/**
	 * Types not modelled here, dateTime for example, are kept as strings.
	 */
	public static FHIRPropertyType of(Type hapiValue) {
		switch (hapiValue.fhirType()) {
			case "code": return CODE;
			case "Coding": return CODING;
			case "boolean": return BOOLEAN;
			case "integer": return INTEGER;
			case "decimal": return DECIMAL;
			default: return STRING;
		}
	}

	public static FHIRPropertyType of(CodeSystem.PropertyType declaredType) {
		if (declaredType == null) {
			return null;
		}
		switch (declaredType) {
			case CODE: return CODE;
			case CODING: return CODING;
			case BOOLEAN: return BOOLEAN;
			case INTEGER: return INTEGER;
			case DECIMAL: return DECIMAL;
			default: return STRING;
		}
	}
}
