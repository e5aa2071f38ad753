package org.snomed.snowcap.fhir.domain;

import org.hl7.fhir.exceptions.FHIRException;
import org.hl7.fhir.r4.model.ValueSet;

import java.util.Objects;

public class FHIRValueSetFilter {

	private final String property;

	private final String op;

	private final String value;

	// Null when the op code is not a known filter operator
	private final ValueSet.FilterOperator operator;

	public FHIRValueSetFilter(String property, String op, String value) {
		this.property = property;
		this.op = op;
		this.value = value;
		this.operator = parseOperator(op);
	}

	public FHIRValueSetFilter(ValueSet.ConceptSetFilterComponent hapiFilter) {
		this(hapiFilter.getProperty(), hapiFilter.getOp() != null ? hapiFilter.getOp().toCode() : null, hapiFilter.getValue());
	}

	private static ValueSet.FilterOperator parseOperator(String op) {
		if (op == null) {
			return null;
		}
		if ("descendant-of".equals(op)) {
			return ValueSet.FilterOperator.DESCENDENTOF;
		}
		if ("eq".equals(op)) {
			return ValueSet.FilterOperator.EQUAL;
		}
		try {
			return ValueSet.FilterOperator.fromCode(op);
		} catch (FHIRException e) {
			return null;
		}
	}

	public ValueSet.ConceptSetFilterComponent getHapi() {
		ValueSet.ConceptSetFilterComponent component = new ValueSet.ConceptSetFilterComponent();
		component.setProperty(property);
		component.setOp(operator);
		component.setValue(value);
		return component;
	}

	public String getProperty() {
		return property;
	}

	public String getOp() {
		return op;
	}

	public ValueSet.FilterOperator getOperator() {
		return operator;
	}

	public String getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FHIRValueSetFilter that = (FHIRValueSetFilter) o;
		return Objects.equals(property, that.property) && Objects.equals(op, that.op) && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(property, op, value);
	}

	@Override
	public String toString() {
		return property + " " + op + " " + value;
	}
}
