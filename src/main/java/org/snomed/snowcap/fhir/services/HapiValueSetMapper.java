package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.*;
import org.snomed.snowcap.fhir.domain.FHIRValueSet;
import org.snomed.snowcap.fhir.pojo.ExpansionContains;
import org.snomed.snowcap.fhir.pojo.ValueSetExpansion;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Writes an expansion into a ValueSet resource. No timestamp is set so that repeated expansions give identical resources.
 */
@Service
public class HapiValueSetMapper {

	public static final String TOO_COSTLY_EXTENSION = "http://hl7.org/fhir/StructureDefinition/valueset-toocostly";

	public ValueSet mapToFHIR(FHIRValueSet valueSet, ValueSetExpansion expansion) {
		ValueSet hapiValueSet = valueSet.getHapi();
		ValueSet.ValueSetExpansionComponent hapiExpansion = hapiValueSet.getExpansion();
		hapiExpansion.setIdentifier(expansion.identifier());
		hapiExpansion.setTotal(expansion.total());
		hapiExpansion.setOffset(expansion.offset());
		if (expansion.tooCostly()) {
			hapiExpansion.addExtension(TOO_COSTLY_EXTENSION, new BooleanType(true));
		}
		for (Map.Entry<String, Object> parameter : expansion.parameters().entrySet()) {
			Object value = parameter.getValue();
			Type type;
			if (value instanceof Integer) {
				type = new IntegerType((Integer) value);
			} else if (value instanceof Boolean) {
				type = new BooleanType((Boolean) value);
			} else {
				type = new StringType(String.valueOf(value));
			}
			hapiExpansion.addParameter().setName(parameter.getKey()).setValue(type);
		}
		for (ExpansionContains contains : expansion.contains()) {
			ValueSet.ValueSetExpansionContainsComponent component = hapiExpansion.addContains();
			component.setSystem(contains.system());
			component.setVersion(contains.version());
			component.setCode(contains.code());
			component.setDisplay(contains.display());
			if (contains.inactive()) {
				component.setInactive(true);
			}
		}
		return hapiValueSet;
	}

	public static boolean isTooCostly(ValueSet valueSet) {
		Extension extension = valueSet.getExpansion().getExtensionByUrl(TOO_COSTLY_EXTENSION);
		return extension != null && extension.getValue() instanceof BooleanType && ((BooleanType) extension.getValue()).booleanValue();
	}
}
