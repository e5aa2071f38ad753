package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.ConceptMap;
import org.hl7.fhir.r4.model.Enumerations;
import org.snomed.snowcap.fhir.pojo.ClosureRow;
import org.snomed.snowcap.fhir.pojo.ClosureUpdate;
import org.snomed.snowcap.fhir.pojo.SystemCode;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes closure table rows as a ConceptMap: each row becomes an element for concept1 with a target of concept2.
 */
@Service
public class HapiConceptMapMapper {

	public ConceptMap mapClosureToFHIR(ClosureUpdate closureUpdate) {
		ConceptMap conceptMap = new ConceptMap();
		conceptMap.setName(closureUpdate.name());
		conceptMap.setVersion(String.valueOf(closureUpdate.version()));
		conceptMap.setStatus(Enumerations.PublicationStatus.ACTIVE);

		Map<String, ConceptMap.ConceptMapGroupComponent> groups = new LinkedHashMap<>();
		for (ClosureRow row : closureUpdate.rows()) {
			SystemCode source = row.concept1();
			SystemCode target = row.concept2();
			String groupKey = String.join("|", String.valueOf(source.system()), String.valueOf(source.version()),
					String.valueOf(target.system()), String.valueOf(target.version()));
			ConceptMap.ConceptMapGroupComponent group = groups.computeIfAbsent(groupKey, key -> conceptMap.addGroup()
					.setSource(source.system())
					.setSourceVersion(source.version())
					.setTarget(target.system())
					.setTargetVersion(target.version()));
			ConceptMap.SourceElementComponent element = group.getElement().stream()
					.filter(existing -> source.code().equals(existing.getCode()))
					.findFirst()
					.orElseGet(() -> group.addElement().setCode(source.code()));
			element.addTarget()
					.setCode(target.code())
					.setEquivalence(row.equivalence().toHapi());
		}
		return conceptMap;
	}
}
