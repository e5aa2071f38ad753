package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.rest.annotation.Operation;
import ca.uhn.fhir.rest.annotation.OperationParam;
import ca.uhn.fhir.rest.server.IResourceProvider;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.*;
import org.hl7.fhir.r4.model.OperationOutcome.IssueType;
import org.snomed.snowcap.fhir.config.FHIRConstants;
import org.snomed.snowcap.fhir.pojo.TranslationMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

import static org.snomed.snowcap.fhir.services.FHIRHelper.*;

@Component
public class FHIRConceptMapProvider implements IResourceProvider, FHIRConstants {

	@Autowired
	private FHIRConceptMapService service;

	@Autowired
	private HapiParametersMapper parametersMapper;

	@Operation(name = "$translate", idempotent = true)
	public Parameters translate(
			@OperationParam(name = "url") UriType urlType,
			@OperationParam(name = "conceptMapVersion") String conceptMapVersion,
			@OperationParam(name = "code") CodeType code,
			@OperationParam(name = "system") UriType system,
			@OperationParam(name = "version") String version,
			@OperationParam(name = "coding") Coding coding,
			@OperationParam(name = "codeableConcept") CodeableConcept codeableConcept,
			@OperationParam(name = "targetsystem") UriType targetSystem,
			@OperationParam(name = "reverse") BooleanType reverse) {

		mutuallyRequired("conceptMapVersion", conceptMapVersion, "url", urlType);
		String url = urlType != null ? urlType.getValueAsString() : null;
		if (url != null && conceptMapVersion != null) {
			url = url + "|" + conceptMapVersion;
		}

		// Get coding to translate
		requireExactlyOneOf("code", code, "coding", coding, "codeableConcept", codeableConcept);
		mutuallyRequired("code", code, "system", system);
		if (coding == null) {
			if (code != null) {
				coding = new Coding(system.getValueAsString(), code.getCode(), null).setVersion(version);
			} else {
				if (codeableConcept.getCoding().size() > 1) {
					throw exception("Translation of CodeableConcept with multiple codes is not supported.", IssueType.NOTSUPPORTED, 400);
				}
				if (codeableConcept.getCoding().isEmpty()) {
					throw exception("CodeableConcept contains no coding.", IssueType.INVARIANT, 400);
				}
				coding = codeableConcept.getCoding().get(0);
			}
		}
		required("system", coding.getSystem());

		String target = targetSystem != null ? targetSystem.getValueAsString() : null;
		List<TranslationMatch> matches;
		if (reverse != null && reverse.booleanValue()) {
			matches = service.reverseTranslate(url, coding.getSystem(), coding.getCode(), target);
		} else {
			matches = service.translate(url, coding.getSystem(), coding.getCode(), target, null);
		}
		return parametersMapper.mapTranslationToFHIR(matches, coding);
	}

	@Override
	public Class<? extends IBaseResource> getResourceType() {
		return ConceptMap.class;
	}
}
