package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.rest.annotation.Operation;
import ca.uhn.fhir.rest.annotation.OperationParam;
import ca.uhn.fhir.rest.server.IResourceProvider;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.*;
import org.snomed.snowcap.fhir.config.FHIRConstants;
import org.snomed.snowcap.fhir.domain.FHIRValueSet;
import org.snomed.snowcap.fhir.pojo.CodeValidationResult;
import org.snomed.snowcap.fhir.pojo.ValueSetExpansion;
import org.snomed.snowcap.fhir.pojo.ValueSetExpansionParameters;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.*;

@Component
public class FHIRValueSetProvider implements IResourceProvider, FHIRConstants {

	@Autowired
	private FHIRValueSetService valueSetService;

	@Autowired
	private HapiValueSetMapper valueSetMapper;

	@Autowired
	private HapiParametersMapper parametersMapper;

	@Operation(name = "$expand", idempotent = true)
	public ValueSet expand(
			@OperationParam(name = "url") UriType url,
			@OperationParam(name = "valueSetVersion") String valueSetVersion,
			@OperationParam(name = "valueSet") ValueSet valueSet,
			@OperationParam(name = "offset") IntegerType offset,
			@OperationParam(name = "count") IntegerType count,
			@OperationParam(name = "activeOnly") BooleanType activeOnly) {

		requireExactlyOneOf("url", url, "valueSet", valueSet);
		mutuallyExclusive("valueSet", valueSet, "valueSetVersion", valueSetVersion);
		ValueSetExpansionParameters parameters = new ValueSetExpansionParameters(
				offset != null ? offset.getValue() : null,
				count != null ? count.getValue() : null,
				activeOnly != null ? activeOnly.getValue() : null);

		FHIRValueSet fhirValueSet;
		ValueSetExpansion expansion;
		if (url != null) {
			String canonical = valueSetVersion != null ? url.getValueAsString() + "|" + valueSetVersion : url.getValueAsString();
			fhirValueSet = valueSetService.find(canonical)
					.orElseThrow(() -> exception(format("Value set '%s' could not be found.", canonical), OperationOutcome.IssueType.NOTFOUND, 404));
			expansion = valueSetService.expand(canonical, parameters);
		} else {
			if (!valueSet.hasCompose()) {
				throw exception("The value set must have a compose element to be expanded.", OperationOutcome.IssueType.INVARIANT, 400);
			}
			fhirValueSet = new FHIRValueSet(valueSet);
			expansion = valueSetService.expand(fhirValueSet, valueSetService.getRegistryResolver(), parameters);
		}
		return valueSetMapper.mapToFHIR(fhirValueSet, expansion);
	}

	@Operation(name = "$validate-code", idempotent = true)
	public Parameters validateCode(
			@OperationParam(name = "url") UriType url,
			@OperationParam(name = "valueSetVersion") String valueSetVersion,
			@OperationParam(name = "valueSet") ValueSet valueSet,
			@OperationParam(name = "code") CodeType code,
			@OperationParam(name = "system") UriType system,
			@OperationParam(name = "systemVersion") String systemVersion,
			@OperationParam(name = "display") String display,
			@OperationParam(name = "coding") Coding coding,
			@OperationParam(name = "codeableConcept") CodeableConcept codeableConcept) {

		requireExactlyOneOf("url", url, "valueSet", valueSet);
		requireExactlyOneOf("code", code, "coding", coding, "codeableConcept", codeableConcept);
		mutuallyRequired("code", code, "system", system);

		FHIRValueSet fhirValueSet;
		if (url != null) {
			String canonical = valueSetVersion != null ? url.getValueAsString() + "|" + valueSetVersion : url.getValueAsString();
			fhirValueSet = valueSetService.find(canonical)
					.orElseThrow(() -> exception(format("Value set '%s' could not be found.", canonical), OperationOutcome.IssueType.NOTFOUND, 404));
		} else {
			fhirValueSet = new FHIRValueSet(valueSet);
		}

		CodeValidationResult result;
		if (code != null) {
			result = valueSetService.validateCode(fhirValueSet.getCompose(), system.getValueAsString(), systemVersion, code.getCode(), display);
		} else if (coding != null) {
			result = valueSetService.validateCoding(fhirValueSet.getCompose(), coding);
		} else {
			result = valueSetService.validateCodeableConcept(fhirValueSet.getCompose(), codeableConcept);
		}
		return parametersMapper.mapToFHIR(result);
	}

	@Override
	public Class<? extends IBaseResource> getResourceType() {
		return ValueSet.class;
	}
}
