package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.rest.annotation.Operation;
import ca.uhn.fhir.rest.annotation.OperationParam;
import ca.uhn.fhir.rest.server.IResourceProvider;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.*;
import org.snomed.snowcap.fhir.config.FHIRConstants;
import org.snomed.snowcap.fhir.domain.FHIRValueSetCompose;
import org.snomed.snowcap.fhir.domain.SubsumesResult;
import org.snomed.snowcap.fhir.pojo.CodeValidationResult;
import org.snomed.snowcap.fhir.pojo.ConceptAndSystemResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.*;

@Component
public class FHIRCodeSystemProvider implements IResourceProvider, FHIRConstants {

	@Autowired
	private FHIRCodeSystemService codeSystemService;

	@Autowired
	private FHIRValueSetService valueSetService;

	@Autowired
	private HapiParametersMapper parametersMapper;

	@Operation(name = "$lookup", idempotent = true)
	public Parameters lookup(
			@OperationParam(name = "code") CodeType code,
			@OperationParam(name = "system") UriType system,
			@OperationParam(name = "version") StringType version,
			@OperationParam(name = "coding") Coding coding) {

		requireExactlyOneOf("code", code, "coding", coding);
		mutuallyRequired("code", code, "system", system);
		String systemUrl = coding != null ? coding.getSystem() : system.getValueAsString();
		String codeValue = coding != null ? coding.getCode() : code.getCode();
		String versionValue = coding != null ? coding.getVersion() : version != null ? version.getValue() : null;
		required("system", systemUrl);

		ConceptAndSystemResult result = codeSystemService.lookup(systemUrl, versionValue, codeValue)
				.orElseThrow(() -> exception(format("Code '%s' not found in code system '%s'.", codeValue, systemUrl),
						OperationOutcome.IssueType.NOTFOUND, 404));
		return parametersMapper.mapToFHIR(result);
	}

	/**
	 * Checks the code against the code system, and against the value set when one is given.
	 */
	@Operation(name = "$validate-code", idempotent = true)
	public Parameters validateCode(
			@OperationParam(name = "url") UriType url,
			@OperationParam(name = "code") CodeType code,
			@OperationParam(name = "version") StringType version,
			@OperationParam(name = "display") String display,
			@OperationParam(name = "coding") Coding coding,
			@OperationParam(name = "valueSet") ValueSet valueSet) {

		requireExactlyOneOf("code", code, "coding", coding);
		mutuallyRequired("code", code, "url", url);
		String systemUrl = coding != null ? coding.getSystem() : url.getValueAsString();
		String codeValue = coding != null ? coding.getCode() : code.getCode();
		String versionValue = coding != null ? coding.getVersion() : version != null ? version.getValue() : null;
		String displayValue = coding != null ? coding.getDisplay() : display;

		CodeValidationResult result;
		if (valueSet != null) {
			FHIRValueSetCompose compose = valueSet.hasCompose() ? new FHIRValueSetCompose(valueSet.getCompose()) : new FHIRValueSetCompose();
			result = valueSetService.validateCode(compose, systemUrl, versionValue, codeValue, displayValue);
		} else {
			result = codeSystemService.validateCode(systemUrl, versionValue, codeValue, displayValue);
		}
		return parametersMapper.mapToFHIR(result);
	}

	@Operation(name = "$subsumes", idempotent = true)
	public Parameters subsumes(
			@OperationParam(name = "codeA") CodeType codeA,
			@OperationParam(name = "codeB") CodeType codeB,
			@OperationParam(name = "system") UriType system,
			@OperationParam(name = "version") StringType version,
			@OperationParam(name = "codingA") Coding codingA,
			@OperationParam(name = "codingB") Coding codingB) {

		requireExactlyOneOf("codeA", codeA, "codingA", codingA);
		requireExactlyOneOf("codeB", codeB, "codingB", codingB);
		String systemUrl = system != null ? system.getValueAsString() : codingA != null ? codingA.getSystem() : null;
		required("system", systemUrl);
		if ((codingA != null && !systemUrl.equals(codingA.getSystem())) || (codingB != null && !systemUrl.equals(codingB.getSystem()))) {
			throw exception("Both codings must be from the same code system.", OperationOutcome.IssueType.INVARIANT, 400);
		}
		String versionValue = version != null ? version.getValue() : null;
		SubsumesResult result = codeSystemService.subsumes(systemUrl, versionValue,
				codeA != null ? codeA.getCode() : codingA.getCode(),
				codeB != null ? codeB.getCode() : codingB.getCode());
		return parametersMapper.mapToFHIR(result);
	}

	@Override
	public Class<? extends IBaseResource> getResourceType() {
		return CodeSystem.class;
	}
}
