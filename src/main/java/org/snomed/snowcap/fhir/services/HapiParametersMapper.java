package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.*;
import org.snomed.snowcap.fhir.config.FHIRConstants;
import org.snomed.snowcap.fhir.domain.*;
import org.snomed.snowcap.fhir.pojo.CodeValidationResult;
import org.snomed.snowcap.fhir.pojo.ConceptAndSystemResult;
import org.snomed.snowcap.fhir.pojo.TranslationMatch;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Builds the Parameters resources returned by the terminology operations.
 */
@Service
public class HapiParametersMapper implements FHIRConstants {

	public Parameters mapToFHIR(ConceptAndSystemResult conceptAndSystemResult) {
		FHIRCodeSystemVersion codeSystemVersion = conceptAndSystemResult.codeSystemVersion();
		FHIRConcept concept = conceptAndSystemResult.concept();

		Parameters parameters = new Parameters();
		if (codeSystemVersion.getName() != null) {
			parameters.addParameter(NAME, codeSystemVersion.getName());
		}
		addSystemAndVersion(parameters, codeSystemVersion);
		parameters.addParameter(CODE, new CodeType(concept.getCode()));
		if (concept.getDisplay() != null) {
			parameters.addParameter(DISPLAY, concept.getDisplay());
		}
		if (concept.getDefinition() != null) {
			parameters.addParameter(DEFINITION, concept.getDefinition());
		}
		addProperty(parameters, INACTIVE, new BooleanType(!concept.isActive()));
		for (String parent : concept.getParents()) {
			addProperty(parameters, PARENT, new CodeType(parent));
		}
		addChildren(parameters, conceptAndSystemResult.children());
		for (Map.Entry<String, List<FHIRProperty>> property : concept.getProperties().entrySet()) {
			if (INACTIVE.equals(property.getKey())) {
				continue;
			}
			for (FHIRProperty propertyValue : property.getValue()) {
				addProperty(parameters, propertyValue.getCode(), propertyValue.toHapiValue(codeSystemVersion.getUrl()));
			}
		}
		for (FHIRDesignation designation : concept.getDesignations()) {
			Parameters.ParametersParameterComponent desParam = parameters.addParameter().setName(DESIGNATION);
			if (designation.getLanguage() != null) {
				desParam.addPart().setName(LANGUAGE).setValue(new CodeType(designation.getLanguage()));
			}
			Coding useCoding = designation.getUseCoding();
			if (useCoding != null) {
				desParam.addPart().setName(USE).setValue(useCoding);
			}
			if (designation.getValue() != null) {
				desParam.addPart().setName(VALUE).setValue(new StringType(designation.getValue()));
			}
		}
		return parameters;
	}

	private void addChildren(Parameters parameters, Collection<String> children) {
		if (children != null) {
			for (String child : children) {
				addProperty(parameters, CHILD, new CodeType(child));
			}
		}
	}

	private void addProperty(Parameters parameters, String code, Type value) {
		Parameters.ParametersParameterComponent param = parameters.addParameter().setName(PROPERTY);
		param.addPart().setName(CODE).setValue(new CodeType(code));
		param.addPart().setName(VALUE).setValue(value);
	}

	private void addSystemAndVersion(Parameters parameters, FHIRCodeSystemVersion codeSystemVersion) {
		parameters.addParameter(SYSTEM, new UriType(codeSystemVersion.getUrl()));
		if (codeSystemVersion.getVersion() != null) {
			parameters.addParameter(VERSION, codeSystemVersion.getVersion());
		}
	}

	public Parameters mapToFHIR(CodeValidationResult validationResult) {
		Parameters parameters = new Parameters();
		parameters.addParameter(RESULT, validationResult.result());
		if (validationResult.code() != null) {
			parameters.addParameter(CODE, new CodeType(validationResult.code()));
		}
		if (validationResult.system() != null) {
			parameters.addParameter(SYSTEM, new UriType(validationResult.system()));
		}
		if (validationResult.version() != null) {
			parameters.addParameter(VERSION, validationResult.version());
		}
		if (validationResult.display() != null) {
			parameters.addParameter(DISPLAY, validationResult.display());
		}
		if (validationResult.inactive() != null) {
			parameters.addParameter(INACTIVE, validationResult.inactive());
		}
		if (validationResult.message() != null) {
			parameters.addParameter(MESSAGE, validationResult.message());
		}
		return parameters;
	}

	public Parameters mapToFHIR(SubsumesResult subsumesResult) {
		Parameters parameters = new Parameters();
		parameters.addParameter(OUTCOME, subsumesResult.toCodeType());
		return parameters;
	}

	/**
	 * The result is true when at least one match is an actual mapping, matches with 'unmatched' or 'disjoint' are still listed.
	 */
	public Parameters mapTranslationToFHIR(List<TranslationMatch> matches, Coding coding) {
		Parameters parameters = new Parameters();
		boolean mapped = matches.stream().anyMatch(match -> match.equivalence().isMapping());
		parameters.addParameter(RESULT, mapped);
		if (!mapped) {
			parameters.addParameter(MESSAGE, format("No mapping found for code '%s', system '%s'.", coding.getCode(), coding.getSystem()));
		}
		for (TranslationMatch match : matches) {
			Parameters.ParametersParameterComponent matchParam = parameters.addParameter().setName(MATCH);
			matchParam.addPart().setName(EQUIVALENCE).setValue(new CodeType(match.equivalence().getCode()));
			if (match.targetCode() != null) {
				matchParam.addPart().setName(CONCEPT).setValue(new Coding(match.targetSystem(), match.targetCode(), match.targetDisplay()));
			}
			matchParam.addPart().setName(SOURCE).setValue(new UriType(match.source()));
		}
		return parameters;
	}
}
