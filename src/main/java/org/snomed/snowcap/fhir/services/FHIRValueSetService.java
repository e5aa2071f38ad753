package org.snomed.snowcap.fhir.services;

import ca.uhn.fhir.context.FhirContext;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import jakarta.annotation.PostConstruct;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.hl7.fhir.r4.model.ValueSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.core.util.OperationTimer;
import org.snomed.snowcap.fhir.config.FHIRTerminologyConfig;
import org.snomed.snowcap.fhir.domain.*;
import org.snomed.snowcap.fhir.exceptions.ValueSetCycleException;
import org.snomed.snowcap.fhir.pojo.*;
import org.snomed.snowcap.fhir.services.context.CancellationContext;
import org.snomed.snowcap.fhir.services.context.ValueSetResolver;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.config.FHIRConstants.*;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Value set expansion and membership, plus the registry of value sets that compose rules can reference.
 */
@Service
public class FHIRValueSetService {

	private static final String NO_VERSION = "";
	private static final int CHECKPOINT_INTERVAL = 1_000;

	@Autowired
	private FHIRCodeSystemService codeSystemService;

	@Autowired
	private FHIRValueSetFilterEvaluator filterEvaluator;

	@Autowired
	private FHIRValueSetCycleDetectionService cycleDetectionService;

	@Autowired
	private FHIRTerminologyConfig terminologyConfig;

	@Autowired
	private FhirContext fhirContext;

	// Registered value sets, url -> version -> value set
	private final Map<String, ConcurrentSkipListMap<String, FHIRValueSet>> valueSets = new ConcurrentHashMap<>();

	private Cache<String, ValueSetExpansion> expansionCache;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@PostConstruct
	public void init() {
		FHIRTerminologyConfig.Expansion expansionConfig = terminologyConfig.getExpansion();
		if (expansionConfig.isCacheEnabled()) {
			expansionCache = CacheBuilder.newBuilder().maximumSize(expansionConfig.getCacheSize()).build();
			logger.info("Expansion cache enabled with maximum size {}.", expansionConfig.getCacheSize());
		}
	}

	public void register(FHIRValueSet valueSet) {
		if (valueSet.getUrl() == null) {
			throw exception("A value set must have a url to be registered.", OperationOutcome.IssueType.INVARIANT, 400);
		}
		valueSets.computeIfAbsent(valueSet.getUrl(), url -> new ConcurrentSkipListMap<>())
				.put(valueSet.getVersion() != null ? valueSet.getVersion() : NO_VERSION, valueSet);
		clearCache();
		logger.info("Registered value set {}.", valueSet.getCanonical());
	}

	public void register(ValueSet hapiValueSet) {
		register(new FHIRValueSet(hapiValueSet));
	}

	public boolean unregister(String url, String version) {
		Map<String, FHIRValueSet> versions = valueSets.get(url);
		if (versions != null && versions.remove(version != null ? version : NO_VERSION) != null) {
			clearCache();
			logger.info("Unregistered value set {}{}.", url, version != null ? "|" + version : "");
			return true;
		}
		return false;
	}

	public void clearCache() {
		if (expansionCache != null) {
			expansionCache.invalidateAll();
		}
	}

	/**
	 * Registered value set by canonical. Without a version the latest registered version is returned.
	 */
	public Optional<FHIRValueSet> find(String valueSetCanonical) {
		CanonicalUri canonicalUri = CanonicalUri.parse(valueSetCanonical);
		if (canonicalUri == null) {
			return Optional.empty();
		}
		ConcurrentSkipListMap<String, FHIRValueSet> versions = valueSets.get(canonicalUri.url());
		if (versions == null || versions.isEmpty()) {
			return Optional.empty();
		}
		if (!canonicalUri.isVersioned()) {
			Map.Entry<String, FHIRValueSet> latest = versions.lastEntry();
			return Optional.ofNullable(latest != null ? latest.getValue() : null);
		}
		return Optional.ofNullable(versions.get(canonicalUri.version()));
	}

	public List<FHIRValueSet> findAll() {
		return valueSets.values().stream()
				.flatMap(versions -> versions.values().stream())
				.collect(Collectors.toList());
	}

	public ValueSetResolver getRegistryResolver() {
		return canonical -> find(canonical).orElse(null);
	}

	/**
	 * Expands a registered value set. Results are cached when the expansion cache is enabled.
	 */
	public ValueSetExpansion expand(String valueSetCanonical, ValueSetExpansionParameters parameters) {
		FHIRValueSet valueSet = find(valueSetCanonical).orElseThrow(() -> valueSetNotFound(valueSetCanonical));
		if (expansionCache == null) {
			return expand(valueSet, getRegistryResolver(), parameters);
		}
		String cacheKey = String.join("|", valueSet.getCanonical(), String.valueOf(parameters.getOffset()), String.valueOf(parameters.getCount()),
				String.valueOf(parameters.getActiveOnly()), String.valueOf(parameters.getMaxEntries()),
				String.valueOf(codeSystemService.getContentGeneration()));
		try {
			return expansionCache.get(cacheKey, () -> expand(valueSet, getRegistryResolver(), parameters));
		} catch (ExecutionException e) {
			throw exception("Failed to expand value set " + valueSet.getCanonical(), OperationOutcome.IssueType.EXCEPTION, 500, e.getCause());
		} catch (UncheckedExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
	}

	/**
	 * Expands a compose whose value set references are resolved from the registry.
	 */
	public ValueSetExpansion expand(FHIRValueSetCompose compose, ValueSetExpansionParameters parameters) {
		return expand(new FHIRValueSet(null, null, compose), getRegistryResolver(), parameters);
	}

	public ValueSetExpansion expand(FHIRValueSetCompose compose, ValueSetResolver resolver, ValueSetExpansionParameters parameters) {
		return expand(new FHIRValueSet(null, null, compose), resolver, parameters);
	}

	/**
	 * Members are sorted by system then code. Inactive concepts are removed when requested, the result is then truncated
	 * to the maximum number of entries and finally paged, so pages are stable between calls.
	 */
	public ValueSetExpansion expand(FHIRValueSet valueSet, ValueSetResolver resolver, ValueSetExpansionParameters parameters) {
		int offset = parameters.getOffset() != null ? parameters.getOffset() : 0;
		int count = parameters.getCount() != null ? parameters.getCount() : terminologyConfig.getExpansion().getDefaultCount();
		int maxEntries = parameters.getMaxEntries() != null ? parameters.getMaxEntries() : terminologyConfig.getExpansion().getMaxEntries();
		if (offset < 0 || count < 0) {
			throw exception("Parameters 'offset' and 'count' must not be negative.", OperationOutcome.IssueType.INVALID, 400);
		}
		CancellationContext cancellation = getCancellation(parameters.getCancellation());

		OperationTimer timer = new OperationTimer(logger, "Expansion " + (valueSet.getUrl() != null ? valueSet.getCanonical() : "of inline compose"), 2000);
		cycleDetectionService.verifyNoCycles(valueSet, resolver);

		List<ExpansionContains> members = new ArrayList<>(computeMembers(valueSet.getCompose(), resolver, 0, cancellation).values());
		members.sort(Comparator.comparing(ExpansionContains::system).thenComparing(ExpansionContains::code));
		timer.stage("compose");

		if (parameters.isActiveOnly()) {
			members = members.stream().filter(contains -> !contains.inactive()).collect(Collectors.toList());
		}
		int total = members.size();
		boolean tooCostly = false;
		if (total > maxEntries) {
			tooCostly = true;
			members = members.subList(0, maxEntries);
			logger.info("Expansion of {} truncated to {} of {} entries.", valueSet.getCanonical(), maxEntries, total);
		}
		List<ExpansionContains> page = offset >= members.size() ? Collections.emptyList() :
				List.copyOf(members.subList(offset, (int) Math.min((long) offset + count, members.size())));
		timer.finish();

		Map<String, Object> expansionParameters = new LinkedHashMap<>();
		expansionParameters.put(OFFSET, offset);
		expansionParameters.put(COUNT, count);
		if (parameters.getActiveOnly() != null) {
			expansionParameters.put("activeOnly", parameters.getActiveOnly());
		}
		return new ValueSetExpansion(getExpansionIdentifier(valueSet, expansionParameters, maxEntries), total, offset, tooCostly, page,
				Collections.unmodifiableMap(expansionParameters));
	}

	/**
	 * Membership test against the full, untruncated expansion, followed by a display check against the code system.
	 */
	public CodeValidationResult validateCode(FHIRValueSetCompose compose, ValueSetResolver resolver, String system, String version, String code, String display) {
		if (system == null || code == null) {
			return CodeValidationResult.invalid(system, version, code, display, "Both a system and a code are required to validate a code against a value set.");
		}
		FHIRValueSet valueSet = new FHIRValueSet(null, null, compose);
		cycleDetectionService.verifyNoCycles(valueSet, resolver);
		Map<SystemCode, ExpansionContains> members = computeMembers(compose, resolver, 0,
				getCancellation(null));
		ExpansionContains member = members.get(new SystemCode(system, code));
		if (member == null || (version != null && member.version() != null && !version.equals(member.version()))) {
			return CodeValidationResult.invalid(system, version, code, display, format("Code '%s' is not in the value set", code));
		}
		CodeValidationResult codeSystemResult = codeSystemService.validateCode(system, member.version(), code, display);
		if (!codeSystemResult.result()) {
			return codeSystemResult;
		}
		return CodeValidationResult.valid(system, member.version(), code, member.display(), member.inactive());
	}

	public CodeValidationResult validateCode(FHIRValueSetCompose compose, String system, String version, String code, String display) {
		return validateCode(compose, getRegistryResolver(), system, version, code, display);
	}

	public CodeValidationResult validateCoding(FHIRValueSetCompose compose, Coding coding) {
		return validateCode(compose, coding.getSystem(), coding.getVersion(), coding.getCode(), coding.getDisplay());
	}

	/**
	 * Valid if any of the codings is valid.
	 */
	public CodeValidationResult validateCodeableConcept(FHIRValueSetCompose compose, CodeableConcept codeableConcept) {
		List<String> errors = new ArrayList<>();
		CodeValidationResult firstFailure = null;
		for (Coding coding : codeableConcept.getCoding()) {
			CodeValidationResult result = validateCoding(compose, coding);
			if (result.result()) {
				return result;
			}
			errors.add(result.message());
			if (firstFailure == null) {
				firstFailure = result;
			}
		}
		if (firstFailure == null) {
			return CodeValidationResult.invalid(null, null, null, null, "No codings to validate.");
		}
		return CodeValidationResult.invalid(firstFailure.system(), firstFailure.version(), firstFailure.code(), firstFailure.display(),
				"None of the codings are valid: " + String.join(", ", errors));
	}

	/**
	 * Structural checks of a registered value set definition. Nothing is expanded.
	 *
	 * @return issues found, empty when the definition is valid
	 */
	public List<String> validate(String valueSetCanonical) {
		FHIRValueSet valueSet = find(valueSetCanonical).orElseThrow(() -> valueSetNotFound(valueSetCanonical));
		FHIRValueSetCompose compose = valueSet.getCompose();
		List<String> issues = new ArrayList<>();
		if (compose.getInclude().isEmpty()) {
			issues.add("Compose has no include rules.");
		}
		validateRules("include", compose.getInclude(), issues);
		validateRules("exclude", compose.getExclude(), issues);

		if (issues.isEmpty()) {
			logger.info("Value set {} is valid.", valueSet.getCanonical());
		} else {
			logger.warn("Value set {} has {} issue(s).", valueSet.getCanonical(), issues.size());
		}
		return issues;
	}

	private void validateRules(String ruleType, List<FHIRValueSetCriteria> rules, List<String> issues) {
		for (int i = 0; i < rules.size(); i++) {
			FHIRValueSetCriteria rule = rules.get(i);
			String path = format("%s[%s]", ruleType, i);
			if (rule.getSystem() == null && rule.getValueSets().isEmpty()) {
				issues.add(format("%s has neither a system nor a value set.", path));
			}
			if (rule.getSystem() == null && (!rule.getCodes().isEmpty() || !rule.getFilter().isEmpty())) {
				issues.add(format("%s lists codes or filters but no system.", path));
			}
			if (rule.getSystem() != null && codeSystemService.findIndex(rule.getSystem(), rule.getVersion()).isEmpty()) {
				issues.add(format("%s references code system '%s%s' which is not loaded.", path, rule.getSystem(),
						rule.getVersion() != null ? "|" + rule.getVersion() : ""));
			}
			List<FHIRValueSetCriteriaConcept> codes = rule.getCodes();
			for (int j = 0; j < codes.size(); j++) {
				if (codes.get(j).getCode() == null) {
					issues.add(format("%s.concept[%s] has no code.", path, j));
				}
			}
			List<FHIRValueSetFilter> filters = rule.getFilter();
			for (int j = 0; j < filters.size(); j++) {
				FHIRValueSetFilter filter = filters.get(j);
				String filterPath = format("%s.filter[%s]", path, j);
				if (filter.getProperty() == null) {
					issues.add(format("%s has no property.", filterPath));
				}
				if (filter.getOp() == null) {
					issues.add(format("%s has no operator.", filterPath));
				} else if (filter.getOperator() == null) {
					issues.add(format("%s has unknown operator '%s'.", filterPath, filter.getOp()));
				}
				if (filter.getValue() == null) {
					issues.add(format("%s has no value.", filterPath));
				}
			}
			for (String valueSetCanonical : rule.getValueSets()) {
				if (find(valueSetCanonical).isEmpty()) {
					issues.add(format("%s references value set '%s' which is not registered.", path, valueSetCanonical));
				}
			}
		}
	}

	// Members keyed by (system, code) in discovery order
	private Map<SystemCode, ExpansionContains> computeMembers(FHIRValueSetCompose compose, ValueSetResolver resolver, int depth, CancellationContext cancellation) {
		int maxDepth = terminologyConfig.getExpansion().getMaxDepth();
		if (depth > maxDepth) {
			throw new ValueSetCycleException(format("Value set references are nested more than %s levels deep.", maxDepth));
		}

		Map<SystemCode, ExpansionContains> members = new LinkedHashMap<>();
		for (FHIRValueSetCriteria include : compose.getInclude()) {
			cancellation.checkpoint();
			computeRule(include, resolver, depth, cancellation).forEach(members::putIfAbsent);
		}
		for (FHIRValueSetCriteria exclude : compose.getExclude()) {
			cancellation.checkpoint();
			members.keySet().removeAll(computeRule(exclude, resolver, depth, cancellation).keySet());
		}
		if (Boolean.FALSE.equals(compose.isInactive())) {
			members.values().removeIf(ExpansionContains::inactive);
		}
		return members;
	}

	// Codes of the system part of the rule, intersected with each referenced value set
	private Map<SystemCode, ExpansionContains> computeRule(FHIRValueSetCriteria criteria, ValueSetResolver resolver, int depth, CancellationContext cancellation) {
		Map<SystemCode, ExpansionContains> ruleMembers = null;
		if (criteria.getSystem() != null) {
			ruleMembers = computeSystemPart(criteria, cancellation);
		} else if (!criteria.getCodes().isEmpty() || !criteria.getFilter().isEmpty()) {
			throw exception("A compose rule with concepts or filters must name a system.", OperationOutcome.IssueType.INVALID, 400);
		}
		for (String valueSetCanonical : criteria.getValueSets()) {
			FHIRValueSet referenced = resolver.resolve(valueSetCanonical);
			if (referenced == null) {
				throw valueSetNotFound(valueSetCanonical);
			}
			Map<SystemCode, ExpansionContains> referencedMembers = computeMembers(referenced.getCompose(), resolver, depth + 1, cancellation);
			if (ruleMembers == null) {
				ruleMembers = referencedMembers;
			} else {
				ruleMembers.keySet().retainAll(referencedMembers.keySet());
			}
		}
		return ruleMembers != null ? ruleMembers : new LinkedHashMap<>();
	}

	private Map<SystemCode, ExpansionContains> computeSystemPart(FHIRValueSetCriteria criteria, CancellationContext cancellation) {
		FHIRConceptIndex index = codeSystemService.getIndex(criteria.getSystem(), criteria.getVersion());
		String version = index.getCodeSystemVersion().getVersion();

		Map<String, String> displayOverrides = new HashMap<>();
		Collection<String> codes;
		if (!criteria.getCodes().isEmpty()) {
			codes = new LinkedHashSet<>();
			for (FHIRValueSetCriteriaConcept criteriaConcept : criteria.getCodes()) {
				if (index.contains(criteriaConcept.getCode())) {
					codes.add(criteriaConcept.getCode());
					if (criteriaConcept.getDisplay() != null) {
						displayOverrides.put(criteriaConcept.getCode(), criteriaConcept.getDisplay());
					}
				} else {
					logger.warn("Code '{}' is not in code system {}, it will not be included in the expansion.", criteriaConcept.getCode(),
							index.getCodeSystemVersion());
				}
			}
			if (!criteria.getFilter().isEmpty()) {
				codes.retainAll(filterEvaluator.evaluateAll(criteria.getFilter(), index));
			}
		} else if (!criteria.getFilter().isEmpty()) {
			codes = filterEvaluator.evaluateAll(criteria.getFilter(), index);
		} else {
			codes = index.getCodes();
		}

		Map<SystemCode, ExpansionContains> members = new LinkedHashMap<>();
		int processed = 0;
		for (String code : codes) {
			if (++processed % CHECKPOINT_INTERVAL == 0) {
				cancellation.checkpoint();
			}
			FHIRConcept concept = index.lookup(code).orElseThrow();
			String display = displayOverrides.getOrDefault(code, concept.getDisplay());
			members.put(new SystemCode(index.getSystem(), code), new ExpansionContains(index.getSystem(), version, code, display, !concept.isActive()));
		}
		return members;
	}

	private CancellationContext getCancellation(CancellationContext cancellation) {
		return cancellation != null ? cancellation : CancellationContext.withTimeoutSeconds(terminologyConfig.getOperation().getTimeoutSeconds());
	}

	private String getExpansionIdentifier(FHIRValueSet valueSet, Map<String, Object> expansionParameters, int maxEntries) {
		String composeJson = fhirContext.newJsonParser().encodeResourceToString(valueSet.getHapi());
		String source = String.join("|", String.valueOf(valueSet.getCanonical()), composeJson, expansionParameters.toString(),
				String.valueOf(maxEntries));
		return "urn:uuid:" + UUID.nameUUIDFromBytes(source.getBytes(StandardCharsets.UTF_8));
	}

	private static SnowcapFHIRServerResponseException valueSetNotFound(String valueSetCanonical) {
		return exception(format("Value set '%s' could not be found.", valueSetCanonical), OperationOutcome.IssueType.NOTFOUND, 404);
	}
}
