package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.CodeSystem;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.fhir.domain.FHIRCodeSystemVersion;
import org.snomed.snowcap.fhir.domain.FHIRConcept;
import org.snomed.snowcap.fhir.domain.FHIRDesignation;
import org.snomed.snowcap.fhir.domain.SubsumesResult;
import org.snomed.snowcap.fhir.exceptions.UnknownCodeSystemException;
import org.snomed.snowcap.fhir.pojo.CodeValidationResult;
import org.snomed.snowcap.fhir.pojo.ConceptAndSystemResult;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Registry of loaded code system versions, each held as a {@link FHIRConceptIndex}.
 */
@Service
public class FHIRCodeSystemService {

	// Key for a code system loaded without a version
	private static final String NO_VERSION = "";

	// System URL -> version -> index. Versions are ordered so the last entry is the latest.
	private final Map<String, ConcurrentSkipListMap<String, FHIRConceptIndex>> indexes = new ConcurrentHashMap<>();

	// Incremented on every load or removal so that cached results derived from the content can be recognised as stale
	private final AtomicLong contentGeneration = new AtomicLong();

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public FHIRConceptIndex load(FHIRCodeSystemVersion codeSystemVersion, Collection<FHIRConcept> concepts) {
		if (codeSystemVersion.getUrl() == null) {
			throw exception("A code system must have a url to be loaded.", OperationOutcome.IssueType.INVARIANT, 400);
		}
		FHIRConceptIndex index = FHIRConceptIndex.build(codeSystemVersion, concepts);
		indexes.computeIfAbsent(codeSystemVersion.getUrl(), url -> new ConcurrentSkipListMap<>())
				.put(versionKey(codeSystemVersion.getVersion()), index);
		contentGeneration.incrementAndGet();
		logger.info("Loaded code system {} with {} concepts.", codeSystemVersion, index.size());
		return index;
	}

	/**
	 * Loads a FHIR CodeSystem resource. Nested concepts become children of the concept that contains them,
	 * 'parent' and 'subsumedBy' properties are also read as parent links.
	 */
	public FHIRConceptIndex load(CodeSystem codeSystem) {
		List<FHIRConcept> concepts = new ArrayList<>();
		Map<String, FHIRConcept> byCode = new HashMap<>();
		Deque<Map.Entry<CodeSystem.ConceptDefinitionComponent, String>> queue = new ArrayDeque<>();
		for (CodeSystem.ConceptDefinitionComponent component : codeSystem.getConcept()) {
			queue.add(new AbstractMap.SimpleEntry<>(component, null));
		}
		while (!queue.isEmpty()) {
			Map.Entry<CodeSystem.ConceptDefinitionComponent, String> next = queue.poll();
			CodeSystem.ConceptDefinitionComponent component = next.getKey();
			FHIRConcept existing = byCode.get(component.getCode());
			if (existing != null && next.getValue() != null) {
				// Same concept nested under a second parent
				existing.addParent(next.getValue());
			} else if (existing == null) {
				FHIRConcept concept = new FHIRConcept(component, next.getValue());
				byCode.put(concept.getCode(), concept);
				concepts.add(concept);
			}
			for (CodeSystem.ConceptDefinitionComponent child : component.getConcept()) {
				queue.add(new AbstractMap.SimpleEntry<>(child, component.getCode()));
			}
		}
		return load(new FHIRCodeSystemVersion(codeSystem), concepts);
	}

	public boolean remove(String url, String version) {
		Map<String, FHIRConceptIndex> versions = indexes.get(url);
		if (versions != null && versions.remove(versionKey(version)) != null) {
			contentGeneration.incrementAndGet();
			logger.info("Removed code system {}{}.", url, version != null ? "|" + version : "");
			return true;
		}
		return false;
	}

	/**
	 * @param version exact version, or null for the latest loaded version
	 */
	public Optional<FHIRConceptIndex> findIndex(String system, String version) {
		if (system == null) {
			return Optional.empty();
		}
		ConcurrentSkipListMap<String, FHIRConceptIndex> versions = indexes.get(system);
		if (versions == null || versions.isEmpty()) {
			return Optional.empty();
		}
		if (version == null) {
			Map.Entry<String, FHIRConceptIndex> latest = versions.lastEntry();
			return Optional.ofNullable(latest != null ? latest.getValue() : null);
		}
		return Optional.ofNullable(versions.get(version));
	}

	/**
	 * @throws UnknownCodeSystemException if no matching version is loaded
	 */
	public FHIRConceptIndex getIndex(String system, String version) {
		return findIndex(system, version).orElseThrow(() -> new UnknownCodeSystemException(system, version));
	}

	public List<FHIRCodeSystemVersion> findAll() {
		List<FHIRCodeSystemVersion> all = new ArrayList<>();
		for (ConcurrentSkipListMap<String, FHIRConceptIndex> versions : indexes.values()) {
			versions.values().forEach(index -> all.add(index.getCodeSystemVersion()));
		}
		all.sort(Comparator.comparing(FHIRCodeSystemVersion::getCanonical));
		return all;
	}

	public long getContentGeneration() {
		return contentGeneration.get();
	}

	/**
	 * @return empty if the code is not in the code system
	 * @throws UnknownCodeSystemException if the code system is not loaded
	 */
	public Optional<ConceptAndSystemResult> lookup(String system, String version, String code) {
		FHIRConceptIndex index = getIndex(system, version);
		return index.lookup(code)
				.map(concept -> new ConceptAndSystemResult(concept, index.getCodeSystemVersion(), index.getChildren(code)));
	}

	public SubsumesResult subsumes(String system, String version, String codeA, String codeB) {
		FHIRConceptIndex index = getIndex(system, version);
		for (String code : List.of(codeA, codeB)) {
			if (!index.contains(code)) {
				throw exception(format("Code '%s' was not found in code system '%s'.", code, index.getCodeSystemVersion().getCanonical()),
						OperationOutcome.IssueType.NOTFOUND, 404);
			}
		}
		if (codeA.equals(codeB)) {
			return SubsumesResult.equivalent;
		}
		if (!index.getCodeSystemVersion().isIsAHierarchy()) {
			return SubsumesResult.not_subsumed;
		}
		return SubsumesResult.fromHierarchy(index.isA(codeB, codeA), index.isA(codeA, codeB));
	}

	/**
	 * Unknown code systems and codes give a negative result rather than an error.
	 * @param display optional, when given it must match the display or one of the designations
	 */
	public CodeValidationResult validateCode(String system, String version, String code, String display) {
		Optional<FHIRConceptIndex> index = findIndex(system, version);
		if (index.isEmpty()) {
			return CodeValidationResult.invalid(system, version, code, display,
					new UnknownCodeSystemException(system, version).getMessage());
		}
		FHIRCodeSystemVersion codeSystemVersion = index.get().getCodeSystemVersion();
		Optional<FHIRConcept> concept = index.get().lookup(code);
		if (concept.isEmpty()) {
			return CodeValidationResult.invalid(system, codeSystemVersion.getVersion(), code, display,
					format("Code '%s' not found in code system '%s'", code, codeSystemVersion.getCanonical()));
		}
		FHIRConcept fhirConcept = concept.get();
		if (display != null && !displayMatches(fhirConcept, display)) {
			return new CodeValidationResult(false, system, codeSystemVersion.getVersion(), code, fhirConcept.getDisplay(),
					"The code exists but the display is not valid", !fhirConcept.isActive());
		}
		return CodeValidationResult.valid(system, codeSystemVersion.getVersion(), code, fhirConcept.getDisplay(), !fhirConcept.isActive());
	}

	private static boolean displayMatches(FHIRConcept concept, String display) {
		if (display.equals(concept.getDisplay())) {
			return true;
		}
		for (FHIRDesignation designation : concept.getDesignations()) {
			if (display.equals(designation.getValue())) {
				return true;
			}
		}
		return false;
	}

	private static String versionKey(String version) {
		return version != null ? version : NO_VERSION;
	}
}
