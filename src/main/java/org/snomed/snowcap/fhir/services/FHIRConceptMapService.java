package org.snomed.snowcap.fhir.services;

import jakarta.annotation.PostConstruct;
import org.hl7.fhir.r4.model.ConceptMap;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.fhir.config.FHIRTerminologyConfig;
import org.snomed.snowcap.fhir.domain.*;
import org.snomed.snowcap.fhir.pojo.CanonicalUri;
import org.snomed.snowcap.fhir.pojo.TranslationChain;
import org.snomed.snowcap.fhir.pojo.TranslationMatch;
import org.snomed.snowcap.fhir.services.context.CancellationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Registry of loaded concept maps and translation of codes through them.
 * An empty translation means no mapping is known, it is not an error.
 */
@Service
public class FHIRConceptMapService {

	private static final String CHAIN_SEPARATOR = " > ";

	@Autowired
	private FHIRCodeSystemService codeSystemService;

	@Autowired
	private FHIRTerminologyConfig terminologyConfig;

	// Canonical url|version -> index, ordered so that translation results are stable
	private final ConcurrentSkipListMap<String, FHIRConceptMapIndex> conceptMaps = new ConcurrentSkipListMap<>();

	private List<TranslationChain> translationChains;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@PostConstruct
	public void init() {
		translationChains = terminologyConfig.getTranslationChains();
	}

	public void load(FHIRConceptMap conceptMap) {
		if (conceptMap.getUrl() == null) {
			throw exception("A concept map must have a url to be loaded.", OperationOutcome.IssueType.INVARIANT, 400);
		}
		FHIRConceptMapIndex index = new FHIRConceptMapIndex(conceptMap);
		conceptMaps.put(conceptMap.getCanonical(), index);
		logger.info("Loaded concept map {} with {} groups.", conceptMap.getCanonical(), conceptMap.getGroup().size());
	}

	public void load(ConceptMap hapiConceptMap) {
		load(new FHIRConceptMap(hapiConceptMap));
	}

	public boolean remove(String url, String version) {
		boolean removed = conceptMaps.remove(version != null ? url + "|" + version : url) != null;
		if (removed) {
			logger.info("Removed concept map {}{}.", url, version != null ? "|" + version : "");
		}
		return removed;
	}

	public List<FHIRConceptMap> findAll() {
		return conceptMaps.values().stream().map(FHIRConceptMapIndex::getConceptMap).collect(Collectors.toList());
	}

	/**
	 * Concept map by canonical. Without a version the map with the greatest version is returned.
	 */
	public Optional<FHIRConceptMapIndex> find(String mapCanonical) {
		CanonicalUri canonicalUri = CanonicalUri.parse(mapCanonical);
		if (canonicalUri == null) {
			return Optional.empty();
		}
		if (canonicalUri.isVersioned()) {
			return Optional.ofNullable(conceptMaps.get(canonicalUri.toString()));
		}
		FHIRConceptMapIndex found = null;
		for (FHIRConceptMapIndex index : conceptMaps.values()) {
			if (canonicalUri.url().equals(index.getConceptMap().getUrl())) {
				found = index;
			}
		}
		return Optional.ofNullable(found);
	}

	/**
	 * Structural checks of a loaded concept map.
	 *
	 * @return issues found, empty when the map is valid
	 */
	public List<String> validate(String mapCanonical) {
		FHIRConceptMap conceptMap = getMaps(mapCanonical).iterator().next().getConceptMap();
		List<String> issues = new ArrayList<>();
		if (conceptMap.getGroup().isEmpty()) {
			issues.add("Concept map has no groups.");
		}
		for (int i = 0; i < conceptMap.getGroup().size(); i++) {
			FHIRConceptMapGroup group = conceptMap.getGroup().get(i);
			// Source and target systems are enforced on load
			String path = format("group[%s]", i);
			if (group.getElement().isEmpty() && group.getUnmapped() == null) {
				issues.add(format("%s has no elements.", path));
			}
			for (int j = 0; j < group.getElement().size(); j++) {
				FHIRMapElement element = group.getElement().get(j);
				String elementPath = format("%s.element[%s]", path, j);
				if (element.getCode() == null) {
					issues.add(format("%s has no code.", elementPath));
				}
				for (int k = 0; k < element.getTarget().size(); k++) {
					FHIRMapTarget target = element.getTarget().get(k);
					String targetPath = format("%s.target[%s]", elementPath, k);
					if (target.getEquivalence() == null) {
						issues.add(format("%s has no equivalence.", targetPath));
					} else if (target.getEquivalence().isMapping() && target.getCode() == null) {
						issues.add(format("%s has no code, one is required for equivalence '%s'.", targetPath, target.getEquivalence().getCode()));
					}
				}
			}
			validateUnmapped(group.getUnmapped(), path, issues);
		}

		if (issues.isEmpty()) {
			logger.info("Concept map {} is valid.", conceptMap.getCanonical());
		} else {
			logger.warn("Concept map {} has {} issue(s).", conceptMap.getCanonical(), issues.size());
		}
		return issues;
	}

	private void validateUnmapped(@Nullable FHIRConceptMapGroupUnmapped unmapped, String path, List<String> issues) {
		if (unmapped == null) {
			return;
		}
		if (unmapped.getMode() == FHIRConceptMapGroupUnmapped.Mode.fixed && unmapped.getCode() == null) {
			issues.add(format("%s.unmapped has mode 'fixed' but no code.", path));
		}
		if (unmapped.getMode() == FHIRConceptMapGroupUnmapped.Mode.other_map) {
			if (unmapped.getUrl() == null) {
				issues.add(format("%s.unmapped has mode 'other-map' but no url.", path));
			} else if (find(unmapped.getUrl()).isEmpty()) {
				issues.add(format("%s.unmapped references concept map '%s' which is not loaded.", path, unmapped.getUrl()));
			}
		}
	}

	public List<TranslationMatch> translate(String sourceSystem, String sourceCode, @Nullable String targetSystem) {
		return translate(null, sourceSystem, sourceCode, targetSystem, null);
	}

	/**
	 * Direct translation through the loaded maps, or through one map when a url is given.
	 * When there is no direct mapping, configured chains through an intermediate system are tried.
	 * The equivalence of a chained match is the weaker of its two hops.
	 *
	 * @param mapUrl optional concept map canonical
	 * @param targetSystem optional, restricts matches to this system
	 */
	public List<TranslationMatch> translate(@Nullable String mapUrl, String sourceSystem, String sourceCode, @Nullable String targetSystem,
			@Nullable CancellationContext cancellation) {

		CancellationContext context = getCancellation(cancellation);
		Collection<FHIRConceptMapIndex> maps = getMaps(mapUrl);
		List<TranslationMatch> matches = translateDirect(maps, sourceSystem, sourceCode, targetSystem, true, context);

		if (matches.stream().noneMatch(match -> match.equivalence().isMapping())) {
			List<TranslationMatch> chained = translateChained(maps, sourceSystem, sourceCode, targetSystem, context);
			if (!chained.isEmpty()) {
				matches = chained;
			}
		}
		logger.debug("Translation of {}|{} to {} found {} matches.", sourceSystem, sourceCode, targetSystem, matches.size());
		return addDisplays(matches);
	}

	/**
	 * Finds the source codes that map to the given code, using the inverted index of each map.
	 *
	 * @param targetSystem system of the code being reverse translated
	 * @param sourceSystem optional, restricts results to sources in this system
	 */
	public List<TranslationMatch> reverseTranslate(@Nullable String mapUrl, String targetSystem, String targetCode, @Nullable String sourceSystem) {
		List<TranslationMatch> matches = new ArrayList<>();
		for (FHIRConceptMapIndex map : getMaps(mapUrl)) {
			for (FHIRConceptMapIndex.MapEntry source : map.getSources(targetSystem, targetCode)) {
				if (sourceSystem == null || sourceSystem.equals(source.system())) {
					matches.add(new TranslationMatch(source.system(), source.code(), source.display(), source.equivalence(), map.getCanonical()));
				}
			}
		}
		return addDisplays(matches);
	}

	private List<TranslationMatch> translateDirect(Collection<FHIRConceptMapIndex> maps, String sourceSystem, String sourceCode, @Nullable String targetSystem,
			boolean followOtherMaps, CancellationContext cancellation) {

		List<TranslationMatch> matches = new ArrayList<>();
		for (FHIRConceptMapIndex map : maps) {
			cancellation.checkpoint();
			for (FHIRConceptMapIndex.MapEntry target : Optional.ofNullable(map.getTargets(sourceSystem, sourceCode)).orElse(Collections.emptyList())) {
				if (targetSystem == null || targetSystem.equals(target.system())) {
					matches.add(new TranslationMatch(target.system(), target.code(), target.display(), target.equivalence(), map.getCanonical()));
				}
			}
			for (FHIRConceptMapGroup group : map.getConceptMap().getGroup()) {
				if (group.getUnmapped() != null && sourceSystem.equals(group.getSource())
						&& (targetSystem == null || targetSystem.equals(group.getTarget()))
						&& group.getElement().stream().noneMatch(element -> sourceCode.equals(element.getCode()))) {
					matches.addAll(translateUnmapped(map, group, sourceSystem, sourceCode, targetSystem, followOtherMaps, cancellation));
				}
			}
		}
		return matches;
	}

	private List<TranslationMatch> translateUnmapped(FHIRConceptMapIndex map, FHIRConceptMapGroup group, String sourceSystem, String sourceCode,
			@Nullable String targetSystem, boolean followOtherMaps, CancellationContext cancellation) {

		FHIRConceptMapGroupUnmapped unmapped = group.getUnmapped();
		switch (unmapped.getMode()) {
			case provided:
				return List.of(new TranslationMatch(group.getTarget(), sourceCode, null, FHIRMapEquivalence.equal, map.getCanonical()));
			case fixed:
				if (unmapped.getCode() == null) {
					return Collections.emptyList();
				}
				return List.of(new TranslationMatch(group.getTarget(), unmapped.getCode(), unmapped.getDisplay(), FHIRMapEquivalence.inexact, map.getCanonical()));
			case other_map:
				if (!followOtherMaps || unmapped.getUrl() == null) {
					return Collections.emptyList();
				}
				Optional<FHIRConceptMapIndex> otherMap = find(unmapped.getUrl());
				if (otherMap.isEmpty() || otherMap.get() == map) {
					logger.warn("Concept map {} refers unmapped codes to {} which is not loaded.", map.getCanonical(), unmapped.getUrl());
					return Collections.emptyList();
				}
				return translateDirect(List.of(otherMap.get()), sourceSystem, sourceCode, targetSystem, false, cancellation);
			default:
				return Collections.emptyList();
		}
	}

	private List<TranslationMatch> translateChained(Collection<FHIRConceptMapIndex> maps, String sourceSystem, String sourceCode, @Nullable String targetSystem,
			CancellationContext cancellation) {

		Map<String, TranslationMatch> chained = new LinkedHashMap<>();
		for (TranslationChain chain : translationChains) {
			if (!chain.sourceSystem().equals(sourceSystem) || (targetSystem != null && !chain.targetSystem().equals(targetSystem))) {
				continue;
			}
			for (TranslationMatch firstHop : translateDirect(maps, sourceSystem, sourceCode, chain.intermediateSystem(), true, cancellation)) {
				if (!firstHop.equivalence().isMapping()) {
					continue;
				}
				for (TranslationMatch secondHop : translateDirect(maps, chain.intermediateSystem(), firstHop.targetCode(), chain.targetSystem(), true, cancellation)) {
					if (!secondHop.equivalence().isMapping()) {
						continue;
					}
					TranslationMatch match = new TranslationMatch(secondHop.targetSystem(), secondHop.targetCode(), secondHop.targetDisplay(),
							firstHop.equivalence().weaker(secondHop.equivalence()), firstHop.source() + CHAIN_SEPARATOR + secondHop.source());
					String key = match.targetSystem() + "|" + match.targetCode();
					TranslationMatch existing = chained.get(key);
					// Keep the most precise route to each target
					if (existing == null || match.equivalence().ordinal() < existing.equivalence().ordinal()) {
						chained.put(key, match);
					}
				}
			}
		}
		return new ArrayList<>(chained.values());
	}

	private List<TranslationMatch> addDisplays(List<TranslationMatch> matches) {
		List<TranslationMatch> withDisplays = new ArrayList<>(matches.size());
		for (TranslationMatch match : matches) {
			if (match.targetDisplay() == null && match.targetCode() != null) {
				Optional<String> display = codeSystemService.findIndex(match.targetSystem(), null)
						.flatMap(index -> index.lookup(match.targetCode()))
						.map(FHIRConcept::getDisplay);
				withDisplays.add(display.isPresent() ? match.withDisplay(display.get()) : match);
			} else {
				withDisplays.add(match);
			}
		}
		return withDisplays;
	}

	private Collection<FHIRConceptMapIndex> getMaps(@Nullable String mapUrl) {
		if (mapUrl == null) {
			return conceptMaps.values();
		}
		return List.of(find(mapUrl).orElseThrow(() ->
				exception(format("Concept map '%s' could not be found.", mapUrl), OperationOutcome.IssueType.NOTFOUND, 404)));
	}

	private CancellationContext getCancellation(@Nullable CancellationContext cancellation) {
		return cancellation != null ? cancellation : CancellationContext.withTimeoutSeconds(terminologyConfig.getOperation().getTimeoutSeconds());
	}
}
