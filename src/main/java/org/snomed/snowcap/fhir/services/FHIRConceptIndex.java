package org.snomed.snowcap.fhir.services;

import org.hl7.fhir.r4.model.OperationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.fhir.domain.FHIRCodeSystemVersion;
import org.snomed.snowcap.fhir.domain.FHIRConcept;
import org.snomed.snowcap.fhir.domain.FHIRProperty;
import org.snomed.snowcap.fhir.domain.FHIRPropertyType;
import org.snomed.snowcap.fhir.exceptions.CyclicHierarchyException;
import org.snomed.snowcap.fhir.exceptions.MalformedHierarchyException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Read only index of read only copies of the concepts of one code system version with their hierarchy.
 * Ancestor and descendant sets are computed on first use and memoized for the life of the index.
 */
public class FHIRConceptIndex {

	private final FHIRCodeSystemVersion codeSystemVersion;

	private final Map<String, FHIRConcept> concepts;

	private final FHIRGraphBuilder graph;

	// Property codes used by at least one concept
	private final Set<String> propertyCodes;

	private final Map<String, Set<String>> ancestors = new ConcurrentHashMap<>();

	private final Map<String, Set<String>> descendants = new ConcurrentHashMap<>();

	private static final Logger logger = LoggerFactory.getLogger(FHIRConceptIndex.class);

	private FHIRConceptIndex(FHIRCodeSystemVersion codeSystemVersion, Map<String, FHIRConcept> concepts, FHIRGraphBuilder graph) {
		this.codeSystemVersion = codeSystemVersion;
		this.concepts = concepts;
		this.graph = graph;
		Set<String> codes = new HashSet<>();
		for (FHIRConcept concept : concepts.values()) {
			codes.addAll(concept.getProperties().keySet());
		}
		propertyCodes = Collections.unmodifiableSet(codes);
	}

	/**
	 * @throws MalformedHierarchyException if a concept declares a parent that is not in the list
	 * @throws CyclicHierarchyException if the parent links contain a loop
	 */
	public static FHIRConceptIndex build(FHIRCodeSystemVersion codeSystemVersion, Collection<FHIRConcept> conceptList) {
		String system = codeSystemVersion.getUrl();
		Map<String, FHIRConcept> concepts = new LinkedHashMap<>();
		for (FHIRConcept concept : conceptList) {
			if (concepts.put(concept.getCode(), concept.readOnlyCopy()) != null) {
				throw exception(format("Code '%s' occurs more than once in code system '%s'.", concept.getCode(), codeSystemVersion.getCanonical()),
						OperationOutcome.IssueType.INVALID, 400);
			}
		}

		FHIRGraphBuilder graph = new FHIRGraphBuilder();
		for (FHIRConcept concept : concepts.values()) {
			graph.addNode(concept.getCode());
			for (String parent : concept.getParents()) {
				if (!concepts.containsKey(parent)) {
					throw new MalformedHierarchyException(system, concept.getCode(), parent);
				}
				graph.addParent(concept.getCode(), parent);
			}
		}
		List<String> loop = graph.findLoop();
		if (!loop.isEmpty()) {
			throw new CyclicHierarchyException(system, loop);
		}
		logger.debug("Built concept index for {} with {} concepts.", codeSystemVersion, concepts.size());
		return new FHIRConceptIndex(codeSystemVersion, Collections.unmodifiableMap(concepts), graph);
	}

	public Optional<FHIRConcept> lookup(String code) {
		return Optional.ofNullable(code != null ? concepts.get(code) : null);
	}

	public boolean contains(String code) {
		return code != null && concepts.containsKey(code);
	}

	/**
	 * Transitive closure over the declared parents. Empty for root concepts and unknown codes.
	 */
	public Set<String> ancestorsOf(String code) {
		if (!contains(code)) {
			return Collections.emptySet();
		}
		Set<String> result = ancestors.get(code);
		if (result == null) {
			result = Collections.unmodifiableSet(graph.getTransitiveClosure(code));
			ancestors.putIfAbsent(code, result);
		}
		return result;
	}

	/**
	 * All concepts that have the code as an ancestor. Empty for leaf concepts and unknown codes.
	 */
	public Set<String> descendantsOf(String code) {
		if (!contains(code)) {
			return Collections.emptySet();
		}
		Set<String> result = descendants.get(code);
		if (result == null) {
			result = Collections.unmodifiableSet(graph.getDescendants(code));
			descendants.putIfAbsent(code, result);
		}
		return result;
	}

	public boolean isA(String code, String candidateAncestor) {
		return Objects.equals(candidateAncestor, code) || ancestorsOf(code).contains(candidateAncestor);
	}

	public Collection<String> getParents(String code) {
		return graph.getParents(code);
	}

	public Collection<String> getChildren(String code) {
		return graph.getChildren(code);
	}

	/**
	 * Concepts in the order they were loaded.
	 */
	public Collection<FHIRConcept> getConcepts() {
		return concepts.values();
	}

	public Set<String> getCodes() {
		return concepts.keySet();
	}

	public Set<String> getPropertyCodes() {
		return propertyCodes;
	}

	/**
	 * Type of a property: the declared type, else the type of the first value found on a concept.
	 */
	public FHIRPropertyType getPropertyType(String propertyCode) {
		FHIRPropertyType declared = codeSystemVersion.getPropertyTypes().get(propertyCode);
		if (declared != null) {
			return declared;
		}
		for (FHIRConcept concept : concepts.values()) {
			List<FHIRProperty> values = concept.getProperty(propertyCode);
			if (!values.isEmpty()) {
				return values.get(0).getType();
			}
		}
		return null;
	}

	public int size() {
		return concepts.size();
	}

	public FHIRCodeSystemVersion getCodeSystemVersion() {
		return codeSystemVersion;
	}

	public String getSystem() {
		return codeSystemVersion.getUrl();
	}
}
