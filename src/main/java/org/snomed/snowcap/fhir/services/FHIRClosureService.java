package org.snomed.snowcap.fhir.services;

import org.apache.commons.lang3.StringUtils;
import org.hl7.fhir.r4.model.OperationOutcome;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.core.util.OperationTimer;
import org.snomed.snowcap.fhir.config.FHIRTerminologyConfig;
import org.snomed.snowcap.fhir.domain.ClosureTable;
import org.snomed.snowcap.fhir.domain.FHIRMapEquivalence;
import org.snomed.snowcap.fhir.pojo.ClosureRow;
import org.snomed.snowcap.fhir.pojo.ClosureUpdate;
import org.snomed.snowcap.fhir.pojo.SystemCode;
import org.snomed.snowcap.fhir.pojo.TranslationMatch;
import org.snomed.snowcap.fhir.services.context.CancellationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static org.snomed.snowcap.fhir.services.FHIRHelper.exception;

/**
 * Named closure tables that grow as clients register concepts. Each update returns only the rows it added.
 * <p>
 * Updates of one table are serialised by the table lock, tables with different names are independent.
 * Rows read "concept2 {equivalence} concept1": for subsumption concept1 is the more specific concept,
 * for concept map rows concept1 is the source of the mapping.
 */
@Service
public class FHIRClosureService {

	@Autowired
	private FHIRCodeSystemService codeSystemService;

	@Autowired
	private FHIRConceptMapService conceptMapService;

	@Autowired
	private FHIRTerminologyConfig terminologyConfig;

	private final Map<String, ClosureTable> tables = new ConcurrentHashMap<>();

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/**
	 * Creates the table if it does not exist yet.
	 * @return the current version of the table
	 */
	public int initialise(String name) {
		requireName(name);
		return getOrCreate(name).getVersion();
	}

	public ClosureUpdate updateClosure(String name, Collection<SystemCode> newCodes) {
		return updateClosure(name, newCodes, null);
	}

	/**
	 * Registers concepts with the table and returns the rows this call added to it.
	 * Concepts already registered are ignored, so repeating a call returns no rows.
	 * Pairs involving a concept that can not be resolved are skipped and a warning is recorded.
	 * If the call is cancelled the table is left unchanged.
	 */
	public ClosureUpdate updateClosure(String name, Collection<SystemCode> newCodes, @Nullable CancellationContext cancellation) {
		requireName(name);
		int maxConcepts = terminologyConfig.getClosure().getMaxConceptsPerCall();
		if (newCodes.size() > maxConcepts) {
			throw exception(format("Too many concepts in one closure call, the maximum is %s.", maxConcepts), OperationOutcome.IssueType.TOOCOSTLY, 400);
		}
		CancellationContext context = cancellation != null ? cancellation :
				CancellationContext.withTimeoutSeconds(terminologyConfig.getOperation().getTimeoutSeconds());

		while (true) {
			ClosureTable table = getOrCreate(name);
			table.getLock().lock();
			try {
				if (tables.get(name) != table) {
					// Reset while waiting for the lock
					continue;
				}
				return doUpdate(table, newCodes, context);
			} finally {
				table.getLock().unlock();
			}
		}
	}

	private ClosureUpdate doUpdate(ClosureTable table, Collection<SystemCode> newCodes, CancellationContext cancellation) {
		Set<SystemCode> added = new LinkedHashSet<>(newCodes);
		added.removeAll(table.getConcepts());
		if (added.isEmpty()) {
			return new ClosureUpdate(table.getName(), table.getVersion(), Collections.emptyList());
		}

		OperationTimer timer = new OperationTimer(logger, "Closure " + table.getName() + " update", 1000);
		List<String> warnings = new ArrayList<>();
		Set<SystemCode> resolvable = new HashSet<>();
		for (SystemCode code : added) {
			if (isResolvable(code)) {
				resolvable.add(code);
			} else {
				String warning = format("Concept %s could not be resolved, subsumption rows for it were skipped.", code);
				logger.warn("Closure {}: {}", table.getName(), warning);
				warnings.add(warning);
			}
		}
		for (SystemCode code : table.getConcepts()) {
			if (isResolvable(code)) {
				resolvable.add(code);
			}
		}

		List<SystemCode> all = new ArrayList<>(table.getConcepts());
		Set<ClosureRow> newRows = new LinkedHashSet<>();
		for (SystemCode b : added) {
			cancellation.checkpoint();
			for (SystemCode a : all) {
				ClosureRow row = getRelationship(a, b, resolvable);
				if (row != null && !table.containsRow(row)) {
					newRows.add(row);
				}
			}
			all.add(b);
		}
		cancellation.checkpoint();
		timer.stage("subsumption");

		int version = table.append(added, newRows, warnings);
		timer.finish();
		logger.debug("Closure {} version {}: {} concepts added, {} rows added.", table.getName(), version, added.size(), newRows.size());
		return new ClosureUpdate(table.getName(), version, List.copyOf(newRows));
	}

	/**
	 * Relationship between two different concepts, or null if there is none.
	 * The result does not depend on the order of the arguments.
	 */
	@Nullable
	ClosureRow getRelationship(SystemCode a, SystemCode b, Set<SystemCode> resolvable) {
		if (a.equals(b)) {
			return null;
		}
		// Order the pair so that the same row is produced whichever concept was registered first
		SystemCode first = a.compareTo(b) <= 0 ? a : b;
		SystemCode second = first == a ? b : a;

		if (Objects.equals(first.system(), second.system())) {
			if (!resolvable.contains(first) || !resolvable.contains(second)) {
				return null;
			}
			if (Objects.equals(first.code(), second.code())) {
				// Versions are compared as resolved, no version means the latest loaded one
				if (Objects.equals(resolvedVersion(first), resolvedVersion(second))) {
					return null;
				}
				return new ClosureRow(first, second, FHIRMapEquivalence.equal);
			}
			FHIRConceptIndex index = codeSystemService.getIndex(first.system(), first.version());
			if (!index.contains(second.code())) {
				return null;
			}
			if (index.isA(first.code(), second.code())) {
				return new ClosureRow(first, second, FHIRMapEquivalence.subsumes);
			}
			if (index.isA(second.code(), first.code())) {
				return new ClosureRow(second, first, FHIRMapEquivalence.subsumes);
			}
			return null;
		}

		ClosureRow mapped = getMappedRelationship(first, second);
		return mapped != null ? mapped : getMappedRelationship(second, first);
	}

	@Nullable
	private ClosureRow getMappedRelationship(SystemCode source, SystemCode target) {
		for (TranslationMatch match : conceptMapService.translate(source.system(), source.code(), target.system())) {
			if (target.code().equals(match.targetCode()) && match.equivalence().isMapping()) {
				return new ClosureRow(source, target, match.equivalence());
			}
		}
		return null;
	}

	@Nullable
	private String resolvedVersion(SystemCode code) {
		return codeSystemService.getIndex(code.system(), code.version()).getCodeSystemVersion().getVersion();
	}

	private boolean isResolvable(SystemCode code) {
		return codeSystemService.findIndex(code.system(), code.version())
				.map(index -> index.contains(code.code()))
				.orElse(false);
	}

	/**
	 * All rows added after the given version, for a client that needs to catch up.
	 */
	public ClosureUpdate getRowsSince(String name, int sinceVersion) {
		ClosureTable table = getTable(name);
		table.getLock().lock();
		try {
			return new ClosureUpdate(name, table.getVersion(), table.getRowsSince(sinceVersion));
		} finally {
			table.getLock().unlock();
		}
	}

	/**
	 * Destroys the table. The next call with the same name starts a new, empty table.
	 */
	public boolean reset(String name) {
		ClosureTable removed = tables.remove(name);
		if (removed != null) {
			logger.info("Closure table {} reset.", name);
		}
		return removed != null;
	}

	public Set<String> getClosureNames() {
		return new TreeSet<>(tables.keySet());
	}

	public List<String> getWarnings(String name) {
		ClosureTable table = getTable(name);
		table.getLock().lock();
		try {
			return table.getWarnings();
		} finally {
			table.getLock().unlock();
		}
	}

	public Optional<Integer> getVersion(String name) {
		return Optional.ofNullable(tables.get(name)).map(table -> {
			table.getLock().lock();
			try {
				return table.getVersion();
			} finally {
				table.getLock().unlock();
			}
		});
	}

	private ClosureTable getOrCreate(String name) {
		return tables.computeIfAbsent(name, key -> {
			logger.info("Closure table {} created.", key);
			return new ClosureTable(key);
		});
	}

	private ClosureTable getTable(String name) {
		ClosureTable table = tables.get(name);
		if (table == null) {
			throw exception(format("Closure table '%s' has not been initialised.", name), OperationOutcome.IssueType.NOTFOUND, 404);
		}
		return table;
	}

	private static void requireName(String name) {
		if (StringUtils.isBlank(name)) {
			throw exception("A closure name is required.", OperationOutcome.IssueType.REQUIRED, 400);
		}
	}
}
