package org.snomed.snowcap.fhir.domain;

import org.snomed.snowcap.fhir.pojo.ClosureRow;
import org.snomed.snowcap.fhir.pojo.SystemCode;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one named closure table. Concepts and rows are only ever added.
 * All access must hold the table lock.
 */
public class ClosureTable {

	private final String name;

	private final Set<SystemCode> concepts = new LinkedHashSet<>();

	// Row -> table version that added it
	private final Map<ClosureRow, Integer> rows = new LinkedHashMap<>();

	private final List<String> warnings = new ArrayList<>();

	private int version;

	private final ReentrantLock lock = new ReentrantLock();

	public ClosureTable(String name) {
		this.name = name;
	}

	public ReentrantLock getLock() {
		return lock;
	}

	/**
	 * @return the new table version
	 */
	public int append(Collection<SystemCode> addedConcepts, Collection<ClosureRow> newRows, Collection<String> newWarnings) {
		version++;
		concepts.addAll(addedConcepts);
		for (ClosureRow row : newRows) {
			rows.putIfAbsent(row, version);
		}
		warnings.addAll(newWarnings);
		return version;
	}

	public boolean containsRow(ClosureRow row) {
		return rows.containsKey(row);
	}

	public List<ClosureRow> getRowsSince(int sinceVersion) {
		List<ClosureRow> since = new ArrayList<>();
		rows.forEach((row, rowVersion) -> {
			if (rowVersion > sinceVersion) {
				since.add(row);
			}
		});
		return since;
	}

	public String getName() {
		return name;
	}

	public Set<SystemCode> getConcepts() {
		return Collections.unmodifiableSet(concepts);
	}

	public List<String> getWarnings() {
		return List.copyOf(warnings);
	}

	public int getVersion() {
		return version;
	}
}
