package org.snomed.snowcap.fhir.pojo;

import org.hl7.fhir.r4.model.Coding;

import java.util.Comparator;

/**
 * Concept identity: code system URI, optional version and code.
 */
public record SystemCode(String system, String version, String code) implements Comparable<SystemCode> {

	private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

	private static final Comparator<SystemCode> ORDER = Comparator.comparing(SystemCode::system, NULLS_FIRST)
			.thenComparing(SystemCode::code, NULLS_FIRST)
			.thenComparing(SystemCode::version, NULLS_FIRST);

	public SystemCode(String system, String code) {
		this(system, null, code);
	}

	public static SystemCode fromCoding(Coding coding) {
		return new SystemCode(coding.getSystem(), coding.getVersion(), coding.getCode());
	}

	@Override
	public int compareTo(SystemCode other) {
		return ORDER.compare(this, other);
	}

	@Override
	public String toString() {
		return (version != null ? system + "|" + version : system) + "#" + code;
	}
}
