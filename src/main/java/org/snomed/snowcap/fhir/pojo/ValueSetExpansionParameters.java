package org.snomed.snowcap.fhir.pojo;

import org.snomed.snowcap.fhir.services.context.CancellationContext;

/**
 * Paging and limits of a single expansion. Null values fall back to the configured defaults.
 */
public final class ValueSetExpansionParameters {

	private final Integer offset;
	private final Integer count;
	private final Boolean activeOnly;
	private final Integer maxEntries;
	private final CancellationContext cancellation;

	public ValueSetExpansionParameters(Integer offset, Integer count, Boolean activeOnly) {
		this(offset, count, activeOnly, null, null);
	}

	public ValueSetExpansionParameters(Integer offset, Integer count, Boolean activeOnly, Integer maxEntries, CancellationContext cancellation) {
		this.offset = offset;
		this.count = count;
		this.activeOnly = activeOnly;
		this.maxEntries = maxEntries;
		this.cancellation = cancellation;
	}

	public static ValueSetExpansionParameters defaults() {
		return new ValueSetExpansionParameters(null, null, null);
	}

	public ValueSetExpansionParameters withMaxEntries(Integer maxEntries) {
		return new ValueSetExpansionParameters(offset, count, activeOnly, maxEntries, cancellation);
	}

	public ValueSetExpansionParameters withCancellation(CancellationContext cancellation) {
		return new ValueSetExpansionParameters(offset, count, activeOnly, maxEntries, cancellation);
	}

	public Integer getOffset() {
		return offset;
	}

	public Integer getCount() {
		return count;
	}

	public Boolean getActiveOnly() {
		return activeOnly;
	}

	public boolean isActiveOnly() {
		return Boolean.TRUE.equals(activeOnly);
	}

	public Integer getMaxEntries() {
		return maxEntries;
	}

	public CancellationContext getCancellation() {
		return cancellation;
	}
}
