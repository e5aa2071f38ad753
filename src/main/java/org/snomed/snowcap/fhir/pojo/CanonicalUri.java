package org.snomed.snowcap.fhir.pojo;

import org.jetbrains.annotations.Nullable;

/**
 * A canonical reference in the form {@code url|version}. An empty version is treated as no version.
 */
public record CanonicalUri(String url, @Nullable String version) {

	@Nullable
	public static CanonicalUri parse(@Nullable String canonical) {
		if (canonical == null) {
			return null;
		}
		int bar = canonical.indexOf('|');
		if (bar < 0) {
			return new CanonicalUri(canonical, null);
		}
		String version = canonical.substring(bar + 1);
		return new CanonicalUri(canonical.substring(0, bar), version.isEmpty() ? null : version);
	}

	public boolean isVersioned() {
		return version != null;
	}

	@Override
	public String toString() {
		return isVersioned() ? url + "|" + version : url;
	}
}
