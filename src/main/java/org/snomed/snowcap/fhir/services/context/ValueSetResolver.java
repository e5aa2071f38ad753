package org.snomed.snowcap.fhir.services.context;

import org.jetbrains.annotations.Nullable;
import org.snomed.snowcap.fhir.domain.FHIRValueSet;

/**
 * Finds the definition of a value set referenced from a compose rule.
 */
@FunctionalInterface
public interface ValueSetResolver {

	/**
	 * @param valueSetCanonical url, optionally followed by '|' and a version
	 * @return the value set, or null if it is not known
	 */
	@Nullable
	FHIRValueSet resolve(String valueSetCanonical);

}
