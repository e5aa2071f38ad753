package org.snomed.snowcap.fhir.pojo;

import java.util.List;

/**
 * Rows appended to a closure table by one call, and the table version after the call.
 */
public record ClosureUpdate(String name, int version, List<ClosureRow> rows) {
}
