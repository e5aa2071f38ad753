package org.snomed.snowcap.fhir.pojo;

public record ExpansionContains(String system, String version, String code, String display, boolean inactive) {
}
