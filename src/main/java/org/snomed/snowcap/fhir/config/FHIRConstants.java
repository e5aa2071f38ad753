package org.snomed.snowcap.fhir.config;

public interface FHIRConstants {

	//Constant words and phrases
	String ACTIVE = "active";
	String CHILD = "child";
	String CODE = "code";
	String CODING = "coding";
	String CONCEPT = "concept";
	String COUNT = "count";
	String DEFINITION = "definition";
	String DESIGNATION = "designation";
	String DISPLAY = "display";
	String EQUIVALENCE = "equivalence";
	String INACTIVE = "inactive";
	String LANGUAGE = "language";
	String MATCH = "match";
	String MESSAGE = "message";
	String NAME = "name";
	String OFFSET = "offset";
	String OUTCOME = "outcome";
	String PARENT = "parent";
	String PIPE = "\\|";
	String PROPERTY = "property";
	String RESULT = "result";
	String SOURCE = "source";
	String STATUS = "status";
	String SUBSUMED_BY = "subsumedBy";
	String SYSTEM = "system";
	String URL = "url";
	String USE = "use";
	String VALUE = "value";
	String VERSION = "version";

	String HIERARCHY_IS_A = "is-a";
	String RETIRED = "retired";

}
