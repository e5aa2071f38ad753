package org.snomed.snowcap.fhir.config;

import ca.uhn.fhir.context.FhirContext;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FHIRConfig {

	@Bean
	public FhirContext fhirContext() {
		return FhirContext.forR4();
	}

	@Bean
	@ConfigurationProperties(prefix = "fhir.terminology")
	public FHIRTerminologyConfig getFhirTerminologyConfig() {
		return new FHIRTerminologyConfig();
	}

}
