package com.al.hl7fhirconverter.config;

import ca.uhn.fhir.context.FhirContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Singleton R4 FHIR context, shared by every conversion for encoding bundles
 * and operation outcomes.
 */
@Configuration
public class PerformanceConfig {

    @Bean
    public FhirContext fhirContext() {
        return FhirContext.forR4();
    }
}
