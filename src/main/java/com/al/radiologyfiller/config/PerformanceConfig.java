package com.al.radiologyfiller.config;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.hl7v2.DefaultHapiContext;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.parser.CanonicalModelClassFactory;
import ca.uhn.hl7v2.validation.impl.NoValidation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Singleton FHIR and HL7 contexts. Both are thread-safe and expensive to create.
 */
@Configuration
public class PerformanceConfig {

    /**
     * FHIR R4 context shared by the mappers and the FHIR endpoints.
     */
    @Bean
    public FhirContext fhirContext() {
        FhirContext ctx = FhirContext.forR4();
        ctx.getParserOptions().setStripVersionsFromReferences(false);
        ctx.getParserOptions().setOverrideResourceIdWithBundleEntryFullUrl(false);
        return ctx;
    }

    /**
     * HL7 v2 context used for ACK generation and the MLLP listener. Every inbound version is read
     * with the 2.5 structures; real-world messages are accepted without validation.
     */
    @Bean(destroyMethod = "close")
    public HapiContext hapiContext() {
        DefaultHapiContext ctx = new DefaultHapiContext();
        ctx.setModelClassFactory(new CanonicalModelClassFactory("2.5"));
        ctx.setValidationContext(new NoValidation());
        return ctx;
    }

    /**
     * Source of "today" for accession numbers and timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
