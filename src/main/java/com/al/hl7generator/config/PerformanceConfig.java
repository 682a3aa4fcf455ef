package com.al.hl7generator.config;

import ca.uhn.hl7v2.DefaultHapiContext;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.parser.GenericModelClassFactory;
import ca.uhn.hl7v2.validation.impl.NoValidation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared, expensive-to-create infrastructure beans.
 */
@Configuration
public class PerformanceConfig {

    /**
     * Singleton HL7 v2 context - thread-safe and reusable.
     * Generic model classes let any generated structure be parsed back without
     * version specific message classes on the classpath.
     */
    @Bean
    public HapiContext hapiContext() {
        DefaultHapiContext ctx = new DefaultHapiContext();
        ctx.setModelClassFactory(new GenericModelClassFactory());

        // Synthetic messages only need to be structurally sound
        ctx.setValidationContext(new NoValidation());
        return ctx;
    }

    /**
     * Reference clock for generated timestamps; replaced by a fixed clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
