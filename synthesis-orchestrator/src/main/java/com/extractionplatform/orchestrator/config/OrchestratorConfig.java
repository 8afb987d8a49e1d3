package com.extractionplatform.orchestrator.config;

import com.extractionplatform.common.synthesis.SynthesisComponents;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Config tables are validated here, so a bad application.yml fails startup. */
    @Bean
    public SynthesisComponents synthesisComponents(SynthesisProperties properties, Clock clock) {
        return SynthesisComponents.create(properties.toConfig(), clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
