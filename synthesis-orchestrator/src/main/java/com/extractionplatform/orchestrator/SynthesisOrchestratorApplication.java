package com.extractionplatform.orchestrator;

import com.extractionplatform.orchestrator.config.SynthesisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "com.extractionplatform")
@EnableConfigurationProperties(SynthesisProperties.class)
public class SynthesisOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SynthesisOrchestratorApplication.class, args);
    }
}
