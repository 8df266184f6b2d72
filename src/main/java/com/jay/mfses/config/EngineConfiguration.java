package com.jay.mfses.config;

import com.jay.mfses.layer3_composite.ScoringEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the engine from the validated scoring section of config.yaml. */
@Configuration
public class EngineConfiguration {

    @Bean
    public ScoringEngine scoringEngine(MfsesConfig config) {
        return new ScoringEngine(config.scoring());
    }
}
