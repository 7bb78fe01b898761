package com.connectfood.backend.modules.matching.application;

import java.security.SecureRandom;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatchingConfig {

    @Bean
    public FreshnessFactorSource freshnessFactorSource() {
        return new UniformFreshnessFactorSource(new SecureRandom());
    }
}
