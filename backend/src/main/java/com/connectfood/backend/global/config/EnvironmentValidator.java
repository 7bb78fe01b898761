package com.connectfood.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required settings and the search/matching knobs once the application is ready.
 * Startup fails with {@link IllegalStateException} when anything is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "server.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        requirePositive(problems, "connectfood.search.default-radius-km", 10.0);
        requirePositive(problems, "connectfood.search.max-results", 100);
        requirePositive(problems, "connectfood.matching.top-k", 5);
        requirePositive(problems, "connectfood.telemetry.interval-ms", 1000);
        return problems;
    }

    private void requirePositive(List<String> problems, String key, double defaultValue) {
        String raw = environment.getProperty(key);
        if (raw == null) {
            return;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value <= 0) {
                problems.add(key + " must be positive (default " + defaultValue + ")");
            }
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number");
        }
    }
}
