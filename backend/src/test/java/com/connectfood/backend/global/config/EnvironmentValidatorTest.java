package com.connectfood.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void acceptsCompleteConfiguration() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/connectfood")
                .withProperty("server.port", "8000")
                .withProperty("connectfood.search.default-radius-km", "10.0")
                .withProperty("connectfood.matching.top-k", "5");

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void reportsMissingDatasourceAndBadKnobs() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("server.port", "8000")
                .withProperty("connectfood.search.max-results", "0")
                .withProperty("connectfood.telemetry.interval-ms", "fast");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder(
                        "spring.datasource.url is missing",
                        "connectfood.search.max-results must be positive (default 100.0)",
                        "connectfood.telemetry.interval-ms must be a number"
                );
    }

    @Test
    void failsStartupWhenProblemsExist() {
        EnvironmentValidator validator = new EnvironmentValidator(new MockEnvironment());

        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url is missing")
                .hasMessageContaining("server.port is missing");
    }
}
