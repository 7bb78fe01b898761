package com.connectfood.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under each module's {@code infrastructure.persistence} package. Audit
 * timestamps come from the {@code utcOffsetDateTimeProvider} bean in {@code TimeConfig}.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.connectfood.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = "utcOffsetDateTimeProvider")
public class JpaConfig {
}
