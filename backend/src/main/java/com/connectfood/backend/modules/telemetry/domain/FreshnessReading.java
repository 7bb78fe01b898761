package com.connectfood.backend.modules.telemetry.domain;

/**
 * One simulated sensor sample. Temperature is already rounded to one decimal.
 */
public record FreshnessReading(int freshness, double temperatureC, int humidity) {
}
