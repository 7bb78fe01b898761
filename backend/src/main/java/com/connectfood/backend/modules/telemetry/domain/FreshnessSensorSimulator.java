package com.connectfood.backend.modules.telemetry.domain;

import java.util.Random;

import com.connectfood.backend.global.common.Decimals;

/**
 * Random-walk stand-in for a storage sensor attached to a listing.
 * Not thread-safe; one instance per feed.
 */
public class FreshnessSensorSimulator {

    static final int MIN_FRESHNESS = 50;
    static final double MIN_TEMPERATURE_C = 0.0;
    static final int MIN_HUMIDITY = 20;
    static final int MAX_HUMIDITY = 90;

    private final Random random;
    private int freshness;
    private double temperatureC;
    private int humidity;

    public FreshnessSensorSimulator(Random random) {
        this.random = random;
        this.freshness = between(85, 99);
        this.temperatureC = Decimals.round(4.0 + 8.0 * random.nextDouble(), 1);
        this.humidity = between(40, 70);
    }

    /**
     * Drifts every value one step and returns the new sample.
     */
    public FreshnessReading next() {
        freshness = Math.max(MIN_FRESHNESS, freshness + between(-2, 1));
        temperatureC = Math.max(MIN_TEMPERATURE_C, temperatureC + (random.nextDouble() * 0.6 - 0.3));
        humidity = Math.min(MAX_HUMIDITY, Math.max(MIN_HUMIDITY, humidity + between(-2, 2)));
        return new FreshnessReading(freshness, Decimals.round(temperatureC, 1), humidity);
    }

    // inclusive on both ends
    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
