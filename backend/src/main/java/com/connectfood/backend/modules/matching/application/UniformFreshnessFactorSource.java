package com.connectfood.backend.modules.matching.application;

import java.util.Random;

/**
 * Draws the freshness factor uniformly from [0.85, 1.0]. Each call is independent.
 */
public class UniformFreshnessFactorSource implements FreshnessFactorSource {

    public static final double MIN_FACTOR = 0.85;
    public static final double MAX_FACTOR = 1.0;

    private final Random random;

    public UniformFreshnessFactorSource(Random random) {
        this.random = random;
    }

    @Override
    public double nextFactor() {
        return MIN_FACTOR + (MAX_FACTOR - MIN_FACTOR) * random.nextDouble();
    }
}
