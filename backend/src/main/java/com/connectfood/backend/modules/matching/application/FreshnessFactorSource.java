package com.connectfood.backend.modules.matching.application;

/**
 * Supplies the recency/engagement factor mixed into each match score.
 * Implementations return values in [0.85, 1.0].
 */
@FunctionalInterface
public interface FreshnessFactorSource {

    double nextFactor();
}
