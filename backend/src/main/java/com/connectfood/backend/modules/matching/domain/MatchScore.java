package com.connectfood.backend.modules.matching.domain;

/**
 * Rounded scoring output: score to 3 decimals, distance to 2, ETA to 1.
 */
public record MatchScore(double score, double distanceKm, double routeEtaMin) {
}
