package com.connectfood.backend.modules.matching.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.geo.domain.GeoDistance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatchScorerTest {

    private static final Coordinate LISTING = new Coordinate(17.3850, 78.4867);

    @Test
    @DisplayName("co-located recipient with full type match scores distance 0.7 + type 0.2 + freshness share")
    void colocatedRecipient() {
        MatchScore score = MatchScorer.score(LISTING, LISTING, 1.0, 0.9);

        assertThat(score.distanceKm()).isZero();
        assertThat(score.score()).isEqualTo(0.99);
        assertThat(score.routeEtaMin()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("distance term vanishes from 20 km on")
    void distanceTermSaturates() {
        assertThat(MatchScorer.distanceTerm(0.0)).isEqualTo(1.0);
        assertThat(MatchScorer.distanceTerm(10.0)).isEqualTo(0.5);
        assertThat(MatchScorer.distanceTerm(20.0)).isZero();
        assertThat(MatchScorer.distanceTerm(250.0)).isZero();
    }

    @Test
    @DisplayName("far recipient keeps only the type and freshness share")
    void farRecipient() {
        Coordinate far = new Coordinate(LISTING.latitude() + 1.0, LISTING.longitude());

        MatchScore score = MatchScorer.score(LISTING, far, 0.8, 1.0);

        assertThat(score.score()).isEqualTo(0.26);
        assertThat(score.distanceKm()).isEqualTo(111.19);
    }

    @Test
    @DisplayName("ETA is 40 km/h travel time with a five minute floor")
    void etaFloorAndSpeed() {
        assertThat(MatchScorer.etaMinutes(1.0)).isEqualTo(5.0);
        assertThat(MatchScorer.etaMinutes(20.0)).isEqualTo(30.0);
    }

    @Test
    @DisplayName("score, distance and ETA are rounded to 3, 2 and 1 decimals")
    void roundedOutputs() {
        Coordinate recipient = new Coordinate(17.4399, 78.4983);
        double exact = GeoDistance.kilometers(LISTING, recipient);

        MatchScore score = MatchScorer.score(LISTING, recipient, 1.0, 0.873);

        assertThat(score.distanceKm()).isEqualTo(Math.round(exact * 100.0) / 100.0);
        assertThat(score.score() * 1000).isCloseTo(Math.rint(score.score() * 1000), within(1e-9));
        assertThat(score.routeEtaMin() * 10).isCloseTo(Math.rint(score.routeEtaMin() * 10), within(1e-9));
        assertThat(score.score()).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("recipients without a preferred category always count as matched")
    void typeMatchWithoutPreference() {
        assertThat(MatchScorer.typeMatch("bakery", null)).isEqualTo(1.0);
        assertThat(MatchScorer.typeMatch("bakery", " ")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("preferred category is compared case-insensitively with the listing type")
    void typeMatchWithPreference() {
        assertThat(MatchScorer.typeMatch("Bakery", "bakery")).isEqualTo(1.0);
        assertThat(MatchScorer.typeMatch("cooked", "bakery")).isEqualTo(0.8);
        assertThat(MatchScorer.typeMatch(null, "bakery")).isEqualTo(0.8);
    }
}
