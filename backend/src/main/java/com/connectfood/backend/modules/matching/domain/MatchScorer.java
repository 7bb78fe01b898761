package com.connectfood.backend.modules.matching.domain;

import java.util.Locale;

import com.connectfood.backend.global.common.Decimals;
import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.geo.domain.GeoDistance;

/**
 * Heuristic listing/recipient compatibility.
 *
 * <pre>
 * score = clamp01(max(0, 1 - dist / 20) * 0.7 + typeMatch * 0.2 + freshness * 0.1)
 * eta   = max(5, dist / 40 km/h * 60)
 * </pre>
 */
public final class MatchScorer {

    public static final double DISTANCE_SATURATION_KM = 20.0;
    public static final double DISTANCE_WEIGHT = 0.7;
    public static final double TYPE_WEIGHT = 0.2;
    public static final double FRESHNESS_WEIGHT = 0.1;
    public static final double TYPE_MATCHED = 1.0;
    public static final double TYPE_MISMATCHED = 0.8;
    public static final double TRAVEL_SPEED_KMH = 40.0;
    public static final double MIN_ETA_MINUTES = 5.0;

    private MatchScorer() {
    }

    public static MatchScore score(Coordinate listingLocation, Coordinate recipientLocation,
                                   double typeMatch, double freshnessFactor) {
        double distanceKm = GeoDistance.kilometers(listingLocation, recipientLocation);
        double raw = distanceTerm(distanceKm) * DISTANCE_WEIGHT
                + typeMatch * TYPE_WEIGHT
                + freshnessFactor * FRESHNESS_WEIGHT;
        double score = Decimals.round(Decimals.clamp(raw, 0.0, 1.0), 3);
        return new MatchScore(score, Decimals.round(distanceKm, 2), Decimals.round(etaMinutes(distanceKm), 1));
    }

    /**
     * Proximity in [0, 1]: 1 at the listing, 0 from {@value #DISTANCE_SATURATION_KM} km on.
     */
    public static double distanceTerm(double distanceKm) {
        return Math.max(0.0, 1.0 - distanceKm / DISTANCE_SATURATION_KM);
    }

    public static double etaMinutes(double distanceKm) {
        return Math.max(MIN_ETA_MINUTES, distanceKm / TRAVEL_SPEED_KMH * 60.0);
    }

    /**
     * Recipients without a declared preference count as matched.
     */
    public static double typeMatch(String listingType, String preferredCategory) {
        if (preferredCategory == null || preferredCategory.isBlank()) {
            return TYPE_MATCHED;
        }
        String listing = listingType == null ? "" : listingType.trim().toLowerCase(Locale.ROOT);
        String preferred = preferredCategory.trim().toLowerCase(Locale.ROOT);
        return listing.equals(preferred) ? TYPE_MATCHED : TYPE_MISMATCHED;
    }
}
