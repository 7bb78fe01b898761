package com.connectfood.backend.modules.geo.domain;

/**
 * Great-circle distance on a spherical Earth (haversine).
 * Longitude wraparound at ±180 is not normalised.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    public static double kilometers(Coordinate a, Coordinate b) {
        double phi1 = Math.toRadians(a.latitude());
        double phi2 = Math.toRadians(b.latitude());
        double deltaPhi = Math.toRadians(b.latitude() - a.latitude());
        double deltaLambda = Math.toRadians(b.longitude() - a.longitude());

        double sinHalfPhi = Math.sin(deltaPhi / 2);
        double sinHalfLambda = Math.sin(deltaLambda / 2);
        double h = sinHalfPhi * sinHalfPhi
                + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }
}
