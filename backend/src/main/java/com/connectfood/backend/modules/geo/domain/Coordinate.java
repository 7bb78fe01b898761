package com.connectfood.backend.modules.geo.domain;

/**
 * A point on the Earth's surface in decimal degrees.
 * Range checks happen at the request boundary; this type trusts its inputs.
 */
public record Coordinate(double latitude, double longitude) {

    public static final Coordinate ORIGIN = new Coordinate(0.0, 0.0);

    /**
     * Builds a coordinate from nullable columns; a missing component falls back to 0.
     */
    public static Coordinate ofNullable(Double latitude, Double longitude) {
        return new Coordinate(
                latitude != null ? latitude : 0.0,
                longitude != null ? longitude : 0.0
        );
    }
}
