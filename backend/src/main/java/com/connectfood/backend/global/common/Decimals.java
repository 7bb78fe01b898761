package com.connectfood.backend.global.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounds API-visible numbers. Uses the exact binary value of the double and half-even
 * rounding so {@code round(2.675, 2)} yields {@code 2.67}, the same as the mobile client.
 */
public final class Decimals {

    private Decimals() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
