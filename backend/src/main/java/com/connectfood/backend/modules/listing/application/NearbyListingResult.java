package com.connectfood.backend.modules.listing.application;

import java.util.List;

/**
 * Outcome of a proximity search. {@code count} is the number of hits before truncation.
 * A {@link Outcome#STORE_UNAVAILABLE} result always carries no items.
 */
public record NearbyListingResult(Outcome outcome, int count, List<NearbyListing> items) {

    public enum Outcome {
        OK,
        STORE_UNAVAILABLE
    }

    public NearbyListingResult {
        items = List.copyOf(items);
    }

    public static NearbyListingResult ok(int count, List<NearbyListing> items) {
        return new NearbyListingResult(Outcome.OK, count, items);
    }

    public static NearbyListingResult storeUnavailable() {
        return new NearbyListingResult(Outcome.STORE_UNAVAILABLE, 0, List.of());
    }

    public boolean storeAvailable() {
        return outcome == Outcome.OK;
    }
}
