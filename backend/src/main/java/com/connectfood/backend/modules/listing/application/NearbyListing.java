package com.connectfood.backend.modules.listing.application;

import com.connectfood.backend.modules.listing.domain.Listing;

/**
 * A listing paired with its distance from the query point, rounded to two decimals.
 */
public record NearbyListing(Listing listing, double distanceKm) {
}
