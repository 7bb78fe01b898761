package com.connectfood.backend.modules.listing.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

import com.connectfood.backend.global.common.Decimals;
import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.geo.domain.GeoDistance;
import com.connectfood.backend.modules.listing.domain.Listing;
import com.connectfood.backend.modules.listing.infrastructure.persistence.ListingRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Proximity search over all listings: expiry filter, haversine distance, radius and status
 * filter, ascending sort, truncation. Filtering happens in memory; the store only serves
 * {@code findAll}. No wrapping transaction: store outages surface from {@code findAll} and
 * map to {@link NearbyListingResult.Outcome#STORE_UNAVAILABLE}.
 */
@Service
public class NearbyListingSearch {

    private static final Logger log = LoggerFactory.getLogger(NearbyListingSearch.class);

    private final ListingRepository listingRepository;
    private final Clock clock;
    private final int maxResults;

    public NearbyListingSearch(
            ListingRepository listingRepository,
            Clock clock,
            @Value("${connectfood.search.max-results:100}") int maxResults
    ) {
        this.listingRepository = listingRepository;
        this.clock = clock;
        this.maxResults = maxResults;
    }

    public NearbyListingResult search(Coordinate origin, double radiusKm) {
        List<Listing> listings;
        try {
            listings = listingRepository.findAll();
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Listing store unavailable, returning degraded search result: {}", ex.getMessage());
            return NearbyListingResult.storeUnavailable();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Candidate> hits = listings.stream()
                .filter(listing -> !listing.isExpiredAt(now))
                .map(listing -> new Candidate(listing, GeoDistance.kilometers(origin, listing.getLocation())))
                .filter(candidate -> candidate.distanceKm() <= radiusKm)
                .filter(candidate -> candidate.listing().getStatus() != null
                        && candidate.listing().getStatus().isSearchable())
                .sorted(Comparator.comparingDouble(Candidate::distanceKm))
                .toList();

        List<NearbyListing> items = hits.stream()
                .limit(maxResults)
                .map(candidate -> new NearbyListing(candidate.listing(), Decimals.round(candidate.distanceKm(), 2)))
                .toList();

        log.debug("Nearby search at ({}, {}) radius={}km matched {} of {} listings",
                origin.latitude(), origin.longitude(), radiusKm, hits.size(), listings.size());
        return NearbyListingResult.ok(hits.size(), items);
    }

    private record Candidate(Listing listing, double distanceKm) {
    }
}
