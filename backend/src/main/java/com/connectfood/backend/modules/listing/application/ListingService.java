package com.connectfood.backend.modules.listing.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.listing.domain.Listing;
import com.connectfood.backend.modules.listing.domain.ListingStatus;
import com.connectfood.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.connectfood.backend.modules.listing.presentation.dto.CreateListingRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class ListingService {

    private static final Logger log = LoggerFactory.getLogger(ListingService.class);

    static final int DEFAULT_EXPIRES_IN_MINUTES = 180;
    static final String DEFAULT_UNIT = "servings";
    private static final int MAX_DONOR_LISTINGS = 100;

    private final ListingRepository listingRepository;
    private final Clock clock;

    public ListingService(ListingRepository listingRepository, Clock clock) {
        this.listingRepository = listingRepository;
        this.clock = clock;
    }

    public Listing createListing(CreateListingRequest request) {
        int expiresInMinutes = request.expiresInMinutes() != null && request.expiresInMinutes() > 0
                ? request.expiresInMinutes()
                : DEFAULT_EXPIRES_IN_MINUTES;

        Listing listing = new Listing();
        listing.setDonorId(request.donorId());
        listing.setTitle(request.title().trim());
        listing.setDescription(StringUtils.hasText(request.description()) ? request.description().trim() : null);
        listing.setType(request.type().trim());
        listing.setQuantity(request.quantity());
        listing.setUnit(StringUtils.hasText(request.unit()) ? request.unit().trim() : DEFAULT_UNIT);
        listing.setLocation(new Coordinate(request.lat(), request.lng()));
        listing.setExpiresAt(OffsetDateTime.now(clock).plusMinutes(expiresInMinutes));
        listing.setStatus(ListingStatus.AVAILABLE);

        Listing saved = listingRepository.save(listing);
        log.info("Listing {} created by donor {} (expires {})", saved.getId(), saved.getDonorId(), saved.getExpiresAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Listing> getDonorListings(UUID donorId) {
        return listingRepository.findByDonorIdOrderByCreatedAtDesc(donorId, PageRequest.of(0, MAX_DONOR_LISTINGS));
    }
}
