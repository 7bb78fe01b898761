package com.connectfood.backend.modules.listing.presentation.dto;

import com.connectfood.backend.modules.listing.application.NearbyListing;
import com.connectfood.backend.modules.listing.application.NearbyListingResult;
import com.connectfood.backend.modules.listing.domain.Listing;

public final class ListingDtoMapper {

    private ListingDtoMapper() {
    }

    public static ListingResponse toResponse(Listing listing) {
        return new ListingResponse(
                listing.getId(),
                listing.getDonorId(),
                listing.getTitle(),
                listing.getDescription(),
                listing.getType(),
                listing.getQuantity(),
                listing.getUnit(),
                listing.getLatitude(),
                listing.getLongitude(),
                listing.getExpiresAt(),
                listing.getStatus().code(),
                listing.getCreatedAt()
        );
    }

    public static NearbyListingResponse toNearbyResponse(NearbyListing nearby) {
        Listing listing = nearby.listing();
        return new NearbyListingResponse(
                listing.getId(),
                listing.getDonorId(),
                listing.getTitle(),
                listing.getDescription(),
                listing.getType(),
                listing.getQuantity(),
                listing.getUnit(),
                listing.getLatitude(),
                listing.getLongitude(),
                listing.getExpiresAt(),
                listing.getStatus().code(),
                listing.getCreatedAt(),
                nearby.distanceKm()
        );
    }

    public static NearbyListingsResponse toNearbyListResponse(NearbyListingResult result) {
        return new NearbyListingsResponse(
                result.count(),
                result.items().stream().map(ListingDtoMapper::toNearbyResponse).toList(),
                result.storeAvailable()
        );
    }
}
