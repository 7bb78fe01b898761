package com.connectfood.backend.modules.listing.presentation.dto;

import java.util.List;

public record NearbyListingsResponse(
        int count,
        List<NearbyListingResponse> items,
        boolean storeAvailable
) {
}
