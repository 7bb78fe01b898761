package com.connectfood.backend.modules.listing.presentation.dto;

import java.util.List;

public record ListingListResponse(List<ListingResponse> items) {
}
