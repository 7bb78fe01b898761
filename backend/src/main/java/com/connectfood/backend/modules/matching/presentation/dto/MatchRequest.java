package com.connectfood.backend.modules.matching.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Blank or malformed ids pass through and resolve to {@code LISTING_NOT_FOUND}.
 */
public record MatchRequest(
        @NotNull(message = "listingId is required") String listingId
) {
}
