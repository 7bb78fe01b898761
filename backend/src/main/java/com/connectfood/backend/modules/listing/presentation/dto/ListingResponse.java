package com.connectfood.backend.modules.listing.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ListingResponse(
        UUID id,
        UUID donorId,
        String title,
        String description,
        String type,
        double quantity,
        String unit,
        double lat,
        double lng,
        OffsetDateTime expiresAt,
        String status,
        OffsetDateTime createdAt
) {
}
