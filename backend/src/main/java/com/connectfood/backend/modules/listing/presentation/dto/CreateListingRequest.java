package com.connectfood.backend.modules.listing.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateListingRequest(
        @NotNull(message = "donorId is required")
        UUID donorId,
        @NotBlank(message = "title is required")
        @Size(max = 120, message = "title must be at most 120 characters")
        String title,
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description,
        @NotBlank(message = "type is required")
        @Size(max = 60, message = "type must be at most 60 characters")
        String type,
        @NotNull(message = "quantity is required")
        @Positive(message = "quantity must be positive")
        Double quantity,
        @Size(max = 32, message = "unit must be at most 32 characters")
        String unit,
        @NotNull(message = "lat is required")
        @DecimalMin(value = "-90.0", message = "lat must be >= -90")
        @DecimalMax(value = "90.0", message = "lat must be <= 90")
        Double lat,
        @NotNull(message = "lng is required")
        @DecimalMin(value = "-180.0", message = "lng must be >= -180")
        @DecimalMax(value = "180.0", message = "lng must be <= 180")
        Double lng,
        Integer expiresInMinutes
) {
}
