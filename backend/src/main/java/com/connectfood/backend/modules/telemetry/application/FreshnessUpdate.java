package com.connectfood.backend.modules.telemetry.application;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FreshnessUpdate(
        String listingId,
        int freshness,
        double temperatureC,
        int humidity,
        String timestamp
) {
}
