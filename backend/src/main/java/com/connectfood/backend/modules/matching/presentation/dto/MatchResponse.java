package com.connectfood.backend.modules.matching.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.connectfood.backend.modules.matching.domain.Match;

public record MatchResponse(
        UUID id,
        UUID listingId,
        UUID donorId,
        UUID recipientId,
        double score,
        double distanceKm,
        double routeEtaMin,
        String status,
        OffsetDateTime createdAt
) {

    public static MatchResponse from(Match match) {
        return new MatchResponse(
                match.getId(),
                match.getListingId(),
                match.getDonorId(),
                match.getRecipientId(),
                match.getScore(),
                match.getDistanceKm(),
                match.getRouteEtaMin(),
                match.getStatus().code(),
                match.getCreatedAt()
        );
    }
}
