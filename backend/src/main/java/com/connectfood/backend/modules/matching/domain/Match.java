package com.connectfood.backend.modules.matching.domain;

import java.util.UUID;

import com.connectfood.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A proposed donor/recipient pairing for one listing. Score, distance and ETA are fixed
 * when the row is written.
 */
@Entity
@Table(name = "food_match")
public class Match extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "listing_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID listingId;

    @Column(name = "donor_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID donorId;

    @Column(name = "recipient_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID recipientId;

    @Column(name = "score", nullable = false, updatable = false)
    private double score;

    @Column(name = "distance_km", nullable = false, updatable = false)
    private double distanceKm;

    @Column(name = "route_eta_min", nullable = false, updatable = false)
    private double routeEtaMin;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private MatchStatus status = MatchStatus.PROPOSED;

    protected Match() {
    }

    public static Match propose(UUID listingId, UUID donorId, UUID recipientId, MatchScore matchScore) {
        Match match = new Match();
        match.listingId = listingId;
        match.donorId = donorId;
        match.recipientId = recipientId;
        match.score = matchScore.score();
        match.distanceKm = matchScore.distanceKm();
        match.routeEtaMin = matchScore.routeEtaMin();
        match.status = MatchStatus.PROPOSED;
        return match;
    }

    public UUID getId() {
        return id;
    }

    public UUID getListingId() {
        return listingId;
    }

    public UUID getDonorId() {
        return donorId;
    }

    public UUID getRecipientId() {
        return recipientId;
    }

    public double getScore() {
        return score;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public double getRouteEtaMin() {
        return routeEtaMin;
    }

    public MatchStatus getStatus() {
        return status;
    }
}
