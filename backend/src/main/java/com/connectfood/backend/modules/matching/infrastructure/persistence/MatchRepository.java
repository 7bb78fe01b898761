package com.connectfood.backend.modules.matching.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.connectfood.backend.modules.matching.domain.Match;

public interface MatchRepository extends JpaRepository<Match, UUID> {

    List<Match> findByListingId(UUID listingId);

    List<Match> findByDonorIdOrRecipientIdOrderByCreatedAtDesc(UUID donorId, UUID recipientId, Pageable pageable);

    List<Match> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
