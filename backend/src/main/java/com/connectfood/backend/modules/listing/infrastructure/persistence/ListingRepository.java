package com.connectfood.backend.modules.listing.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.connectfood.backend.modules.listing.domain.Listing;

public interface ListingRepository extends JpaRepository<Listing, UUID> {

    List<Listing> findByDonorIdOrderByCreatedAtDesc(UUID donorId, Pageable pageable);
}
