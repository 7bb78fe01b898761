package com.connectfood.backend.modules.matching.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.connectfood.backend.global.common.Uuids;
import com.connectfood.backend.global.error.ProblemException;
import com.connectfood.backend.modules.account.domain.Account;
import com.connectfood.backend.modules.account.domain.AccountRole;
import com.connectfood.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.listing.domain.Listing;
import com.connectfood.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.connectfood.backend.modules.matching.domain.Match;
import com.connectfood.backend.modules.matching.domain.MatchScore;
import com.connectfood.backend.modules.matching.domain.MatchScorer;
import com.connectfood.backend.modules.matching.infrastructure.persistence.MatchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Scores every active recipient against a listing, stores one proposed match per recipient
 * and returns the best few.
 *
 * <p>{@link #proposeMatches(String)} has no surrounding transaction: each match is saved on
 * its own, and rows written before a failure stay in place.</p>
 */
@Service
public class MatchingService {

    private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

    static final String LISTING_NOT_FOUND = "LISTING_NOT_FOUND";
    private static final int MAX_MATCH_HISTORY = 100;

    static final Comparator<Match> RANKING = Comparator.comparingDouble(Match::getScore).reversed()
            .thenComparingDouble(Match::getDistanceKm);

    private final ListingRepository listingRepository;
    private final AccountRepository accountRepository;
    private final MatchRepository matchRepository;
    private final FreshnessFactorSource freshnessFactorSource;
    private final int topK;

    public MatchingService(
            ListingRepository listingRepository,
            AccountRepository accountRepository,
            MatchRepository matchRepository,
            FreshnessFactorSource freshnessFactorSource,
            @Value("${connectfood.matching.top-k:5}") int topK
    ) {
        this.listingRepository = listingRepository;
        this.accountRepository = accountRepository;
        this.matchRepository = matchRepository;
        this.freshnessFactorSource = freshnessFactorSource;
        this.topK = topK;
    }

    public List<Match> proposeMatches(String listingId) {
        Listing listing = Uuids.tryParse(listingId)
                .flatMap(listingRepository::findById)
                .orElseThrow(() -> ProblemException.notFound(LISTING_NOT_FOUND, "Listing not found"));

        List<Account> recipients = accountRepository.findByRoleAndActiveTrue(AccountRole.RECIPIENT);
        if (recipients.isEmpty()) {
            log.info("No active recipients for listing {}", listing.getId());
            return List.of();
        }

        Coordinate origin = listing.getLocation();
        List<Match> created = new ArrayList<>(recipients.size());
        for (Account recipient : recipients) {
            MatchScore matchScore = MatchScorer.score(
                    origin,
                    recipient.getLocationOrOrigin(),
                    MatchScorer.typeMatch(listing.getType(), recipient.getPreferredCategory()),
                    freshnessFactorSource.nextFactor()
            );
            Match match = Match.propose(listing.getId(), listing.getDonorId(), recipient.getId(), matchScore);
            created.add(matchRepository.save(match));
        }

        List<Match> ranked = created.stream()
                .sorted(RANKING)
                .limit(topK)
                .toList();
        log.info("Proposed {} matches for listing {}, returning top {}", created.size(), listing.getId(), ranked.size());
        return ranked;
    }

    @Transactional(readOnly = true)
    public List<Match> getMatches(UUID userId) {
        PageRequest page = PageRequest.of(0, MAX_MATCH_HISTORY);
        if (userId == null) {
            return matchRepository.findAllByOrderByCreatedAtDesc(page);
        }
        return matchRepository.findByDonorIdOrRecipientIdOrderByCreatedAtDesc(userId, userId, page);
    }
}
