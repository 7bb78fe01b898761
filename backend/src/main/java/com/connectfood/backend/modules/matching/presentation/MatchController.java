package com.connectfood.backend.modules.matching.presentation;

import java.util.List;

import com.connectfood.backend.global.common.Uuids;
import com.connectfood.backend.modules.matching.application.MatchingService;
import com.connectfood.backend.modules.matching.domain.Match;
import com.connectfood.backend.modules.matching.presentation.dto.MatchListResponse;
import com.connectfood.backend.modules.matching.presentation.dto.MatchRequest;
import com.connectfood.backend.modules.matching.presentation.dto.MatchResponse;
import com.connectfood.backend.modules.matching.presentation.dto.ProposedMatchesResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class MatchController {

    private final MatchingService matchingService;

    public MatchController(MatchingService matchingService) {
        this.matchingService = matchingService;
    }

    @Operation(
            summary = "Match recipients to a listing",
            description = """
                    Scores every active recipient, stores one `proposed` match per recipient and \
                    returns the five best, highest score first, nearer recipient first on ties.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Top matches (possibly empty)"),
            @ApiResponse(responseCode = "404", description = "Listing not found – code `LISTING_NOT_FOUND`")
    })
    @PostMapping("/match")
    public ResponseEntity<ProposedMatchesResponse> computeMatches(@Valid @RequestBody MatchRequest request) {
        return ResponseEntity.ok(new ProposedMatchesResponse(
                matchingService.proposeMatches(request.listingId()).stream()
                        .map(MatchResponse::from)
                        .toList()
        ));
    }

    @Operation(
            summary = "Match history",
            description = """
                    Latest 100 matches, newest first. With `user_id` only matches where the user is \
                    donor or recipient; an id that is not a UUID matches nothing.
                    """
    )
    @GetMapping("/matches")
    public ResponseEntity<MatchListResponse> getMatches(
            @RequestParam(name = "user_id", required = false) String userId
    ) {
        List<Match> matches = StringUtils.hasText(userId)
                ? Uuids.tryParse(userId).map(matchingService::getMatches).orElse(List.of())
                : matchingService.getMatches(null);
        return ResponseEntity.ok(new MatchListResponse(
                matches.stream()
                        .map(MatchResponse::from)
                        .toList()
        ));
    }
}
