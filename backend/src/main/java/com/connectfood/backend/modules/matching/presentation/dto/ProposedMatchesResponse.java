package com.connectfood.backend.modules.matching.presentation.dto;

import java.util.List;

public record ProposedMatchesResponse(List<MatchResponse> matches) {
}
