package com.connectfood.backend.modules.matching.presentation.dto;

import java.util.List;

public record MatchListResponse(List<MatchResponse> items) {
}
