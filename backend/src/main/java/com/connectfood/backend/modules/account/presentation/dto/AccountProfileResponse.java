package com.connectfood.backend.modules.account.presentation.dto;

import java.util.UUID;

public record AccountProfileResponse(
        UUID id,
        String name,
        String email,
        String role,
        Double lat,
        Double lng
) {
}
