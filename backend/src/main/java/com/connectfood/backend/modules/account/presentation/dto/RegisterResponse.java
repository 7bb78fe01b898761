package com.connectfood.backend.modules.account.presentation.dto;

import java.util.UUID;

public record RegisterResponse(
        UUID id,
        String email,
        String role
) {
}
