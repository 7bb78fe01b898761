package com.connectfood.backend.modules.account.presentation.dto;

public record LoginResponse(AccountProfileResponse user) {
}
