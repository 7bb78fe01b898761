package com.connectfood.backend.modules.message.presentation.dto;

import java.util.UUID;

public record SendMessageResponse(UUID id) {
}
