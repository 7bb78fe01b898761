package com.connectfood.backend.modules.message.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MessageItemResponse(
        UUID id,
        UUID matchId,
        UUID senderId,
        String content,
        OffsetDateTime createdAt
) {
}
