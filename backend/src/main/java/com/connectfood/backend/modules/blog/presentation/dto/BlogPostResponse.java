package com.connectfood.backend.modules.blog.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record BlogPostResponse(
        UUID id,
        String title,
        String excerpt,
        String body,
        List<String> tags,
        OffsetDateTime createdAt
) {
}
