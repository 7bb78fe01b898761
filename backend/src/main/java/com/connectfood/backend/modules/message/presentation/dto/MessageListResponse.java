package com.connectfood.backend.modules.message.presentation.dto;

import java.util.List;

public record MessageListResponse(List<MessageItemResponse> items) {
}
