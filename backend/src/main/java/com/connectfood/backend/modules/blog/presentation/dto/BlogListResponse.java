package com.connectfood.backend.modules.blog.presentation.dto;

import java.util.List;

public record BlogListResponse(List<BlogPostResponse> items) {
}
