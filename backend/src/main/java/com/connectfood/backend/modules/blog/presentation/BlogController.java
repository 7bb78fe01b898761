package com.connectfood.backend.modules.blog.presentation;

import java.util.List;

import com.connectfood.backend.modules.blog.application.BlogService;
import com.connectfood.backend.modules.blog.domain.BlogPost;
import com.connectfood.backend.modules.blog.presentation.dto.BlogListResponse;
import com.connectfood.backend.modules.blog.presentation.dto.BlogPostResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BlogController {

    private final BlogService blogService;

    public BlogController(BlogService blogService) {
        this.blogService = blogService;
    }

    @GetMapping("/api/blog")
    public ResponseEntity<BlogListResponse> listPosts() {
        List<BlogPostResponse> items = blogService.listPosts().stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(new BlogListResponse(items));
    }

    private BlogPostResponse toResponse(BlogPost post) {
        return new BlogPostResponse(
                post.getId(),
                post.getTitle(),
                post.getExcerpt(),
                post.getBody(),
                List.copyOf(post.getTags()),
                post.getCreatedAt()
        );
    }
}
