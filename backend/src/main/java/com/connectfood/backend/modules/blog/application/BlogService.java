package com.connectfood.backend.modules.blog.application;

import java.util.List;

import com.connectfood.backend.modules.blog.domain.BlogPost;
import com.connectfood.backend.modules.blog.infrastructure.persistence.BlogPostRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class BlogService {

    private static final Logger log = LoggerFactory.getLogger(BlogService.class);
    static final int MAX_POSTS = 20;

    static final List<DemoPost> DEMO_POSTS = List.of(
            new DemoPost("AI for Food Redistribution", "How ML reduces waste", "...", List.of("ai", "sustainability")),
            new DemoPost("Food Safety 101", "Best practices for handling surplus", "...", List.of("safety"))
    );

    private final BlogPostRepository blogPostRepository;

    public BlogService(BlogPostRepository blogPostRepository) {
        this.blogPostRepository = blogPostRepository;
    }

    /**
     * Lists posts, seeding the demo articles first when the store is empty.
     */
    public List<BlogPost> listPosts() {
        if (blogPostRepository.count() == 0) {
            blogPostRepository.saveAll(demoPosts());
            log.info("Seeded {} demo blog posts", DEMO_POSTS.size());
        }
        return blogPostRepository.findAllByOrderByCreatedAtAsc(PageRequest.of(0, MAX_POSTS));
    }

    private static List<BlogPost> demoPosts() {
        return DEMO_POSTS.stream()
                .map(post -> new BlogPost(post.title(), post.excerpt(), post.body(), post.tags()))
                .toList();
    }

    record DemoPost(String title, String excerpt, String body, List<String> tags) {
    }
}
