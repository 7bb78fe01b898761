package com.connectfood.backend.modules.blog.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.connectfood.backend.modules.blog.domain.BlogPost;

public interface BlogPostRepository extends JpaRepository<BlogPost, UUID> {

    List<BlogPost> findAllByOrderByCreatedAtAsc(Pageable pageable);
}
