package com.connectfood.backend.modules.blog.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.connectfood.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "blog_post")
public class BlogPost extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "excerpt", length = 500)
    private String excerpt;

    @Column(name = "body", nullable = false, columnDefinition = "text")
    private String body;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "blog_post_tag", joinColumns = @JoinColumn(name = "blog_post_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", nullable = false, length = 40)
    private List<String> tags = new ArrayList<>();

    protected BlogPost() {
    }

    public BlogPost(String title, String excerpt, String body, List<String> tags) {
        this.title = title;
        this.excerpt = excerpt;
        this.body = body;
        this.tags = new ArrayList<>(tags);
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getExcerpt() {
        return excerpt;
    }

    public String getBody() {
        return body;
    }

    public List<String> getTags() {
        return tags;
    }
}
