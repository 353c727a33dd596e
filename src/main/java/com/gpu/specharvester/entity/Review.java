package com.gpu.specharvester.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "reviews", indexes = {
        @Index(name = "ix_reviews_master", columnList = "master_product_id"),
        @Index(name = "ix_reviews_main_url", columnList = "main_url")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "master_product_id", nullable = false)
    private Long masterProductId;

    @Column(nullable = false, length = 200)
    private String type;

    @Column(length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(name = "main_url", length = 500)
    private String mainUrl;

    @Column(name = "page_url", length = 500)
    private String pageUrl;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Only advanced when body or extracted data actually change
    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
