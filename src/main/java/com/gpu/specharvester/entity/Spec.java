package com.gpu.specharvester.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One attribute value of a product, grouped under a category code.
 * A product's spec set is always replaced as a whole, never patched row by row.
 */
@Entity
@Table(name = "specs", indexes = @Index(name = "ix_specs_product", columnList = "product_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Spec {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "category_code", nullable = false)
    private Integer categoryCode;

    @Column(nullable = false, length = 300)
    private String name;

    @Column(name = "spec_value", columnDefinition = "TEXT")
    private String value;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
