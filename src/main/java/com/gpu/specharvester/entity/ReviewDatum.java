package com.gpu.specharvester.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "review_data", indexes = @Index(name = "ix_review_data_review", columnList = "review_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDatum {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "review_id", nullable = false)
    private Long reviewId;

    @Column(name = "data_type", length = 200)
    private String dataType;

    @Column(name = "data_key", length = 300)
    private String key;

    @Column(name = "data_value", columnDefinition = "TEXT")
    private String value;

    @Column(name = "data_unit", length = 50)
    private String unit;

    @Column(name = "product_name", length = 300)
    private String productName;
}
