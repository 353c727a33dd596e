package com.gpu.specharvester.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "spec_categories", uniqueConstraints = {
        @UniqueConstraint(name = "uk_spec_categories_name", columnNames = {"domain_tag", "name"}),
        @UniqueConstraint(name = "uk_spec_categories_code", columnNames = {"domain_tag", "code"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpecCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "domain_tag", nullable = false, length = 100)
    private String domainTag;

    @Column(nullable = false)
    private Integer code;

    @Column(nullable = false, length = 300)
    private String name;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
