package com.gpu.specharvester.dto;

import java.util.List;

/**
 * Normalized content of a product (or board) detail page
 */
public record ProductDetail(ProductAttributes attributes, List<SpecItem> specs) {

    public ProductDetail {
        specs = specs == null ? List.of() : List.copyOf(specs);
    }
}
