package com.gpu.specharvester.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attributes supplied to a product upsert. Null fields leave the stored value untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductAttributes {

    private String name;
    private String vendor;
    private String description;
    private String imageUrl;
}
