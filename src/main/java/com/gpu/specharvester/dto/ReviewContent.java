package com.gpu.specharvester.dto;

import java.util.List;

/**
 * Normalized content of one review sub-page
 */
public record ReviewContent(String title, String body, List<ReviewDataItem> data, List<SpecItem> specs) {

    public ReviewContent {
        data = data == null ? List.of() : List.copyOf(data);
        specs = specs == null ? List.of() : List.copyOf(specs);
    }
}
