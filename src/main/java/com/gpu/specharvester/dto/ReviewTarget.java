package com.gpu.specharvester.dto;

import java.time.LocalDateTime;

/**
 * A stored review that has a main URL, joined with the name of the product it belongs to
 */
public record ReviewTarget(
        Long reviewId,
        String type,
        String mainUrl,
        String pageUrl,
        Long productId,
        String productName,
        LocalDateTime updatedAt
) {
}
