package com.gpu.specharvester.dto;

import java.util.Map;

/**
 * A board variant row found in the boards section of a GPU detail page.
 * {@code url} and {@code reviewUrl} may be null.
 */
public record BoardListing(String name, String url, String reviewUrl, Map<String, String> columns) {

    public BoardListing {
        columns = columns == null ? Map.of() : Map.copyOf(columns);
    }

    public boolean hasReview() {
        return reviewUrl != null && !reviewUrl.isBlank();
    }

    public boolean hasDetailPage() {
        return url != null && !url.isBlank();
    }
}
