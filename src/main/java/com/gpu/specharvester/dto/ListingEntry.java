package com.gpu.specharvester.dto;

/**
 * One row of the catalog listing table
 */
public record ListingEntry(String name, String url) {
}
