package com.gpu.specharvester.dto;

/**
 * A normalized spec value before its category has been resolved to a code
 */
public record SpecItem(String category, String name, String value) {
}
