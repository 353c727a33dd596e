package com.gpu.specharvester.dto;

/**
 * Identity of a stored product, {@code created} is true when the upsert inserted the row
 */
public record ProductRef(Long id, String name, boolean created) {
}
