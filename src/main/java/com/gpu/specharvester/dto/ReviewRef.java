package com.gpu.specharvester.dto;

/**
 * Identity of a stored review after an upsert.
 * {@code changed} is true when the row was inserted or its content differed.
 */
public record ReviewRef(Long id, boolean created, boolean changed) {
}
