package com.gpu.specharvester.dto;

/**
 * An entry of the review sub-page drop-down: label text and target URL
 */
public record ReviewOption(String text, String value) {
}
