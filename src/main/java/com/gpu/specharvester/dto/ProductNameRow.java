package com.gpu.specharvester.dto;

public record ProductNameRow(Long id, String name) {
}
