package com.gpu.specharvester.dto;

public record CategoryRef(Long id, Integer code, String name) {
}
