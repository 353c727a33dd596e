package com.gpu.specharvester.dto;

public record ReviewDataItem(String dataType, String key, String value, String unit, String productName) {
}
