package com.gpu.specharvester.dto;

public record RunStartResult(boolean accepted, String message) {

    public static RunStartResult accepted(String message) {
        return new RunStartResult(true, message);
    }

    public static RunStartResult rejected(String message) {
        return new RunStartResult(false, message);
    }
}
