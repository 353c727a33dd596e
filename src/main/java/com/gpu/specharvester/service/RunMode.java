package com.gpu.specharvester.service;

import java.util.Locale;

public enum RunMode {
    /** Product, board and review harvest */
    DEFAULT,
    /** Rewrite every stored review from its page */
    FULL,
    /** Rewrite only reviews whose page was posted after their last update */
    INCREMENTAL;

    /**
     * Parse a mode name, null or blank means {@link #DEFAULT}
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static RunMode parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown run mode: " + value);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
