package com.lexsched.lexsched_api.solver.model;

public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE;

    /**
     * Lenient parse for request payloads: accepts {@code min}, {@code minimize}, {@code MAXIMIZE}, ...
     */
    public static ObjectiveSense parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Objective sense must be 'minimize' or 'maximize'.");
        }
        String normalized = value.trim().toLowerCase(java.util.Locale.ROOT);
        if (normalized.startsWith("min")) {
            return MINIMIZE;
        }
        if (normalized.startsWith("max")) {
            return MAXIMIZE;
        }
        throw new IllegalArgumentException("Objective sense must be 'minimize' or 'maximize', got '" + value + "'.");
    }
}
