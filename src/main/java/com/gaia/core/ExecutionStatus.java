package com.gaia.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by an executor for a single test item.
 */
public enum ExecutionStatus {
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a wire status. Matching is exact and case-sensitive, as for priorities.
     * Missing or unrecognised values map to FAILED.
     */
    public static ExecutionStatus fromValue(String raw) {
        if (raw != null) {
            for (ExecutionStatus status : values()) {
                if (status.value.equals(raw)) {
                    return status;
                }
            }
        }
        return FAILED;
    }
}
