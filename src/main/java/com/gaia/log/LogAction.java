package com.gaia.log;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of priority log entry.
 */
public enum LogAction {
    INGESTED("ingested"),
    SCORED("scored"),
    EXECUTED("executed"),
    RESCORE("rescore");

    private final String value;

    LogAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
