package com.codewarden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Finding severity, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
