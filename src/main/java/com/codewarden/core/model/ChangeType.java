package com.codewarden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of filesystem change that scheduled an analysis.
 */
public enum ChangeType {
    ADDED,
    CHANGED,
    DELETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
