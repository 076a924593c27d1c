package com.codewarden.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of finding categories.
 */
public enum IssueCategory {
    SECURITY,
    PERFORMANCE,
    STYLE,
    BUG,
    SUGGESTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
