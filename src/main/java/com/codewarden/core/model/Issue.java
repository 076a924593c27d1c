package com.codewarden.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A single finding produced by a detector rule.
 *
 * @param category   what kind of problem this is
 * @param severity   how bad it is; drives the score deduction
 * @param line       1-based source line, or {@code null} for file-level findings
 * @param message    human-readable description
 * @param suggestion optional remediation text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Issue(
    IssueCategory category,
    Severity severity,
    Integer line,
    String message,
    String suggestion
) implements Serializable {

    public Issue {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Issue at(int line, IssueCategory category, Severity severity, String message, String suggestion) {
        return new Issue(category, severity, line, message, suggestion);
    }
}
