package com.codewarden.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Outcome of the optional natural-language assessment attached to a report.
 * Never affects issues or score.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Enrichment(
    Status status,
    String summary,
    String optimizedCode,
    String error
) implements Serializable {

    public enum Status { OK, SKIPPED, TIMEOUT, FAILED }

    public static Enrichment ok(String summary, String optimizedCode) {
        return new Enrichment(Status.OK, summary, optimizedCode, null);
    }

    public static Enrichment skipped() {
        return new Enrichment(Status.SKIPPED, null, null, null);
    }

    public static Enrichment timeout(long timeoutMs) {
        return new Enrichment(Status.TIMEOUT, null, null, "Assessment timed out after " + timeoutMs + "ms");
    }

    public static Enrichment failed(String error) {
        return new Enrichment(Status.FAILED, null, null, error);
    }
}
