package com.codewarden.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Engine output for one source text.
 *
 * @param issues        findings in family order (security, performance, style, maintainability),
 *                      then in-file order; not deduplicated across families
 * @param score         0..100
 * @param degradedRules rules or families that threw and were skipped, e.g. {@code "style.naming"}
 * @param enrichment    optional assessment outcome
 */
public record AnalysisReport(
    List<Issue> issues,
    int score,
    List<String> degradedRules,
    Enrichment enrichment
) implements Serializable {

    public AnalysisReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
        degradedRules = degradedRules != null ? List.copyOf(degradedRules) : List.of();
        if (enrichment == null) {
            enrichment = Enrichment.skipped();
        }
    }

    public boolean isDegraded() {
        return !degradedRules.isEmpty();
    }

    public AnalysisReport withEnrichment(Enrichment enrichment) {
        return new AnalysisReport(issues, score, degradedRules, enrichment);
    }
}
