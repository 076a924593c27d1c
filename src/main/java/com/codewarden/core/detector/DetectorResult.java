package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;

import java.util.List;

/**
 * Output of one detector family.
 *
 * @param issues        findings
 * @param degradedRules qualified names ({@code family.rule}) of rules that threw
 */
public record DetectorResult(List<Issue> issues, List<String> degradedRules) {

    public DetectorResult {
        issues = issues != null ? List.copyOf(issues) : List.of();
        degradedRules = degradedRules != null ? List.copyOf(degradedRules) : List.of();
    }

    public static DetectorResult failed(String family) {
        return new DetectorResult(List.of(), List.of(family));
    }
}
