package com.codewarden.core.llm;

import com.codewarden.core.model.Issue;

import java.util.List;

/**
 * Used when no model is configured. Reports come back with a skipped enrichment.
 */
public class NoopAssessmentService implements AssessmentService {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public Assessment summarize(String code, String language, List<Issue> issues, String context) {
        throw new IllegalStateException("No assessment model configured");
    }
}
