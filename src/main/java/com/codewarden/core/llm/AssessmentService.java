package com.codewarden.core.llm;

import com.codewarden.core.model.Issue;

import java.util.List;

/**
 * External service that summarises a source text and its findings.
 * Callers must treat it as optional: reports stay valid when it is unavailable or fails.
 */
public interface AssessmentService {

    /**
     * Whether calls can be attempted at all (e.g. an API key is configured).
     */
    boolean isAvailable();

    /**
     * Produces an assessment. May block on network I/O; callers impose their own timeout.
     *
     * @throws LlmEmptyResponseException if the model returns nothing
     * @throws LlmParseException         if the response cannot be mapped to {@link Assessment}
     */
    Assessment summarize(String code, String language, List<Issue> issues, String context);
}
