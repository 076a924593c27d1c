package com.codewarden.core.model;

/**
 * One-shot analysis input.
 *
 * @param code     source text
 * @param language language hint, e.g. {@code "javascript"}
 * @param filePath optional, used for logging only
 * @param context  optional free text passed to the assessment service
 */
public record AnalysisRequest(
    String code,
    String language,
    String filePath,
    String context
) {

    public AnalysisRequest(String code, String language) {
        this(code, language, null, null);
    }
}
