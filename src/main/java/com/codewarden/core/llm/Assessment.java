package com.codewarden.core.llm;

import java.util.List;

/**
 * Natural-language review returned by the assessment service.
 *
 * @param summary                overall quality summary
 * @param optimizedCode          improved version of the code, if the model produced one
 * @param additionalSuggestions  extra free-form suggestions
 */
public record Assessment(
    String summary,
    String optimizedCode,
    List<String> additionalSuggestions
) {}
