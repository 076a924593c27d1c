package com.codewarden.core.llm;

/**
 * Thrown when the model returns empty content.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
