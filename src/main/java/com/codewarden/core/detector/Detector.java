package com.codewarden.core.detector;

/**
 * A family of independent, stateless rules over one source text.
 * Implementations must not keep state between invocations; the engine
 * calls all families concurrently on the same input.
 */
public interface Detector {

    /**
     * Returns the family this detector belongs to. Determines report ordering.
     */
    DetectorFamily family();

    /**
     * Runs every rule of the family.
     *
     * @param source   the full source text
     * @param language language hint such as {@code "javascript"}; may be {@code null}
     * @return findings in rule order then line order, plus the names of rules that failed
     */
    DetectorResult detect(String source, String language);
}
