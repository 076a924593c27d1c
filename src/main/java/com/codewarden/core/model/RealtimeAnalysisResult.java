package com.codewarden.core.model;

import java.io.Serializable;

/**
 * Payload of a {@code realtime_analysis} broadcast.
 *
 * @param filePath   the file that changed
 * @param analysis   the report, or {@code null} for deletions
 * @param timestamp  epoch millis when the debounced job fired
 * @param changeType the last change kind observed for the path
 */
public record RealtimeAnalysisResult(
    String filePath,
    AnalysisReport analysis,
    long timestamp,
    ChangeType changeType
) implements Serializable {}
