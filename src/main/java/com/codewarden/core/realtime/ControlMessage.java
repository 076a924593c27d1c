package com.codewarden.core.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound control request.
 *
 * @param type     {@code watch}, {@code unwatch} or {@code analyze_file}
 * @param path     root for watch/unwatch
 * @param filePath file for analyze_file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlMessage(String type, String path, String filePath) {

    public static final String WATCH = "watch";
    public static final String UNWATCH = "unwatch";
    public static final String ANALYZE_FILE = "analyze_file";
}
