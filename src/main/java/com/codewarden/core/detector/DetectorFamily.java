package com.codewarden.core.detector;

/**
 * The four detector families, in the order their findings appear in a report.
 */
public enum DetectorFamily {
    SECURITY("security"),
    PERFORMANCE("performance"),
    STYLE("style"),
    MAINTAINABILITY("maintainability");

    private final String id;

    DetectorFamily(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
