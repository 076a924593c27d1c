package com.codewarden.core.engine;

/**
 * Thrown when a path to watch or analyze does not exist.
 */
public class PathNotFoundException extends RuntimeException {

    private final String path;

    public PathNotFoundException(String path) {
        super("Path does not exist: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
