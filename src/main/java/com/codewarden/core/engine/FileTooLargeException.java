package com.codewarden.core.engine;

/**
 * Thrown by the upstream size guard when a file exceeds the configured maximum.
 */
public class FileTooLargeException extends RuntimeException {

    private final long sizeBytes;
    private final long maxBytes;

    public FileTooLargeException(String path, long sizeBytes, long maxBytes) {
        super(String.format("File too large: %s is %.2fMB (max: %.2fMB)",
                path, sizeBytes / (1024.0 * 1024.0), maxBytes / (1024.0 * 1024.0)));
        this.sizeBytes = sizeBytes;
        this.maxBytes = maxBytes;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
