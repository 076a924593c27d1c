package com.codewarden.core.engine;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a file for analysis, enforcing the size guard before any content is read.
 */
@Component
public class SourceFileReader {

    /**
     * A file's content with the language detected from its extension.
     */
    public record SourceFile(Path path, String content, String language) {}

    private final long maxBytes;

    @Autowired
    public SourceFileReader(AnalysisProperties properties) {
        this(properties.getMaxFileSizeBytes());
    }

    SourceFileReader(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    /**
     * @throws PathNotFoundException  if the file does not exist
     * @throws FileTooLargeException  if it exceeds the configured size
     * @throws UncheckedIOException   if it cannot be read
     */
    public SourceFile read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PathNotFoundException(path.toString());
        }
        try {
            long size = Files.size(path);
            if (size > maxBytes) {
                throw new FileTooLargeException(path.toString(), size, maxBytes);
            }
            // Malformed bytes decode to U+FFFD so files in legacy encodings are still analyzed.
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return new SourceFile(path, content, LanguageDetector.detect(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
