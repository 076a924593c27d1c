package com.codewarden.core.watch;

import com.codewarden.core.engine.LanguageDetector;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which paths under a watched root are skipped, and which files are
 * code worth analysing.
 * <p>
 * A path is ignored when any component below the root names an ignored
 * directory or file, or when its file name has an ignored extension or prefix.
 */
@Component
public class IgnoreMatcher {

    private final Set<String> ignoreDirs;
    private final Set<String> ignoreFiles;
    private final List<String> ignoreExtensions;
    private final List<String> ignorePrefixes;
    private final Set<String> codeExtensions;

    @Autowired
    public IgnoreMatcher(WatchProperties properties) {
        this.ignoreDirs = Set.copyOf(properties.getIgnoreDirs());
        this.ignoreFiles = Set.copyOf(properties.getIgnoreFiles());
        this.ignoreExtensions = lower(properties.getIgnoreExtensions());
        this.ignorePrefixes = List.copyOf(properties.getIgnorePrefixes());
        this.codeExtensions = Set.copyOf(lower(properties.getCodeExtensions()));
    }

    public IgnoreMatcher() {
        this(new WatchProperties());
    }

    /**
     * Returns {@code true} if {@code path} (inside {@code root}) should produce no events.
     */
    public boolean isIgnored(Path root, Path path) {
        Path relative = path.startsWith(root) ? root.relativize(path) : path;
        for (Path component : relative) {
            String name = component.toString();
            if (ignoreDirs.contains(name) || ignoreFiles.contains(name)) {
                return true;
            }
        }
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        String lowerName = name.toLowerCase(Locale.ROOT);
        for (String extension : ignoreExtensions) {
            if (lowerName.endsWith(extension)) {
                return true;
            }
        }
        for (String prefix : ignorePrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if the file has one of the configured code extensions.
     */
    public boolean isCodeFile(Path path) {
        return codeExtensions.contains(LanguageDetector.extensionOf(path));
    }

    private static List<String> lower(List<String> values) {
        return values.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }
}
