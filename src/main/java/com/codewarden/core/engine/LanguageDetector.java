package com.codewarden.core.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Maps file extensions to language hints understood by the detectors.
 */
public final class LanguageDetector {

    public static final String UNKNOWN = "text";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript"),
            Map.entry(".py", "python"),
            Map.entry(".java", "java"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".c", "c"),
            Map.entry(".cc", "cpp"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".php", "php"),
            Map.entry(".rb", "ruby"),
            Map.entry(".swift", "swift"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".cs", "csharp"),
            Map.entry(".scala", "scala"),
            Map.entry(".vue", "javascript"),
            Map.entry(".svelte", "javascript"),
            Map.entry(".html", "html"),
            Map.entry(".css", "css"),
            Map.entry(".json", "json"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".yml", "yaml"),
            Map.entry(".xml", "xml")
    );

    /** Languages advertised to clients, in display order. */
    public static final List<String> SUPPORTED_LANGUAGES = List.of(
            "javascript", "typescript", "python", "java", "cpp", "c",
            "go", "rust", "php", "ruby", "swift", "kotlin"
    );

    private LanguageDetector() {}

    public static String detect(Path file) {
        return BY_EXTENSION.getOrDefault(extensionOf(file), UNKNOWN);
    }

    /** Lower-cased extension including the dot, or an empty string. */
    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot).toLowerCase() : "";
    }
}
