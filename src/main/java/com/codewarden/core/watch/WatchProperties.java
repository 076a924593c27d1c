package com.codewarden.core.watch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for directory watching and debounced re-analysis.
 */
@Component
@ConfigurationProperties(prefix = "codewarden.watch")
public class WatchProperties {

    private long debounceMs = 2000;
    private List<String> ignoreDirs = new ArrayList<>(List.of(
            "node_modules", ".git", "dist", "build", "coverage", "target", ".idea", ".vscode"));
    private List<String> ignoreFiles = new ArrayList<>(List.of(".DS_Store"));
    private List<String> ignoreExtensions = new ArrayList<>(List.of(".log"));
    private List<String> ignorePrefixes = new ArrayList<>(List.of(".env"));
    private List<String> codeExtensions = new ArrayList<>(List.of(
            ".js", ".jsx", ".ts", ".tsx", ".py", ".java", ".cpp", ".c", ".cc", ".go", ".rs",
            ".php", ".rb", ".swift", ".kt", ".cs", ".scala", ".vue", ".svelte",
            ".html", ".css", ".json", ".yaml", ".yml", ".xml"));

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public List<String> getIgnoreDirs() {
        return ignoreDirs;
    }

    public void setIgnoreDirs(List<String> ignoreDirs) {
        this.ignoreDirs = ignoreDirs;
    }

    public List<String> getIgnoreFiles() {
        return ignoreFiles;
    }

    public void setIgnoreFiles(List<String> ignoreFiles) {
        this.ignoreFiles = ignoreFiles;
    }

    public List<String> getIgnoreExtensions() {
        return ignoreExtensions;
    }

    public void setIgnoreExtensions(List<String> ignoreExtensions) {
        this.ignoreExtensions = ignoreExtensions;
    }

    public List<String> getIgnorePrefixes() {
        return ignorePrefixes;
    }

    public void setIgnorePrefixes(List<String> ignorePrefixes) {
        this.ignorePrefixes = ignorePrefixes;
    }

    public List<String> getCodeExtensions() {
        return codeExtensions;
    }

    public void setCodeExtensions(List<String> codeExtensions) {
        this.codeExtensions = codeExtensions;
    }
}
