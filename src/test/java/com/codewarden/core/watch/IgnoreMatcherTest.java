package com.codewarden.core.watch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreMatcherTest {

    private final IgnoreMatcher matcher = new IgnoreMatcher();
    private final Path root = Path.of("/work/project");

    @Test
    @DisplayName("ignores anything below an ignored directory")
    void ignoredDirectories() {
        assertTrue(matcher.isIgnored(root, root.resolve("node_modules/lodash/index.js")));
        assertTrue(matcher.isIgnored(root, root.resolve("src/.git/HEAD")));
        assertTrue(matcher.isIgnored(root, root.resolve("target")));
        assertFalse(matcher.isIgnored(root, root.resolve("src/build.js")));
    }

    @Test
    @DisplayName("ignores files by name, extension and prefix")
    void ignoredFiles() {
        assertTrue(matcher.isIgnored(root, root.resolve("src/.DS_Store")));
        assertTrue(matcher.isIgnored(root, root.resolve("logs/server.LOG")));
        assertTrue(matcher.isIgnored(root, root.resolve(".env.local")));
        assertFalse(matcher.isIgnored(root, root.resolve("src/environment.ts")));
    }

    @Test
    @DisplayName("only components below the root count")
    void rootItselfNotMatched() {
        Path buildRoot = Path.of("/ci/build/checkout");
        assertFalse(matcher.isIgnored(buildRoot, buildRoot.resolve("src/app.js")));
    }

    @Test
    @DisplayName("code files are chosen by extension")
    void codeFiles() {
        assertTrue(matcher.isCodeFile(Path.of("src/App.TSX")));
        assertTrue(matcher.isCodeFile(Path.of("config.yml")));
        assertFalse(matcher.isCodeFile(Path.of("README.md")));
        assertFalse(matcher.isCodeFile(Path.of("Makefile")));
    }

    @Test
    @DisplayName("configured lists replace the defaults")
    void customConfiguration() {
        var properties = new WatchProperties();
        properties.setIgnoreDirs(List.of("vendor"));
        properties.setCodeExtensions(List.of(".PY"));
        var custom = new IgnoreMatcher(properties);

        assertTrue(custom.isIgnored(root, root.resolve("vendor/lib.py")));
        assertFalse(custom.isIgnored(root, root.resolve("node_modules/lib.py")));
        assertTrue(custom.isCodeFile(Path.of("tool.py")));
        assertFalse(custom.isCodeFile(Path.of("app.js")));
    }
}
