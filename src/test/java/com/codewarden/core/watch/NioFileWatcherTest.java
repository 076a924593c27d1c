package com.codewarden.core.watch;

import com.codewarden.core.model.ChangeType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against the real filesystem; event latency depends on the platform watch service.
 */
class NioFileWatcherTest {

    private static final long TIMEOUT_SECONDS = 15;

    @TempDir
    Path tempDir;

    private final BlockingQueue<FileChangeEvent> events = new LinkedBlockingQueue<>();
    private final List<FileChangeEvent> seen = new ArrayList<>();
    private NioFileWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        watcher = new NioFileWatcher(new IgnoreMatcher(), new FileWatcher.Listener() {
            @Override
            public void onChange(FileChangeEvent event) {
                events.add(event);
            }

            @Override
            public void onError(Throwable error) {
            }
        });
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    private FileChangeEvent await(Path path, ChangeType type) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (System.nanoTime() < deadline) {
            FileChangeEvent event = events.poll(200, TimeUnit.MILLISECONDS);
            if (event == null) {
                continue;
            }
            seen.add(event);
            if (event.path().equals(path) && event.type() == type) {
                return event;
            }
        }
        fail("No " + type + " event for " + path + "; saw " + seen);
        return null;
    }

    @Test
    @DisplayName("reports created and deleted files")
    void createAndDelete() throws Exception {
        watcher.addRoot(tempDir);

        Path file = Files.writeString(tempDir.resolve("app.js"), "const a = 1;");
        await(file, ChangeType.ADDED);

        Files.delete(file);
        await(file, ChangeType.DELETED);
    }

    @Test
    @DisplayName("reports files in directories created after the root was added")
    void newSubdirectory() throws Exception {
        watcher.addRoot(tempDir);

        Path dir = Files.createDirectory(tempDir.resolve("src"));
        Path file = Files.writeString(dir.resolve("util.py"), "x = 1");

        await(file, ChangeType.ADDED);
    }

    @Test
    @DisplayName("skips ignored directories and files")
    void ignoresConfiguredPaths() throws Exception {
        Path modules = Files.createDirectory(tempDir.resolve("node_modules"));
        watcher.addRoot(tempDir);

        Files.writeString(modules.resolve("lib.js"), "module.exports = {};");
        Files.writeString(tempDir.resolve("debug.log"), "noise");
        Path marker = Files.writeString(tempDir.resolve("marker.js"), "done();");
        await(marker, ChangeType.ADDED);

        assertTrue(seen.stream().noneMatch(e -> e.path().startsWith(modules)), "saw " + seen);
        assertTrue(seen.stream().noneMatch(e -> e.path().getFileName().toString().endsWith(".log")), "saw " + seen);
    }

    @Test
    @DisplayName("a single-file root only reports that file")
    void fileRoot() throws Exception {
        Path target = Files.writeString(tempDir.resolve("main.go"), "package main");
        watcher.addRoot(target);

        Files.writeString(tempDir.resolve("other.go"), "package other");
        Files.writeString(target, "package main\n");
        await(target, ChangeType.CHANGED);

        assertTrue(seen.stream().allMatch(e -> e.path().equals(target)), "saw " + seen);
    }

    @Test
    @DisplayName("close is idempotent")
    void closeTwice() {
        watcher.close();
        assertDoesNotThrow(() -> watcher.close());
    }
}
