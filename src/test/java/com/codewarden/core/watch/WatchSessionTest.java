package com.codewarden.core.watch;

import com.codewarden.core.engine.PathNotFoundException;
import com.codewarden.core.metrics.CodewardenMetrics;
import com.codewarden.core.model.ChangeType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatchSessionTest {

    @TempDir
    Path tempDir;

    private final List<FakeWatcher> created = new ArrayList<>();
    private SimpleMeterRegistry registry;
    private WatchSession session;
    private Path first;
    private Path second;

    static final class FakeWatcher implements FileWatcher {
        final Listener listener;
        final List<Path> roots = new ArrayList<>();
        boolean closed;

        FakeWatcher(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void addRoot(Path root) {
            roots.add(root);
        }

        @Override
        public void removeRoot(Path root) {
            roots.remove(root);
        }

        @Override
        public void close() {
            closed = true;
        }

        void fire(Path path, ChangeType type) {
            listener.onChange(new FileChangeEvent(path, type));
        }

        void crash(String message) {
            listener.onError(new IOException(message));
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        registry = new SimpleMeterRegistry();
        session = new WatchSession(listener -> {
            var watcher = new FakeWatcher(listener);
            created.add(watcher);
            return watcher;
        }, new CodewardenMetrics(registry));
        first = Files.createDirectory(tempDir.resolve("first"));
        second = Files.createDirectory(tempDir.resolve("second"));
    }

    @Nested
    @DisplayName("adding and removing roots")
    class Roots {

        @Test
        @DisplayName("a missing path is rejected before any watcher exists")
        void missingPath() {
            var ex = assertThrows(PathNotFoundException.class,
                    () -> session.addPath(tempDir.resolve("missing").toString()));
            assertTrue(ex.getMessage().startsWith("Path does not exist"));
            assertTrue(session.watchedPaths().isEmpty());
            assertTrue(created.isEmpty());
        }

        @Test
        @DisplayName("blank paths are rejected")
        void blankPath() {
            assertThrows(PathNotFoundException.class, () -> session.addPath(" "));
            assertThrows(PathNotFoundException.class, () -> session.addPath(null));
        }

        @Test
        @DisplayName("adding the same root twice is a no-op")
        void addTwice() {
            assertTrue(session.addPath(first.toString()));
            assertFalse(session.addPath(first + "/./"));

            assertEquals(List.of(first.toString()), session.watchedPaths());
            assertEquals(1, created.size());
            assertEquals(List.of(first), created.get(0).roots);
        }

        @Test
        @DisplayName("roots share one watcher and are listed in insertion order")
        void sharedWatcher() {
            session.addPath(second.toString());
            session.addPath(first.toString());

            assertEquals(List.of(second.toString(), first.toString()), session.watchedPaths());
            assertEquals(1, created.size());
            assertTrue(session.isWatching(first.toString()));
        }

        @Test
        @DisplayName("removing the last root closes the watcher")
        void removeLast() {
            session.addPath(first.toString());
            session.addPath(second.toString());

            assertTrue(session.removePath(first.toString()));
            assertFalse(created.get(0).closed);
            assertTrue(session.removePath(second.toString()));
            assertTrue(created.get(0).closed);
            assertFalse(session.removePath(second.toString()));
            assertTrue(session.watchedPaths().isEmpty());
        }

        @Test
        @DisplayName("a new watcher is created after the previous one was closed")
        void recreateAfterEmpty() {
            session.addPath(first.toString());
            session.removePath(first.toString());
            session.addPath(first.toString());
            assertEquals(2, created.size());
        }
    }

    @Test
    @DisplayName("dispatches events to every listener even if one throws")
    void dispatch() {
        var received = new ArrayList<FileChangeEvent>();
        session.onChange(event -> {
            throw new IllegalStateException("listener bug");
        });
        session.onChange(received::add);
        session.addPath(first.toString());

        created.get(0).fire(first.resolve("a.js"), ChangeType.CHANGED);

        assertEquals(List.of(new FileChangeEvent(first.resolve("a.js"), ChangeType.CHANGED)), received);
    }

    @Nested
    @DisplayName("watcher failures")
    class Failures {

        @Test
        @DisplayName("the first crash re-creates the watcher with every root")
        void reinitializes() {
            session.addPath(first.toString());
            session.addPath(second.toString());

            created.get(0).crash("inotify limit");

            assertTrue(created.get(0).closed);
            assertEquals(2, created.size());
            assertEquals(List.of(first, second), created.get(1).roots);
            assertTrue(session.isHealthy());
            assertEquals("inotify limit", session.lastError());
            assertEquals(1.0, registry.get("codewarden.watcher.errors").counter().count());
        }

        @Test
        @DisplayName("a second crash leaves the session unhealthy")
        void secondCrash() {
            session.addPath(first.toString());
            created.get(0).crash("one");
            created.get(1).crash("two");

            assertFalse(session.isHealthy());
            assertEquals(2, created.size());
            assertEquals("two", session.lastError());
        }

        @Test
        @DisplayName("errors from an already replaced watcher are ignored")
        void staleWatcherError() {
            session.addPath(first.toString());
            created.get(0).crash("one");
            created.get(0).crash("late");

            assertTrue(session.isHealthy());
            assertEquals(2, created.size());
            assertEquals(1.0, registry.get("codewarden.watcher.errors").counter().count());
        }

        @Test
        @DisplayName("close resets health and is safe to repeat")
        void closeResets() {
            session.addPath(first.toString());
            created.get(0).crash("one");
            created.get(1).crash("two");

            session.close();
            session.close();

            assertTrue(session.isHealthy());
            assertNull(session.lastError());
            assertTrue(session.watchedPaths().isEmpty());
        }
    }
}
