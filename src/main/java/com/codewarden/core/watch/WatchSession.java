package com.codewarden.core.watch;

import com.codewarden.core.engine.PathNotFoundException;
import com.codewarden.core.metrics.CodewardenMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The set of watched roots and the watcher that serves them.
 * <p>
 * The watcher is created lazily with the first root and closed when the last
 * one is removed. If it crashes it is re-created once with every root
 * re-registered; a second crash leaves the session unhealthy until
 * {@link #close()}. All mutations are serialised on the session.
 */
@Service
public class WatchSession {

    private static final Logger log = LoggerFactory.getLogger(WatchSession.class);

    private static final int MAX_REINITIALIZATIONS = 1;

    private final FileWatcher.Factory watcherFactory;
    private final CodewardenMetrics metrics;
    private final List<Consumer<FileChangeEvent>> changeListeners = new CopyOnWriteArrayList<>();
    private final Set<Path> roots = new LinkedHashSet<>();

    private FileWatcher watcher;
    private int reinitializations;
    private boolean healthy = true;
    private String lastError;

    @Autowired
    public WatchSession(IgnoreMatcher ignoreMatcher, CodewardenMetrics metrics) {
        this(listener -> new NioFileWatcher(ignoreMatcher, listener), metrics);
    }

    WatchSession(FileWatcher.Factory watcherFactory, CodewardenMetrics metrics) {
        this.watcherFactory = watcherFactory;
        this.metrics = metrics;
    }

    /**
     * Registers a consumer for change events from every watched root.
     */
    public void onChange(Consumer<FileChangeEvent> listener) {
        changeListeners.add(listener);
    }

    /**
     * Starts watching {@code path}.
     *
     * @return {@code false} if the path was already watched
     * @throws PathNotFoundException if the path does not exist
     */
    public synchronized boolean addPath(String path) {
        Path root = normalize(path);
        if (!Files.exists(root)) {
            throw new PathNotFoundException(path);
        }
        if (roots.contains(root)) {
            log.debug("Already watching {}", root);
            return false;
        }
        try {
            ensureWatcher().addRoot(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to watch " + root, e);
        }
        roots.add(root);
        log.info("Started watching {}", root);
        return true;
    }

    /**
     * Stops watching {@code path}.
     *
     * @return {@code false} if the path was not watched
     */
    public synchronized boolean removePath(String path) {
        Path root = normalize(path);
        if (!roots.remove(root)) {
            return false;
        }
        if (watcher != null) {
            watcher.removeRoot(root);
            if (roots.isEmpty()) {
                watcher.close();
                watcher = null;
            }
        }
        log.info("Stopped watching {}", root);
        return true;
    }

    public synchronized List<String> watchedPaths() {
        var paths = new ArrayList<String>(roots.size());
        roots.forEach(root -> paths.add(root.toString()));
        return paths;
    }

    public synchronized boolean isWatching(String path) {
        return roots.contains(normalize(path));
    }

    public synchronized boolean isHealthy() {
        return healthy;
    }

    public synchronized String lastError() {
        return lastError;
    }

    /**
     * Closes the watcher and forgets every root. Safe to call repeatedly.
     */
    @PreDestroy
    public synchronized void close() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        if (!roots.isEmpty()) {
            log.info("Watch session closed ({} roots released)", roots.size());
        }
        roots.clear();
        healthy = true;
        reinitializations = 0;
        lastError = null;
    }

    private FileWatcher ensureWatcher() throws IOException {
        if (watcher == null) {
            var listener = new SessionListener();
            watcher = watcherFactory.create(listener);
            listener.owner = watcher;
            log.info("File watcher initialized");
        }
        return watcher;
    }

    private synchronized void handleWatcherError(FileWatcher failed, Throwable error) {
        if (failed != watcher) {
            return;
        }
        metrics.recordWatcherError();
        lastError = error.getMessage();
        log.error("File watcher crashed: {}", error.getMessage(), error);
        failed.close();
        watcher = null;

        if (reinitializations >= MAX_REINITIALIZATIONS) {
            healthy = false;
            log.error("File watcher failed again; giving up on {} roots", roots.size());
            return;
        }
        reinitializations++;
        try {
            FileWatcher fresh = ensureWatcher();
            for (Path root : roots) {
                fresh.addRoot(root);
            }
            log.info("File watcher reinitialized with {} roots", roots.size());
        } catch (IOException | RuntimeException e) {
            healthy = false;
            lastError = e.getMessage();
            log.error("File watcher reinitialization failed: {}", e.getMessage(), e);
        }
    }

    private void dispatch(FileChangeEvent event) {
        for (Consumer<FileChangeEvent> listener : changeListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Change listener threw for {}: {}", event.path(), e.getMessage(), e);
            }
        }
    }

    private static Path normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new PathNotFoundException(String.valueOf(path));
        }
        return Path.of(path).toAbsolutePath().normalize();
    }

    /** Routes a watcher's callbacks; errors from replaced watchers are ignored. */
    private final class SessionListener implements FileWatcher.Listener {
        private volatile FileWatcher owner;

        @Override
        public void onChange(FileChangeEvent event) {
            dispatch(event);
        }

        @Override
        public void onError(Throwable error) {
            handleWatcherError(owner, error);
        }
    }
}
