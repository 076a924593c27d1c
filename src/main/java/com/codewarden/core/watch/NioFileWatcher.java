package com.codewarden.core.watch;

import com.codewarden.core.model.ChangeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link FileWatcher} on the JDK {@link WatchService}. Every non-ignored
 * directory below a root is registered; directories created later are
 * registered as they appear and their files reported as added.
 * Existing files produce no events when a root is added.
 */
public class NioFileWatcher implements FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(NioFileWatcher.class);

    private final WatchService watchService;
    private final IgnoreMatcher ignoreMatcher;
    private final Listener listener;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private final Set<Path> roots = ConcurrentHashMap.newKeySet();
    private final Thread pollThread;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean running = true;

    public NioFileWatcher(IgnoreMatcher ignoreMatcher, Listener listener) throws IOException {
        this.watchService = FileSystems.getDefault().newWatchService();
        this.ignoreMatcher = ignoreMatcher;
        this.listener = listener;
        this.pollThread = new Thread(this::pollLoop, "file-watcher");
        this.pollThread.setDaemon(true);
        this.pollThread.start();
    }

    @Override
    public void addRoot(Path root) throws IOException {
        roots.add(root);
        if (Files.isRegularFile(root)) {
            register(root.getParent());
        } else {
            registerTree(root, root, false);
        }
        log.debug("Watching {} ({} directories registered)", root, directories.size());
    }

    @Override
    public void removeRoot(Path root) {
        roots.remove(root);
        directories.entrySet().removeIf(entry -> {
            Path dir = entry.getValue();
            if ((dir.startsWith(root) || dir.equals(root.getParent())) && !isNeeded(dir)) {
                entry.getKey().cancel();
                return true;
            }
            return false;
        });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service: {}", e.getMessage());
        }
        directories.clear();
        roots.clear();
    }

    private void pollLoop() {
        try {
            while (running) {
                WatchKey key = watchService.take();
                Path dir = directories.get(key);
                if (dir != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        handle(dir, event);
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        } catch (ClosedWatchServiceException e) {
            if (running) {
                running = false;
                listener.onError(e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (running) {
                running = false;
                log.error("File watcher loop failed: {}", e.getMessage(), e);
                listener.onError(e);
            }
        }
    }

    private void handle(Path dir, WatchEvent<?> event) {
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
            log.warn("Watch events overflowed for {}; some changes were missed", dir);
            return;
        }
        Path path = dir.resolve((Path) event.context());
        Path root = rootOf(path);
        if (root == null || ignoreMatcher.isIgnored(root, path)) {
            return;
        }

        if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(path)) {
            try {
                registerTree(root, path, true);
            } catch (IOException e) {
                log.warn("Failed to watch new directory {}: {}", path, e.getMessage());
            }
            return;
        }
        if (Files.isDirectory(path)) {
            return;
        }

        ChangeType type;
        if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
            type = ChangeType.ADDED;
        } else if (event.kind() == StandardWatchEventKinds.ENTRY_DELETE) {
            type = ChangeType.DELETED;
        } else {
            type = ChangeType.CHANGED;
        }
        emit(new FileChangeEvent(path, type));
    }

    private void emit(FileChangeEvent event) {
        try {
            listener.onChange(event);
        } catch (RuntimeException e) {
            log.warn("Change listener failed for {}: {}", event.path(), e.getMessage(), e);
        }
    }

    private void registerTree(Path root, Path start, boolean reportFiles) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && ignoreMatcher.isIgnored(root, dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                register(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (reportFiles && !ignoreMatcher.isIgnored(root, file)) {
                    emit(new FileChangeEvent(file, ChangeType.ADDED));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void register(Path dir) throws IOException {
        WatchKey key = dir.register(watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_DELETE,
                StandardWatchEventKinds.ENTRY_MODIFY);
        directories.put(key, dir);
    }

    private boolean isNeeded(Path dir) {
        for (Path root : roots) {
            if (dir.startsWith(root) || dir.equals(root.getParent())) {
                return true;
            }
        }
        return false;
    }

    /** The most specific watched root containing {@code path}, or {@code null}. */
    private Path rootOf(Path path) {
        Path best = null;
        for (Path root : roots) {
            if (path.startsWith(root) && (best == null || root.getNameCount() > best.getNameCount())) {
                best = root;
            }
        }
        return best;
    }
}
