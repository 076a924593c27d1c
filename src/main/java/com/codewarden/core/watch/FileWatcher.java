package com.codewarden.core.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Recursive directory watcher. Implementations deliver events and errors on
 * their own thread through the {@link Listener} given at creation.
 */
public interface FileWatcher extends AutoCloseable {

    /**
     * Starts watching {@code root} and everything below it.
     */
    void addRoot(Path root) throws IOException;

    /**
     * Stops watching {@code root}. Directories still covered by another root stay watched.
     */
    void removeRoot(Path root);

    @Override
    void close();

    /**
     * Receives watcher output.
     */
    interface Listener {
        void onChange(FileChangeEvent event);

        /**
         * Called once when the watcher can no longer deliver events.
         */
        void onError(Throwable error);
    }

    /**
     * Creates watchers; lets {@link WatchSession} re-create one after a crash.
     */
    @FunctionalInterface
    interface Factory {
        FileWatcher create(Listener listener) throws IOException;
    }
}
