package com.codewarden.core.realtime;

import com.codewarden.core.engine.AnalysisEngine;
import com.codewarden.core.engine.FileTooLargeException;
import com.codewarden.core.engine.PathNotFoundException;
import com.codewarden.core.engine.SourceFileReader;
import com.codewarden.core.engine.ValidationException;
import com.codewarden.core.events.BroadcastChannel;
import com.codewarden.core.logging.MdcContext;
import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.AnalysisRequest;
import com.codewarden.core.model.ChangeType;
import com.codewarden.core.model.RealtimeAnalysisResult;
import com.codewarden.core.scheduler.DebounceScheduler;
import com.codewarden.core.watch.FileChangeEvent;
import com.codewarden.core.watch.IgnoreMatcher;
import com.codewarden.core.watch.WatchSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires watcher events through the debounce scheduler into the engine and
 * out to the broadcast channel, and serves the control API.
 * <p>
 * Only code files are scheduled. A deleted file is broadcast with a
 * {@code null} analysis and never read.
 */
@Service
public class RealtimePipeline {

    private static final Logger log = LoggerFactory.getLogger(RealtimePipeline.class);

    private final WatchSession watchSession;
    private final DebounceScheduler scheduler;
    private final AnalysisEngine engine;
    private final SourceFileReader fileReader;
    private final BroadcastChannel broadcastChannel;
    private final IgnoreMatcher ignoreMatcher;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public RealtimePipeline(WatchSession watchSession,
                            DebounceScheduler scheduler,
                            AnalysisEngine engine,
                            SourceFileReader fileReader,
                            BroadcastChannel broadcastChannel,
                            IgnoreMatcher ignoreMatcher) {
        this.watchSession = watchSession;
        this.scheduler = scheduler;
        this.engine = engine;
        this.fileReader = fileReader;
        this.broadcastChannel = broadcastChannel;
        this.ignoreMatcher = ignoreMatcher;
        watchSession.onChange(this::onFileChange);
    }

    /**
     * Handles one control request and returns its acknowledgment. Never throws
     * for request-level failures; they become error acknowledgments.
     */
    public ControlAck handleControl(ControlMessage message) {
        if (message == null || message.type() == null) {
            return ControlAck.error("Unknown message type");
        }
        try {
            return switch (message.type()) {
                case ControlMessage.WATCH -> {
                    watch(message.path());
                    yield ControlAck.watchStarted(message.path());
                }
                case ControlMessage.UNWATCH -> {
                    unwatch(message.path());
                    yield ControlAck.watchStopped(message.path());
                }
                case ControlMessage.ANALYZE_FILE -> ControlAck.analysisResult(analyzeFile(message.filePath()));
                default -> ControlAck.error("Unknown message type");
            };
        } catch (ValidationException | PathNotFoundException | FileTooLargeException e) {
            log.debug("Control request {} rejected: {}", message.type(), e.getMessage());
            return ControlAck.error(e.getMessage());
        } catch (UncheckedIOException e) {
            log.warn("Control request {} failed: {}", message.type(), e.getMessage());
            return ControlAck.error(e.getMessage());
        }
    }

    /**
     * @return {@code false} if the path was already watched
     * @throws PathNotFoundException if the path does not exist
     */
    public boolean watch(String path) {
        requireText(path, "path");
        ensureRunning();
        return watchSession.addPath(path);
    }

    /**
     * Stops watching {@code path} and cancels pending analyses below it.
     *
     * @return {@code false} if the path was not watched
     */
    public boolean unwatch(String path) {
        requireText(path, "path");
        boolean removed = watchSession.removePath(path);
        if (removed) {
            Path root = Path.of(path).toAbsolutePath().normalize();
            int cancelled = scheduler.cancelMatching(key -> Path.of(key).startsWith(root));
            if (cancelled > 0) {
                log.debug("Cancelled {} pending analyses under {}", cancelled, root);
            }
        }
        return removed;
    }

    /**
     * Reads and analyzes one file immediately.
     *
     * @throws ValidationException   if no path is given
     * @throws PathNotFoundException if the file does not exist
     * @throws FileTooLargeException if the file exceeds the size guard
     */
    public AnalysisReport analyzeFile(String filePath) {
        requireText(filePath, "filePath");
        SourceFileReader.SourceFile file = fileReader.read(Path.of(filePath));
        return engine.analyze(new AnalysisRequest(file.content(), file.language(), filePath, null));
    }

    /**
     * Cancels pending timers, closes the watcher and then every subscriber.
     * Safe to call more than once.
     */
    @PreDestroy
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        int cancelled = scheduler.cancelAll();
        watchSession.close();
        broadcastChannel.closeAll();
        log.info("Realtime pipeline stopped ({} pending analyses cancelled)", cancelled);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    void onFileChange(FileChangeEvent event) {
        if (stopped.get() || !ignoreMatcher.isCodeFile(event.path())) {
            return;
        }
        log.debug("File {}: {}", event.type().wireName(), event.path());
        scheduler.schedule(event.path().toString(), event.type(), this::runAnalysis);
    }

    void runAnalysis(String filePath, ChangeType changeType) {
        MdcContext.setFile(filePath, changeType);
        try {
            AnalysisReport report = null;
            if (changeType != ChangeType.DELETED) {
                try {
                    report = analyzeFile(filePath);
                } catch (PathNotFoundException e) {
                    log.debug("File vanished before analysis: {}", filePath);
                    changeType = ChangeType.DELETED;
                } catch (FileTooLargeException e) {
                    log.warn("Skipping analysis: {}", e.getMessage());
                    return;
                } catch (UncheckedIOException e) {
                    log.warn("Skipping analysis of {}: {}", filePath, e.getMessage());
                    return;
                }
            }
            var result = new RealtimeAnalysisResult(filePath, report, System.currentTimeMillis(), changeType);
            int delivered = broadcastChannel.publish(ControlAck.realtimeAnalysis(result));
            log.info("Broadcast analysis for {} to {} subscribers", filePath, delivered);
        } finally {
            MdcContext.clear();
        }
    }

    private void ensureRunning() {
        if (stopped.get()) {
            throw new ValidationException("Realtime pipeline is stopped");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
