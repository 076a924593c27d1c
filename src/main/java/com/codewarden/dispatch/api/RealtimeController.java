package com.codewarden.dispatch.api;

import com.codewarden.core.engine.FileTooLargeException;
import com.codewarden.core.engine.PathNotFoundException;
import com.codewarden.core.engine.ValidationException;
import com.codewarden.core.realtime.RealtimePipeline;
import com.codewarden.core.watch.WatchSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST mirror of the watch/unwatch control messages.
 */
@RestController
@RequestMapping("/api/v1/realtime")
public class RealtimeController {

    private final RealtimePipeline pipeline;
    private final WatchSession watchSession;

    public RealtimeController(RealtimePipeline pipeline, WatchSession watchSession) {
        this.pipeline = pipeline;
        this.watchSession = watchSession;
    }

    /**
     * POST /api/v1/realtime/watch : Start watching a path.
     * Returns 404 if the path does not exist.
     */
    @PostMapping("/watch")
    public ResponseEntity<Map<String, Object>> watch(@RequestBody WatchRequest request) {
        try {
            boolean added = pipeline.watch(request.path());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("type", "watch_started");
            body.put("path", request.path());
            body.put("alreadyWatched", !added);
            return ResponseEntity.ok(body);
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (PathNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (UncheckedIOException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/realtime/watch : Stop watching a path.
     */
    @DeleteMapping("/watch")
    public ResponseEntity<Map<String, Object>> unwatch(@RequestBody WatchRequest request) {
        try {
            boolean removed = pipeline.unwatch(request.path());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("type", "watch_stopped");
            body.put("path", request.path());
            body.put("wasWatched", removed);
            return ResponseEntity.ok(body);
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/realtime/analyze-file : Analyze one file on disk immediately.
     * Returns 404 if the file does not exist, 413 if it is too large.
     */
    @PostMapping("/analyze-file")
    public ResponseEntity<?> analyzeFile(@RequestBody AnalyzeFileRequest request) {
        try {
            return ResponseEntity.ok(pipeline.analyzeFile(request.filePath()));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (PathNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (FileTooLargeException e) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(Map.of("error", e.getMessage()));
        } catch (UncheckedIOException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/realtime/watched-paths : Currently watched roots.
     */
    @GetMapping("/watched-paths")
    public ResponseEntity<Map<String, Object>> watchedPaths() {
        return ResponseEntity.ok(Map.of("paths", watchSession.watchedPaths()));
    }

    public record WatchRequest(String path) {}

    public record AnalyzeFileRequest(String filePath) {}
}
