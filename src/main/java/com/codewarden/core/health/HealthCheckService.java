package com.codewarden.core.health;

import com.codewarden.core.engine.AnalysisEngine;
import com.codewarden.core.events.BroadcastChannel;
import com.codewarden.core.watch.WatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final String PROBE_SOURCE = "const probe = 1;";

    private final AnalysisEngine engine;
    private final WatchSession watchSession;
    private final BroadcastChannel broadcastChannel;

    public HealthCheckService(AnalysisEngine engine, WatchSession watchSession, BroadcastChannel broadcastChannel) {
        this.engine = engine;
        this.watchSession = watchSession;
        this.broadcastChannel = broadcastChannel;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEngine());
        results.add(checkWatcher());
        results.add(checkAssessment());
        return results;
    }

    public boolean isAnyDown(List<HealthStatus> statuses) {
        return statuses.stream().anyMatch(s -> s.status() == HealthStatus.Status.DOWN);
    }

    private HealthStatus checkEngine() {
        try {
            var report = engine.detect(PROBE_SOURCE, "javascript");
            if (report.isDegraded()) {
                return new HealthStatus("engine", HealthStatus.Status.DEGRADED,
                        "Some rules failed on probe input",
                        Map.of("degradedRules", String.join(",", report.degradedRules())));
            }
            return new HealthStatus("engine", HealthStatus.Status.UP,
                    "Detectors available", Map.of());
        } catch (RuntimeException e) {
            log.warn("Engine health check failed: {}", e.getMessage());
            return new HealthStatus("engine", HealthStatus.Status.DOWN,
                    "Engine error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWatcher() {
        var metadata = Map.of(
                "watchedPaths", String.valueOf(watchSession.watchedPaths().size()),
                "subscribers", String.valueOf(broadcastChannel.subscriberCount()));
        if (!watchSession.isHealthy()) {
            String error = watchSession.lastError();
            return new HealthStatus("watcher", HealthStatus.Status.DOWN,
                    "File watcher failed" + (error != null ? ": " + error : ""), metadata);
        }
        return new HealthStatus("watcher", HealthStatus.Status.UP,
                "File watcher ready", metadata);
    }

    private HealthStatus checkAssessment() {
        if (engine.isAssessmentAvailable()) {
            return new HealthStatus("assessment", HealthStatus.Status.UP,
                    "Assessment model configured", Map.of());
        }
        return new HealthStatus("assessment", HealthStatus.Status.DEGRADED,
                "No assessment model configured; reports carry no summary", Map.of());
    }
}
