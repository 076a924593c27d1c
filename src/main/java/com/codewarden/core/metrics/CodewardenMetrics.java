package com.codewarden.core.metrics;

import com.codewarden.core.model.Enrichment;
import com.codewarden.core.model.Issue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Centralised Micrometer metrics for analysis and the realtime pipeline.
 */
@Service
public class CodewardenMetrics {

    private final MeterRegistry registry;

    public CodewardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(String language, long ms) {
        Timer.builder("codewarden.analysis.duration")
                .tag("language", language == null ? "unknown" : language)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordIssues(List<Issue> issues) {
        for (Issue issue : issues) {
            Counter.builder("codewarden.issues.total")
                    .tag("category", issue.category().wireName())
                    .tag("severity", issue.severity().wireName())
                    .register(registry)
                    .increment();
        }
    }

    /**
     * Records a rule or whole family that threw and was skipped.
     *
     * @param name {@code family.rule} or {@code family}
     */
    public void recordDegradedRule(String name) {
        Counter.builder("codewarden.rules.degraded")
                .description("Detector rules skipped because they failed")
                .tag("rule", name)
                .register(registry)
                .increment();
    }

    public void recordEnrichment(Enrichment.Status status) {
        Counter.builder("codewarden.enrichment.total")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Incremented when a change event re-arms an already pending timer.
     */
    public void recordDebounceCollapse() {
        Counter.builder("codewarden.debounce.collapsed")
                .description("Change events folded into an already pending analysis")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "delivered" or "dropped"
     */
    public void recordBroadcast(String outcome) {
        Counter.builder("codewarden.broadcast.messages")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordWatcherError() {
        Counter.builder("codewarden.watcher.errors")
                .register(registry)
                .increment();
    }
}
