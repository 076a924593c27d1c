package com.codewarden.core.engine;

import com.codewarden.core.detector.Detector;
import com.codewarden.core.detector.DetectorResult;
import com.codewarden.core.llm.Assessment;
import com.codewarden.core.llm.AssessmentService;
import com.codewarden.core.llm.LlmProperties;
import com.codewarden.core.metrics.CodewardenMetrics;
import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.AnalysisRequest;
import com.codewarden.core.model.Enrichment;
import com.codewarden.core.model.Issue;
import com.codewarden.core.scoring.ScoringPolicy;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the four detector families over a source text, joins their findings
 * in family order and scores the result.
 * <p>
 * Families run concurrently on a dedicated pool and the engine waits for all
 * of them before scoring, so output does not depend on completion order.
 * A family that fails as a whole is reported as degraded and contributes no
 * findings. The optional assessment runs after scoring under its own timeout
 * and never changes issues or score.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final List<Detector> detectors;
    private final ScoringPolicy scoringPolicy;
    private final AssessmentService assessmentService;
    private final CodewardenMetrics metrics;
    private final long enrichmentTimeoutMs;
    private final ExecutorService detectorPool;
    private final ExecutorService enrichmentPool;

    @Autowired
    public AnalysisEngine(List<Detector> detectors,
                          ScoringPolicy scoringPolicy,
                          AssessmentService assessmentService,
                          CodewardenMetrics metrics,
                          AnalysisProperties analysisProperties,
                          LlmProperties llmProperties) {
        this(detectors, scoringPolicy, assessmentService, metrics,
                analysisProperties.getDetectorParallelism(), llmProperties.getTimeoutMs());
    }

    AnalysisEngine(List<Detector> detectors,
                   ScoringPolicy scoringPolicy,
                   AssessmentService assessmentService,
                   CodewardenMetrics metrics,
                   int parallelism,
                   long enrichmentTimeoutMs) {
        var ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparing(Detector::family));
        this.detectors = List.copyOf(ordered);
        this.scoringPolicy = scoringPolicy;
        this.assessmentService = assessmentService;
        this.metrics = metrics;
        this.enrichmentTimeoutMs = enrichmentTimeoutMs;
        this.detectorPool = Executors.newFixedThreadPool(Math.max(1, parallelism), daemonThreads("detector"));
        this.enrichmentPool = Executors.newCachedThreadPool(daemonThreads("assessment"));
        log.info("AnalysisEngine initialized with {} detector families (parallelism={})",
                this.detectors.size(), Math.max(1, parallelism));
    }

    /**
     * Analyzes the text and attaches an assessment when the service is available.
     */
    public AnalysisReport analyze(String code, String language) {
        return analyze(new AnalysisRequest(code, language));
    }

    /**
     * Validates the request, runs detection and scoring, then the optional assessment.
     *
     * @throws ValidationException when code or language is missing
     */
    public AnalysisReport analyze(AnalysisRequest request) {
        if (request == null || request.code() == null || request.language() == null
                || request.language().isBlank()) {
            throw new ValidationException("Code and language are required");
        }
        AnalysisReport report = detect(request.code(), request.language());
        return report.withEnrichment(enrich(request, report.issues()));
    }

    /**
     * Runs detection and scoring only. Deterministic for a given input.
     */
    public AnalysisReport detect(String code, String language) {
        long start = System.currentTimeMillis();
        String source = code != null ? code : "";

        var futures = new ArrayList<Future<DetectorResult>>(detectors.size());
        for (Detector detector : detectors) {
            try {
                futures.add(detectorPool.submit(() -> detector.detect(source, language)));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }

        var issues = new ArrayList<Issue>();
        var degraded = new ArrayList<String>();
        boolean interrupted = false;
        for (int i = 0; i < detectors.size(); i++) {
            String family = detectors.get(i).family().id();
            if (interrupted) {
                futures.get(i).cancel(true);
                degraded.add(family);
                continue;
            }
            try {
                DetectorResult result = futures.get(i).get();
                issues.addAll(result.issues());
                degraded.addAll(result.degradedRules());
            } catch (ExecutionException e) {
                log.warn("Detector family {} failed: {}", family, e.getCause().getMessage(), e.getCause());
                degraded.add(family);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                degraded.add(family);
            }
        }

        int score = scoringPolicy.score(issues);
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Analysis complete ({}): {} issues, score {}, {}ms", language, issues.size(), score, elapsed);
        metrics.recordAnalysis(language, elapsed);
        metrics.recordIssues(issues);
        degraded.forEach(metrics::recordDegradedRule);
        return new AnalysisReport(issues, score, degraded, Enrichment.skipped());
    }

    private Enrichment enrich(AnalysisRequest request, List<Issue> issues) {
        if (!assessmentService.isAvailable()) {
            return Enrichment.skipped();
        }
        Future<Assessment> call;
        try {
            call = enrichmentPool.submit(
                    () -> assessmentService.summarize(request.code(), request.language(), issues, request.context()));
        } catch (RejectedExecutionException e) {
            log.warn("Assessment rejected: {}", e.getMessage());
            return Enrichment.failed("Assessment unavailable: engine is shutting down");
        }
        Enrichment enrichment;
        try {
            Assessment assessment = call.get(enrichmentTimeoutMs, TimeUnit.MILLISECONDS);
            enrichment = assessment == null
                    ? Enrichment.failed("Assessment service returned nothing")
                    : Enrichment.ok(assessment.summary(), assessment.optimizedCode());
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Assessment timed out after {}ms", enrichmentTimeoutMs);
            enrichment = Enrichment.timeout(enrichmentTimeoutMs);
        } catch (ExecutionException e) {
            log.warn("Assessment failed: {}", e.getCause().getMessage());
            enrichment = Enrichment.failed(e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            enrichment = Enrichment.failed("Interrupted while waiting for assessment");
        }
        metrics.recordEnrichment(enrichment.status());
        return enrichment;
    }

    public boolean isAssessmentAvailable() {
        return assessmentService.isAvailable();
    }

    @PreDestroy
    public void shutdown() {
        detectorPool.shutdownNow();
        enrichmentPool.shutdownNow();
        try {
            detectorPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("AnalysisEngine stopped");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
