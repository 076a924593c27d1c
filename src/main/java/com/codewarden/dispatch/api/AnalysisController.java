package com.codewarden.dispatch.api;

import com.codewarden.core.engine.AnalysisEngine;
import com.codewarden.core.engine.LanguageDetector;
import com.codewarden.core.engine.ValidationException;
import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.AnalysisRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * One-shot analysis of submitted source text.
 */
@RestController
@RequestMapping("/api/v1")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisEngine engine;

    public AnalysisController(AnalysisEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/analyze : Analyze a code snippet.
     * Returns 400 when code or language is missing.
     */
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        if (request == null || request.code() == null || request.code().isEmpty()
                || request.language() == null || request.language().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Code and language are required"));
        }
        try {
            AnalysisReport report = engine.analyze(request);
            log.info("Analyzed {} ({}): {} issues, score {}",
                    request.filePath() != null ? request.filePath() : "snippet",
                    request.language(), report.issues().size(), report.score());
            return ResponseEntity.ok(report);
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/languages : Languages the detectors understand.
     */
    @GetMapping("/languages")
    public ResponseEntity<Map<String, Object>> languages() {
        return ResponseEntity.ok(Map.of("languages", LanguageDetector.SUPPORTED_LANGUAGES));
    }
}
