package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for detector families built from named line-scanning rules.
 * <p>
 * Rules run in registration order and the combined findings are then
 * stably ordered by line, file-level findings last. A rule that throws is
 * skipped and its qualified name is reported as degraded; the remaining
 * rules still run.
 */
public abstract class RuleBasedDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDetector.class);

    /** A single check over the scanned source. */
    @FunctionalInterface
    protected interface Rule {
        List<Issue> check(SourceLines source);
    }

    private static final Comparator<Issue> IN_FILE_ORDER = Comparator.comparing(
            Issue::line, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    protected final void register(String name, Rule rule) {
        if (rules.putIfAbsent(name, rule) != null) {
            throw new IllegalStateException("Duplicate rule " + name + " in " + family().id());
        }
    }

    /** Rule names in execution order. */
    public List<String> ruleNames() {
        return List.copyOf(rules.keySet());
    }

    @Override
    public DetectorResult detect(String source, String language) {
        SourceLines lines = SourceLines.of(source, language);
        var issues = new ArrayList<Issue>();
        var degraded = new ArrayList<String>();

        for (Map.Entry<String, Rule> entry : rules.entrySet()) {
            String qualifiedName = family().id() + "." + entry.getKey();
            try {
                issues.addAll(entry.getValue().check(lines));
            } catch (RuntimeException e) {
                log.warn("Rule {} failed, skipping: {}", qualifiedName, e.getMessage(), e);
                degraded.add(qualifiedName);
            }
        }
        issues.sort(IN_FILE_ORDER);
        return new DetectorResult(issues, degraded);
    }
}
