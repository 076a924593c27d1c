package com.codewarden.core.scoring;

import com.codewarden.core.engine.AnalysisProperties;
import com.codewarden.core.model.Issue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a list of findings into a 0..100 score by subtracting a fixed weight
 * per severity from 100. There are no diminishing returns, so enough
 * low-severity findings still reach 0.
 */
@Component
public class ScoringPolicy {

    public static final int MAX_SCORE = 100;

    private final AnalysisProperties.Weights weights;

    @Autowired
    public ScoringPolicy(AnalysisProperties properties) {
        this.weights = properties.getWeights();
    }

    public ScoringPolicy() {
        this(new AnalysisProperties());
    }

    /**
     * Never throws; {@code null} lists and {@code null} entries count as nothing.
     * Negative configured weights are treated as 0 so adding a finding can never raise the score.
     */
    public int score(List<Issue> issues) {
        if (issues == null) {
            return MAX_SCORE;
        }
        long deduction = 0;
        for (Issue issue : issues) {
            if (issue != null) {
                deduction += Math.max(0, weights.weightOf(issue.severity()));
            }
        }
        return (int) Math.max(0, MAX_SCORE - deduction);
    }
}
