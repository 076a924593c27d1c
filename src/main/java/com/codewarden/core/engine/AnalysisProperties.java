package com.codewarden.core.engine;

import com.codewarden.core.model.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the analysis engine. The complexity thresholds and severity
 * weights are heuristic constants kept configurable.
 */
@Component
@ConfigurationProperties(prefix = "codewarden.analysis")
public class AnalysisProperties {

    private int maxFileSizeMb = 10;
    private int complexityThreshold = 10;
    private int veryHighComplexityThreshold = 15;
    private int detectorParallelism = 4;
    private Weights weights = new Weights();

    public int getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public void setMaxFileSizeMb(int maxFileSizeMb) {
        this.maxFileSizeMb = maxFileSizeMb;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeMb * 1024L * 1024L;
    }

    public int getComplexityThreshold() {
        return complexityThreshold;
    }

    public void setComplexityThreshold(int complexityThreshold) {
        this.complexityThreshold = complexityThreshold;
    }

    public int getVeryHighComplexityThreshold() {
        return veryHighComplexityThreshold;
    }

    public void setVeryHighComplexityThreshold(int veryHighComplexityThreshold) {
        this.veryHighComplexityThreshold = veryHighComplexityThreshold;
    }

    public int getDetectorParallelism() {
        return detectorParallelism;
    }

    public void setDetectorParallelism(int detectorParallelism) {
        this.detectorParallelism = detectorParallelism;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    public static class Weights {
        private int critical = 20;
        private int high = 10;
        private int medium = 5;
        private int low = 2;

        public int weightOf(Severity severity) {
            return switch (severity) {
                case CRITICAL -> critical;
                case HIGH -> high;
                case MEDIUM -> medium;
                case LOW -> low;
            };
        }

        public int getCritical() { return critical; }
        public void setCritical(int critical) { this.critical = critical; }
        public int getHigh() { return high; }
        public void setHigh(int high) { this.high = high; }
        public int getMedium() { return medium; }
        public void setMedium(int medium) { this.medium = medium; }
        public int getLow() { return low; }
        public void setLow(int low) { this.low = low; }
    }
}
