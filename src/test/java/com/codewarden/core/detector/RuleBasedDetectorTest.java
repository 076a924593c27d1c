package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedDetectorTest {

    private static Issue at(Integer line, String message) {
        return new Issue(IssueCategory.STYLE, Severity.LOW, line, message, null);
    }

    static class PartlyBrokenDetector extends RuleBasedDetector {
        PartlyBrokenDetector() {
            register("first", source -> List.of(at(3, "three"), at(1, "one")));
            register("boom", source -> {
                throw new IllegalStateException("boom");
            });
            register("last", source -> List.of(at(null, "file-level"), at(2, "two")));
        }

        @Override
        public DetectorFamily family() {
            return DetectorFamily.STYLE;
        }
    }

    @Test
    @DisplayName("a failing rule is reported as degraded and the others still run")
    void failingRuleDegrades() {
        DetectorResult result = new PartlyBrokenDetector().detect("anything", "javascript");

        assertEquals(List.of("style.boom"), result.degradedRules());
        assertEquals(Arrays.asList(1, 2, 3, null), result.issues().stream().map(Issue::line).toList());
        assertEquals("file-level", result.issues().get(3).message());
    }

    @Test
    @DisplayName("registering the same rule twice is rejected")
    void duplicateRule() {
        class Duplicate extends RuleBasedDetector {
            Duplicate() {
                register("same", source -> List.of());
                register("same", source -> List.of());
            }

            @Override
            public DetectorFamily family() {
                return DetectorFamily.SECURITY;
            }
        }
        var ex = assertThrows(IllegalStateException.class, Duplicate::new);
        assertTrue(ex.getMessage().contains("same"));
    }

    @Test
    @DisplayName("null input is treated as empty text")
    void nullSource() {
        assertTrue(new SecurityDetector().detect(null, null).issues().isEmpty());
    }
}
