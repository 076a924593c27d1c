package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaintainabilityDetectorTest {

    private final MaintainabilityDetector detector = new MaintainabilityDetector();

    private List<Issue> find(MaintainabilityDetector d, String source, String messagePrefix) {
        DetectorResult result = d.detect(source, "javascript");
        assertTrue(result.degradedRules().isEmpty());
        return result.issues().stream().filter(i -> i.message().startsWith(messagePrefix)).toList();
    }

    private List<Issue> find(String source, String messagePrefix) {
        return find(detector, source, messagePrefix);
    }

    private static String functionWithIfs(int ifs) {
        var body = new StringBuilder("function route(v) {\n");
        for (int i = 0; i < ifs; i++) {
            body.append("  if (v > ").append(i).append(") return;\n");
        }
        return body.append("}").toString();
    }

    @Test
    @DisplayName("flags functions with more than five parameters")
    void tooManyParameters() {
        var issues = find("function build(a, b, c, d, e, f) {}", "Function has too many parameters");
        assertEquals(1, issues.size());
        assertEquals("Function has too many parameters (6)", issues.get(0).message());
        assertEquals(IssueCategory.STYLE, issues.get(0).category());
        assertTrue(find("function build(a, b, c, d, e) {}", "Function has too many").isEmpty());
    }

    @Test
    @DisplayName("flags magic numbers except round values and commented lines")
    void magicNumbers() {
        var issues = find("const timeout = 3600;", "Magic number");
        assertEquals(1, issues.size());
        assertEquals("Magic number detected: 3600", issues.get(0).message());

        assertTrue(find("const pct = 100;", "Magic number").isEmpty());
        assertTrue(find("const t = 3600; // seconds", "Magic number").isEmpty());
    }

    @Test
    @DisplayName("flags indentation wider than sixteen columns")
    void deepNesting() {
        assertEquals(1, find(" ".repeat(20) + "doWork();", "Deep nesting").size());
        assertTrue(find(" ".repeat(16) + "doWork();", "Deep nesting").isEmpty());
    }

    @Test
    @DisplayName("counts each leading tab as one indentation character")
    void tabIndentation() {
        assertTrue(find("\t".repeat(5) + "doWork();", "Deep nesting").isEmpty());
        assertEquals(1, find("\t".repeat(17) + "doWork();", "Deep nesting").size());
    }

    @Test
    @DisplayName("flags very high complexity above its own threshold")
    void veryHighComplexity() {
        var issues = find(new MaintainabilityDetector(15), functionWithIfs(15), "Very high cyclomatic");
        assertEquals(1, issues.size());
        assertEquals("Very high cyclomatic complexity (16)", issues.get(0).message());
        assertEquals(1, issues.get(0).line());

        assertTrue(find(new MaintainabilityDetector(15), functionWithIfs(14), "Very high cyclomatic").isEmpty());
    }

    @Test
    @DisplayName("flags methods spanning more than fifty lines")
    void longMethod() {
        var body = new StringBuilder("function work() {\n");
        for (int i = 0; i < 51; i++) {
            body.append("  step();\n");
        }
        body.append("}");

        var issues = find(body.toString(), "Long method");
        assertEquals(1, issues.size());
        assertEquals("Long method detected (52 lines)", issues.get(0).message());
    }

    @Test
    @DisplayName("flags static calls and global state as testability concerns")
    void testability() {
        assertEquals(1, find("const m = Math.max(a, b);", "Static method call").size());
        assertEquals(1, find("const port = process.env.PORT;", "Global state access").size());
    }

    @Test
    @DisplayName("functions preceded by a doc comment are considered documented")
    void documentation() {
        assertEquals(1, find("function add(a, b) {}", "Public function/class without documentation").size());
        assertTrue(find("/** Adds two numbers. */\nfunction add(a, b) {}",
                "Public function/class without documentation").isEmpty());
    }

    @Test
    @DisplayName("short TODOs need more context")
    void shortTodo() {
        assertEquals(1, find("// TODO fix", "TODO/FIXME without sufficient context").size());
    }
}
