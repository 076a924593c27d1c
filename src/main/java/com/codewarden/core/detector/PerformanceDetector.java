package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Algorithmic, memory, async, DOM and database performance checks.
 * <p>
 * Loop context is approximated in two ways: a nesting counter driven by
 * loop keywords and brace depth, and keyword co-occurrence in a fixed window
 * of preceding lines. Neither is data-flow aware.
 */
@Component
public class PerformanceDetector extends RuleBasedDetector {

    static final Pattern LOOP = Pattern.compile("\\b(?:for|while)\\b|\\.forEach\\(");
    private static final Pattern PLAIN_LOOP = Pattern.compile("\\b(?:for|while)\\b");
    private static final Pattern LARGE_NUMBER = Pattern.compile("\\d{4,}");
    private static final Pattern ASYNC = Pattern.compile("\\basync\\b");
    private static final Pattern CALLBACK = Pattern.compile("function\\s*\\(");
    private static final Pattern STRING_LITERAL = Pattern.compile("[\"'`]");
    private static final Pattern DB_READ = Pattern.compile("\\bSELECT\\b|\\.find\\w*\\(");
    private static final Pattern WHERE_EQUALS = Pattern.compile("WHERE\\s+(\\w+)\\s*=");

    private static final int NESTED_LOOP_LIMIT = 2;
    private static final int CONCAT_WINDOW = 10;
    private static final int LOOP_WINDOW = 5;
    private static final int ASYNC_BODY_WINDOW = 20;
    private static final int SYNC_IO_WINDOW = 10;

    public PerformanceDetector() {
        register("algorithmic-complexity", this::checkAlgorithmicComplexity);
        register("memory", this::checkMemoryUsage);
        register("async", this::checkAsyncPatterns);
        register("dom", this::checkDomOperations);
        register("database", this::checkDatabaseQueries);
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.PERFORMANCE;
    }

    /**
     * Tracks how many loop bodies enclose the current line. Each loop records
     * the brace depth it started at and is closed once depth falls back to it.
     */
    static final class LoopTracker {
        private final Deque<Integer> loopStartDepths = new ArrayDeque<>();
        private int depth;

        /** Registers a loop starting on the current line; returns the new nesting level. */
        int enterLoop() {
            loopStartDepths.push(depth);
            return loopStartDepths.size();
        }

        int nesting() {
            return loopStartDepths.size();
        }

        /** Applies the braces of a finished line and closes loops whose block ended. */
        void endLine(String line) {
            depth += SourceLines.braceDelta(line);
            while (!loopStartDepths.isEmpty() && depth <= loopStartDepths.peek()) {
                loopStartDepths.pop();
            }
        }
    }

    private List<Issue> checkAlgorithmicComplexity(SourceLines source) {
        var issues = new ArrayList<Issue>();
        var loops = new LoopTracker();
        boolean fileHasLoop = source.anyLine(l -> PLAIN_LOOP.matcher(l).find());

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (LOOP.matcher(line).find()) {
                int nesting = loops.enterLoop();
                if (nesting > NESTED_LOOP_LIMIT) {
                    issues.add(performance(n, Severity.HIGH,
                            "Deep nested loops detected (depth: " + nesting + ")",
                            "Consider optimizing algorithm complexity or using more efficient data structures"));
                }
            }

            boolean inLoop = loops.nesting() > 0;

            if (inLoop && (line.contains(".indexOf(") || line.contains(".includes("))) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Array.indexOf() or includes() inside loop can be O(n²)",
                        "Consider using Set or Map for O(1) lookups"));
            }

            if ((line.contains(".splice(0") || line.contains(".shift()")) && (inLoop || fileHasLoop)) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Array.splice(0) or shift() in loop is inefficient",
                        "Consider using a queue data structure or reversing iteration"));
            }

            if (inLoop && line.contains(".sort(")) {
                issues.add(performance(n, Severity.HIGH,
                        "Sorting inside loop is inefficient",
                        "Move sorting outside of loop or use more efficient algorithms"));
            }

            loops.endLine(source.raw(i));
        }
        return issues;
    }

    private List<Issue> checkMemoryUsage(SourceLines source) {
        var issues = new ArrayList<Issue>();
        boolean removesListeners = source.textContains("removeEventListener");
        boolean clearsIntervals = source.textContains("clearInterval");

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (line.contains("new Array(") && LARGE_NUMBER.matcher(line).find()) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Creating large array may cause memory issues",
                        "Consider using streams or processing data in chunks"));
            }

            if (line.contains("addEventListener") && !removesListeners) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Potential memory leak - event listener without removal",
                        "Add corresponding removeEventListener() call"));
            }

            if (line.contains("setInterval") && !clearsIntervals) {
                issues.add(performance(n, Severity.HIGH,
                        "Potential memory leak - setInterval without clearInterval",
                        "Add clearInterval() call to clean up timer"));
            }

            if (line.contains("+=") && STRING_LITERAL.matcher(line).find()
                    && source.anyBefore(i, CONCAT_WINDOW, l -> LOOP.matcher(l).find())) {
                issues.add(performance(n, Severity.MEDIUM,
                        "String concatenation in loop is inefficient",
                        "Collect parts and join them once after the loop"));
            }

            if ((line.contains("function(") || line.contains("=>"))
                    && source.anyBefore(i, LOOP_WINDOW, l -> PLAIN_LOOP.matcher(l).find())) {
                issues.add(performance(n, Severity.LOW,
                        "Creating functions inside loops can impact performance",
                        "Define functions outside of loops when possible"));
            }
        }
        return issues;
    }

    private List<Issue> checkAsyncPatterns(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (ASYNC.matcher(line).find()) {
                boolean hasPromises = source.anyFrom(i, ASYNC_BODY_WINDOW, l ->
                        l.contains(".then(") || l.contains("Promise.")
                                || l.contains("fetch(") || l.contains("setTimeout("));
                boolean hasAwait = source.anyFrom(i, ASYNC_BODY_WINDOW, l -> l.contains("await"));
                if (hasPromises && !hasAwait) {
                    issues.add(performance(n, Severity.MEDIUM,
                            "Async function with Promises but no await - potential missed optimization",
                            "Use await for better error handling and readability"));
                }
            }

            if (line.contains("await") && !line.contains("Promise.all")
                    && i + 2 < source.size()
                    && source.trimmed(i + 1).contains("await")
                    && source.trimmed(i + 2).contains("await")) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Sequential await operations - consider parallel execution",
                        "Use Promise.all() for independent async operations"));
            }

            if ((line.contains("readFileSync") || line.contains("execSync"))
                    && source.anyBefore(i, SYNC_IO_WINDOW, l -> l.contains("async"))) {
                issues.add(performance(n, Severity.HIGH,
                        "Synchronous operation in async function blocks event loop",
                        "Use async versions (readFile, exec) with await"));
            }

            if (SourceLines.count(line, CALLBACK) > 2) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Deep callback nesting detected",
                        "Consider using Promises or async/await for better readability"));
            }
        }
        return issues;
    }

    private List<Issue> checkDomOperations(SourceLines source) {
        var issues = new ArrayList<Issue>();
        if (!source.isJavaScriptFamily()) {
            return issues;
        }

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);
            boolean loopNearby = source.anyBefore(i, LOOP_WINDOW, l -> LOOP.matcher(l).find());

            if ((line.contains("document.querySelector") || line.contains("getElementById")) && loopNearby) {
                issues.add(performance(n, Severity.MEDIUM,
                        "DOM query inside loop is expensive",
                        "Cache DOM elements outside of loops"));
            }

            if (line.contains("offsetHeight") || line.contains("offsetWidth")
                    || line.contains("scrollTop") || line.contains("getComputedStyle")) {
                issues.add(performance(n, Severity.LOW,
                        "Property access that triggers layout recalculation",
                        "Batch DOM reads and writes to minimize reflows"));
            }

            if ((line.contains(".style.") || line.contains(".classList.")) && loopNearby) {
                issues.add(performance(n, Severity.MEDIUM,
                        "DOM style manipulation inside loop causes multiple repaints",
                        "Use CSS classes or batch style changes"));
            }

            if (line.contains("innerHTML") && line.contains("+=")) {
                issues.add(performance(n, Severity.HIGH,
                        "innerHTML concatenation is inefficient",
                        "Use DocumentFragment or build string first, then set innerHTML once"));
            }
        }
        return issues;
    }

    private List<Issue> checkDatabaseQueries(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (DB_READ.matcher(line).find()
                    && source.anyBefore(i, LOOP_WINDOW, l -> LOOP.matcher(l).find())) {
                issues.add(performance(n, Severity.HIGH,
                        "Potential N+1 query problem - database query inside loop",
                        "Use joins, includes, or bulk operations to reduce database calls"));
            }

            if (line.contains("WHERE") && !line.contains("INDEX") && WHERE_EQUALS.matcher(line).find()) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Query without explicit index usage",
                        "Ensure proper database indexes exist for query performance"));
            }

            if (line.contains("SELECT *")) {
                issues.add(performance(n, Severity.LOW,
                        "SELECT * queries fetch unnecessary data",
                        "Specify only required columns in SELECT statement"));
            }

            if (line.contains("SELECT") && !line.contains("LIMIT") && !line.contains("TOP")) {
                issues.add(performance(n, Severity.MEDIUM,
                        "Query without LIMIT may return excessive data",
                        "Add LIMIT clause to prevent large result sets"));
            }
        }
        return issues;
    }

    private static Issue performance(int line, Severity severity, String message, String suggestion) {
        return Issue.at(line, IssueCategory.PERFORMANCE, severity, message, suggestion);
    }
}
