package com.codewarden.core.detector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds function bodies by brace counting and accumulates a cyclomatic
 * complexity estimate for each one.
 * <p>
 * A function starts on a line that carries {@code function}, {@code =>} or a
 * method-like signature ending in an opening brace. Its brace depth at that
 * point is recorded and the function ends on the first later line containing
 * {@code }} after which the depth is back at or below the recorded value.
 * Branch keywords count toward the innermost open function only.
 * Functions still open at end of input are not reported.
 */
final class FunctionScanner {

    static final Pattern BRANCH = Pattern.compile(
            "\\b(?:if|for|while|switch|case|catch)\\b|&&|\\|\\||\\s\\?\\s");

    private static final Pattern FUNCTION_MARKER = Pattern.compile("\\bfunction\\b|=>");

    private static final Pattern METHOD_SIGNATURE = Pattern.compile(
            "^(?:[\\w@<>\\[\\],.?]+\\s+)+(\\w+)\\s*\\([^;]*\\)\\s*(?:throws\\s+[\\w.,\\s]+)?\\{\\s*$");

    private static final Set<String> NOT_METHOD_NAMES = Set.of(
            "if", "for", "while", "switch", "catch", "synchronized", "return", "new", "else");

    /**
     * A closed function body.
     *
     * @param startIndex 0-based line of the signature
     * @param endIndex   0-based line of the closing brace
     * @param complexity 1 + number of branch points inside the body
     */
    record FunctionSpan(int startIndex, int endIndex, int complexity) {
        int length() {
            return endIndex - startIndex;
        }
    }

    private static final class OpenFunction {
        final int startIndex;
        final int startDepth;
        int complexity = 1;

        OpenFunction(int startIndex, int startDepth) {
            this.startIndex = startIndex;
            this.startDepth = startDepth;
        }
    }

    private FunctionScanner() {}

    static List<FunctionSpan> scan(SourceLines source) {
        var spans = new ArrayList<FunctionSpan>();
        Deque<OpenFunction> open = new ArrayDeque<>();
        int depth = 0;

        for (int i = 0; i < source.size(); i++) {
            String line = source.raw(i);
            String trimmed = source.trimmed(i);
            boolean hasOpeningBrace = line.indexOf('{') >= 0;

            OpenFunction started = null;
            if (hasOpeningBrace && isFunctionStart(trimmed)) {
                started = new OpenFunction(i, depth);
                open.push(started);
            }

            if (!open.isEmpty()) {
                open.peek().complexity += SourceLines.count(trimmed, BRANCH);
            }

            depth += SourceLines.braceDelta(line);

            if (line.indexOf('}') < 0) {
                continue;
            }
            while (!open.isEmpty() && depth <= open.peek().startDepth) {
                OpenFunction closed = open.pop();
                spans.add(new FunctionSpan(closed.startIndex, i, closed.complexity));
            }
        }

        spans.sort(Comparator.comparingInt(FunctionSpan::startIndex));
        return spans;
    }

    static boolean isFunctionStart(String trimmed) {
        if (isComment(trimmed)) {
            return false;
        }
        if (FUNCTION_MARKER.matcher(trimmed).find()) {
            return true;
        }
        if (trimmed.contains("new ")) {
            return false;
        }
        Matcher m = METHOD_SIGNATURE.matcher(trimmed);
        return m.matches() && !NOT_METHOD_NAMES.contains(m.group(1));
    }

    static boolean isComment(String trimmed) {
        return trimmed.startsWith("//") || trimmed.startsWith("*") || trimmed.startsWith("/*");
    }
}
