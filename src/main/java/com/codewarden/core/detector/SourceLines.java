package com.codewarden.core.detector;

import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Line view over a source text shared by all rules of one detector run.
 * Indexes are 0-based; {@link #lineNumber(int)} converts to the 1-based
 * numbers reported in findings.
 */
public final class SourceLines {

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private static final Set<String> JAVASCRIPT_FAMILY = Set.of("javascript", "typescript");

    private final String text;
    private final String[] raw;
    private final String[] trimmed;
    private final String language;

    private SourceLines(String text, String language) {
        this.text = text;
        this.raw = LINE_BREAK.split(text, -1);
        this.trimmed = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            trimmed[i] = raw[i].trim();
        }
        this.language = language != null ? language.toLowerCase() : "";
    }

    public static SourceLines of(String text, String language) {
        return new SourceLines(text != null ? text : "", language);
    }

    public int size() {
        return raw.length;
    }

    public String raw(int index) {
        return raw[index];
    }

    public String trimmed(int index) {
        return trimmed[index];
    }

    public static int lineNumber(int index) {
        return index + 1;
    }

    public String language() {
        return language;
    }

    public boolean isJavaScriptFamily() {
        return JAVASCRIPT_FAMILY.contains(language);
    }

    /** Whether the whole text contains {@code needle}. */
    public boolean textContains(String needle) {
        return text.contains(needle);
    }

    /** Tests the {@code window} raw lines immediately before {@code index}. */
    public boolean anyBefore(int index, int window, Predicate<String> predicate) {
        for (int i = Math.max(0, index - window); i < index; i++) {
            if (predicate.test(raw[i])) {
                return true;
            }
        }
        return false;
    }

    /** Tests up to {@code count} raw lines starting at {@code index}. */
    public boolean anyFrom(int index, int count, Predicate<String> predicate) {
        for (int i = index; i < Math.min(raw.length, index + count); i++) {
            if (predicate.test(raw[i])) {
                return true;
            }
        }
        return false;
    }

    public boolean anyLine(Predicate<String> predicate) {
        return anyFrom(0, raw.length, predicate);
    }

    public static int count(String line, char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    public static int count(String line, Pattern pattern) {
        var matcher = pattern.matcher(line);
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    /** Net brace delta of a line: opening minus closing braces. */
    public static int braceDelta(String line) {
        return count(line, '{') - count(line, '}');
    }
}
