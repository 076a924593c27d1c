package com.codewarden.core.detector;

import com.codewarden.core.engine.AnalysisProperties;
import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical and style checks: punctuation, naming, line length, function
 * complexity and common JavaScript/TypeScript pitfalls.
 */
@Component
public class StyleDetector extends RuleBasedDetector {

    private static final int MAX_LINE_LENGTH = 100;
    private static final int MIN_NAME_LENGTH = 3;
    private static final Set<String> ALLOWED_SHORT_NAMES = Set.of("i", "j", "k", "x", "y", "z");

    private static final Pattern VARIABLE_DECLARATION = Pattern.compile("\\b(?:var|let|const)\\s+(\\w+)");
    private static final Pattern FUNCTION_DECLARATION = Pattern.compile("\\bfunction\\s+(\\w+)");
    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][a-zA-Z0-9]*$");
    private static final Pattern LOOSE_EQUALITY = Pattern.compile("(?<![=!<>])==(?!=)");
    private static final Pattern VAR_KEYWORD = Pattern.compile("\\bvar\\s");

    private final int complexityThreshold;

    @Autowired
    public StyleDetector(AnalysisProperties properties) {
        this(properties.getComplexityThreshold());
    }

    StyleDetector(int complexityThreshold) {
        this.complexityThreshold = complexityThreshold;
        register("semicolons", this::checkSemicolons);
        register("unused-variables", this::checkUnusedVariables);
        register("line-length", this::checkLineLength);
        register("todo-comments", this::checkTodoComments);
        register("naming", this::checkNaming);
        register("complexity", this::checkComplexity);
        register("best-practices", this::checkBestPractices);
    }

    public StyleDetector() {
        this(new AnalysisProperties());
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.STYLE;
    }

    private List<Issue> checkSemicolons(SourceLines source) {
        var issues = new ArrayList<Issue>();
        if (!source.isJavaScriptFamily()) {
            return issues;
        }
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            if (line.isEmpty()
                    || line.endsWith(";") || line.endsWith("{") || line.endsWith("}")
                    || FunctionScanner.isComment(line)) {
                continue;
            }
            issues.add(style(SourceLines.lineNumber(i), Severity.LOW,
                    "Missing semicolon",
                    "Add semicolon at the end of the statement"));
        }
        return issues;
    }

    private List<Issue> checkUnusedVariables(SourceLines source) {
        var issues = new ArrayList<Issue>();
        if (!source.isJavaScriptFamily()) {
            return issues;
        }
        for (int i = 0; i < source.size(); i++) {
            Matcher m = VARIABLE_DECLARATION.matcher(source.trimmed(i));
            if (!m.find()) {
                continue;
            }
            String name = m.group(1);
            if (!source.anyFrom(i + 1, source.size(), l -> l.contains(name))) {
                issues.add(style(SourceLines.lineNumber(i), Severity.MEDIUM,
                        "Potentially unused variable: " + name,
                        "Remove unused variable or use it in the code"));
            }
        }
        return issues;
    }

    private List<Issue> checkLineLength(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            if (source.raw(i).length() > MAX_LINE_LENGTH) {
                issues.add(style(SourceLines.lineNumber(i), Severity.LOW,
                        "Line too long (over " + MAX_LINE_LENGTH + " characters)",
                        "Break long lines into multiple lines for better readability"));
            }
        }
        return issues;
    }

    private List<Issue> checkTodoComments(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            if (line.contains("TODO") || line.contains("FIXME")) {
                issues.add(Issue.at(SourceLines.lineNumber(i), IssueCategory.SUGGESTION, Severity.LOW,
                        "TODO/FIXME comment found",
                        "Address the TODO/FIXME comment"));
            }
        }
        return issues;
    }

    private List<Issue> checkNaming(SourceLines source) {
        var issues = new ArrayList<Issue>();
        if (!source.isJavaScriptFamily()) {
            return issues;
        }
        for (int i = 0; i < source.size(); i++) {
            String line = source.raw(i);
            int n = SourceLines.lineNumber(i);

            Matcher function = FUNCTION_DECLARATION.matcher(line);
            if (function.find() && !CAMEL_CASE.matcher(function.group(1)).matches()) {
                issues.add(style(n, Severity.MEDIUM,
                        "Function name '" + function.group(1) + "' should be camelCase",
                        "Use camelCase naming convention for functions"));
            }

            Matcher variable = VARIABLE_DECLARATION.matcher(line);
            if (variable.find()) {
                String name = variable.group(1);
                if (name.length() < MIN_NAME_LENGTH && !ALLOWED_SHORT_NAMES.contains(name)) {
                    issues.add(style(n, Severity.LOW,
                            "Variable name '" + name + "' is too short",
                            "Use descriptive variable names"));
                }
            }
        }
        return issues;
    }

    private List<Issue> checkComplexity(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (FunctionScanner.FunctionSpan span : FunctionScanner.scan(source)) {
            if (span.complexity() > complexityThreshold) {
                issues.add(Issue.at(SourceLines.lineNumber(span.startIndex()),
                        IssueCategory.SUGGESTION, Severity.HIGH,
                        "Function has high cyclomatic complexity (" + span.complexity() + ")",
                        "Consider breaking down the function into smaller functions"));
            }
        }
        return issues;
    }

    private List<Issue> checkBestPractices(SourceLines source) {
        var issues = new ArrayList<Issue>();
        if (!source.isJavaScriptFamily()) {
            return issues;
        }
        boolean fileHandlesErrors = source.textContains("try") || source.textContains("catch");

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (line.contains("console.log")) {
                issues.add(Issue.at(n, IssueCategory.SUGGESTION, Severity.LOW,
                        "console.log found - should be removed in production",
                        "Use proper logging library or remove debug statements"));
            }

            if (LOOSE_EQUALITY.matcher(line).find()) {
                issues.add(Issue.at(n, IssueCategory.BUG, Severity.MEDIUM,
                        "Use strict equality (===) instead of loose equality (==)",
                        "Replace == with === for strict comparison"));
            }

            if (VAR_KEYWORD.matcher(line).find()) {
                issues.add(style(n, Severity.MEDIUM,
                        "Use let or const instead of var",
                        "Replace var with let (for mutable) or const (for immutable) variables"));
            }

            if (line.contains("JSON.parse") && !fileHandlesErrors) {
                issues.add(Issue.at(n, IssueCategory.BUG, Severity.HIGH,
                        "JSON.parse without error handling",
                        "Wrap JSON.parse in try-catch block"));
            }
        }
        return issues;
    }

    private static Issue style(int line, Severity severity, String message, String suggestion) {
        return Issue.at(line, IssueCategory.STYLE, severity, message, suggestion);
    }
}
