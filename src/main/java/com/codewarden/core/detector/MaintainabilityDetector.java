package com.codewarden.core.detector;

import com.codewarden.core.engine.AnalysisProperties;
import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Design, code smell, maintainability, testability and documentation checks.
 */
@Component
public class MaintainabilityDetector extends RuleBasedDetector {

    private static final Pattern CLASS_DECLARATION = Pattern.compile("\\bclass\\s");
    private static final Pattern METHOD_LIKE = Pattern.compile("function\\s+\\w+|\\w+\\s*\\(");
    private static final Pattern PROPERTY_ASSIGNMENT = Pattern.compile("this\\.\\w+\\s*=");
    private static final Pattern BRANCH_START = Pattern.compile("\\b(?:switch|if)\\b");
    private static final Pattern INSTANTIATION = Pattern.compile("new\\s+\\w+");
    private static final Pattern FUNCTION_PARAMETERS = Pattern.compile("function\\s+\\w+\\s*\\(([^)]+)\\)");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\b(\\d{2,})\\b");
    private static final Pattern FOREIGN_CALL = Pattern.compile("\\w+\\.\\w+\\(");
    private static final Pattern STATIC_CALL = Pattern.compile("\\b[A-Z]\\w*\\.\\w+\\(");
    private static final Pattern REGEX_LITERAL = Pattern.compile("/[^/]+/[gimuy]*");

    private static final int GOD_CLASS_METHODS = 15;
    private static final int GOD_CLASS_PROPERTIES = 20;
    private static final int FACTORY_WINDOW = 10;
    private static final int FACTORY_INSTANTIATIONS = 3;
    private static final int MAX_PARAMETERS = 5;
    private static final int DUPLICATE_MIN_LENGTH = 20;
    private static final int MAX_FOREIGN_CALLS = 3;
    private static final int MAX_INDENT = 16;
    private static final int MAX_METHOD_LINES = 50;
    private static final int MIN_REGEX_LENGTH = 20;
    private static final int MIN_TODO_LENGTH = 20;

    private final int veryHighComplexityThreshold;

    @Autowired
    public MaintainabilityDetector(AnalysisProperties properties) {
        this(properties.getVeryHighComplexityThreshold());
    }

    MaintainabilityDetector(int veryHighComplexityThreshold) {
        this.veryHighComplexityThreshold = veryHighComplexityThreshold;
        register("design-patterns", this::checkDesignPatterns);
        register("code-smells", this::checkCodeSmells);
        register("maintainability", this::checkMaintainability);
        register("testability", this::checkTestability);
        register("documentation", this::checkDocumentation);
    }

    public MaintainabilityDetector() {
        this(new AnalysisProperties());
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.MAINTAINABILITY;
    }

    private List<Issue> checkDesignPatterns(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (CLASS_DECLARATION.matcher(line).find()) {
                String body = classBody(source, i);
                int methods = SourceLines.count(body, METHOD_LIKE);
                int properties = SourceLines.count(body, PROPERTY_ASSIGNMENT);
                if (methods > GOD_CLASS_METHODS || properties > GOD_CLASS_PROPERTIES) {
                    issues.add(suggestion(n, Severity.HIGH,
                            "God class detected - class has too many responsibilities",
                            "Consider splitting this class into smaller, more focused classes"));
                }
            }

            if (line.contains("new ") && line.contains("Singleton")) {
                issues.add(Issue.at(n, IssueCategory.BUG, Severity.MEDIUM,
                        "Potential singleton pattern misuse",
                        "Ensure singleton pattern is implemented correctly or consider dependency injection"));
            }

            if (BRANCH_START.matcher(line).find()) {
                var window = new StringBuilder();
                for (int j = i; j < Math.min(source.size(), i + FACTORY_WINDOW); j++) {
                    window.append(source.raw(j)).append('\n');
                }
                if (SourceLines.count(window.toString(), INSTANTIATION) > FACTORY_INSTANTIATIONS) {
                    issues.add(suggestion(n, Severity.MEDIUM,
                            "Consider using Factory pattern for object creation",
                            "Multiple object instantiations could benefit from a factory pattern"));
                }
            }
        }
        return issues;
    }

    private List<Issue> checkCodeSmells(SourceLines source) {
        var issues = new ArrayList<Issue>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < source.size(); i++) {
            occurrences.merge(source.trimmed(i), 1, Integer::sum);
        }

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            Matcher params = FUNCTION_PARAMETERS.matcher(line);
            if (params.find()) {
                long count = countParameters(params.group(1));
                if (count > MAX_PARAMETERS) {
                    issues.add(Issue.at(n, IssueCategory.STYLE, Severity.MEDIUM,
                            "Function has too many parameters (" + count + ")",
                            "Consider using an options object or splitting the function"));
                }
            }

            if (line.length() > DUPLICATE_MIN_LENGTH && occurrences.getOrDefault(line, 0) > 1) {
                issues.add(suggestion(n, Severity.LOW,
                        "Duplicate code detected",
                        "Consider extracting common code into a function or constant"));
            }

            Matcher number = NUMBER_LITERAL.matcher(line);
            if (number.find() && !line.contains("//") && isMagicNumber(number.group(1))) {
                issues.add(Issue.at(n, IssueCategory.STYLE, Severity.LOW,
                        "Magic number detected: " + number.group(1).replaceFirst("^0+(?=\\d)", ""),
                        "Consider using a named constant for better readability"));
            }

            if (SourceLines.count(line, FOREIGN_CALL) > MAX_FOREIGN_CALLS) {
                issues.add(suggestion(n, Severity.LOW,
                        "Possible feature envy - too many calls to other objects",
                        "Consider moving this logic closer to the data it operates on"));
            }

            if (source.isJavaScriptFamily()
                    && line.contains("x,") && line.contains("y,") && line.contains("z")) {
                issues.add(suggestion(n, Severity.LOW,
                        "Data clump detected (x, y, z parameters)",
                        "Consider creating a Point or Vector class"));
            }
        }
        return issues;
    }

    private List<Issue> checkMaintainability(SourceLines source) {
        var issues = new ArrayList<Issue>();

        for (FunctionScanner.FunctionSpan span : FunctionScanner.scan(source)) {
            int n = SourceLines.lineNumber(span.startIndex());
            if (span.complexity() > veryHighComplexityThreshold) {
                issues.add(suggestion(n, Severity.HIGH,
                        "Very high cyclomatic complexity (" + span.complexity() + ")",
                        "This function is very complex and hard to maintain. Consider refactoring."));
            }
            if (span.length() > MAX_METHOD_LINES) {
                issues.add(suggestion(n, Severity.MEDIUM,
                        "Long method detected (" + span.length() + " lines)",
                        "Consider breaking this method into smaller, more focused methods"));
            }
        }

        for (int i = 0; i < source.size(); i++) {
            if (!source.trimmed(i).isEmpty() && indentWidth(source.raw(i)) > MAX_INDENT) {
                issues.add(Issue.at(SourceLines.lineNumber(i), IssueCategory.STYLE, Severity.MEDIUM,
                        "Deep nesting detected",
                        "Consider extracting nested logic into separate functions"));
            }
        }
        return issues;
    }

    private List<Issue> checkTestability(SourceLines source) {
        var issues = new ArrayList<Issue>();
        boolean looksLikeTestCode = source.textContains("mock") || source.textContains("test");

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (STATIC_CALL.matcher(line).find()) {
                issues.add(suggestion(n, Severity.LOW,
                        "Static method call detected - may be hard to test",
                        "Consider dependency injection for better testability"));
            }

            if (line.contains("window.") || line.contains("global.") || line.contains("process.env")) {
                issues.add(suggestion(n, Severity.MEDIUM,
                        "Global state access detected",
                        "Consider passing dependencies as parameters for better testability"));
            }

            if (line.contains("new Date()") || line.contains("Date.now()")) {
                issues.add(suggestion(n, Severity.LOW,
                        "Direct date/time dependency",
                        "Consider injecting a time provider for better testability"));
            }

            if (line.contains("Math.random()")) {
                issues.add(suggestion(n, Severity.LOW,
                        "Random number generation affects testability",
                        "Consider injecting a random number generator for deterministic tests"));
            }

            if ((line.contains("fs.") || line.contains("require(") || line.contains("import("))
                    && !looksLikeTestCode) {
                issues.add(suggestion(n, Severity.LOW,
                        "File system or module dependency",
                        "Consider using dependency injection for better testability"));
            }
        }
        return issues;
    }

    private List<Issue> checkDocumentation(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);
            String previous = i > 0 ? source.trimmed(i - 1) : "";

            if ((line.contains("function ") || line.contains("class "))
                    && !previous.contains("*") && !previous.contains("//")) {
                issues.add(suggestion(n, Severity.LOW,
                        "Public function/class without documentation",
                        "Consider adding doc comments to improve code documentation"));
            }

            if (line.contains("/") && line.contains("\\")) {
                Matcher regex = REGEX_LITERAL.matcher(line);
                if (regex.find() && regex.group().length() > MIN_REGEX_LENGTH && !previous.contains("//")) {
                    issues.add(suggestion(n, Severity.LOW,
                            "Complex regular expression without explanation",
                            "Add a comment explaining what this regex does"));
                }
            }

            if ((line.contains("TODO") || line.contains("FIXME")) && line.length() < MIN_TODO_LENGTH) {
                issues.add(suggestion(n, Severity.LOW,
                        "TODO/FIXME without sufficient context",
                        "Provide more details about what needs to be done"));
            }
        }
        return issues;
    }

    /** Text from a class declaration line through its closing brace, or to end of input. */
    private static String classBody(SourceLines source, int startIndex) {
        var body = new StringBuilder();
        int braces = 0;
        for (int i = startIndex; i < source.size(); i++) {
            String line = source.raw(i);
            body.append(line).append('\n');
            braces += SourceLines.braceDelta(line);
            if (braces == 0 && i > startIndex) {
                break;
            }
        }
        return body.toString();
    }

    private static long countParameters(String parameterList) {
        long count = 0;
        for (String p : parameterList.split(",")) {
            if (!p.isBlank()) {
                count++;
            }
        }
        return count;
    }

    private static boolean isMagicNumber(String digits) {
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() > 9) {
            return true;
        }
        int value = Integer.parseInt(significant);
        return value > 10 && value != 100 && value != 1000;
    }

    /** Leading whitespace characters; a tab counts as one. */
    private static int indentWidth(String line) {
        int width = 0;
        while (width < line.length() && Character.isWhitespace(line.charAt(width))) {
            width++;
        }
        return width;
    }

    private static Issue suggestion(int line, Severity severity, String message, String suggestion) {
        return Issue.at(line, IssueCategory.SUGGESTION, severity, message, suggestion);
    }
}
