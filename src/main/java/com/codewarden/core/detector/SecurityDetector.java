package com.codewarden.core.detector;

import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Injection, cryptography, authentication, data exposure and dependency checks.
 * <p>
 * Detection is signature based: fixed keyword lists and regexes applied per
 * line, with string concatenation next to a query or exec call taken as a
 * taint signal.
 */
@Component
public class SecurityDetector extends RuleBasedDetector {

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("password\\s*[=:]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("api[_-]?key\\s*[=:]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("secret\\s*[=:]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("token\\s*[=:]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern SQL_WRITE_OR_READ = Pattern.compile("\\b(?:SELECT|INSERT|UPDATE)\\b");
    private static final Pattern WEAK_HASH = Pattern.compile("\\b(?:md5|sha1)\\b|\\bsha-1\\b");
    private static final Pattern WEAK_CIPHER = Pattern.compile("\\b(?:3DES|DES|DESede|TripleDES)\\b");
    private static final Pattern MUTATING_ROUTE = Pattern.compile("router\\.(?:delete|put|post)\\b");

    private static final List<String> SENSITIVE_LOG_TERMS =
            List.of("password", "token", "secret", "key", "credit", "ssn");
    private static final List<String> DANGEROUS_MODULES = List.of("eval", "vm", "child_process");
    private static final List<String> DEPRECATED_PACKAGES = List.of("request", "node-uuid");

    public SecurityDetector() {
        register("injection", this::checkInjection);
        register("cryptography", this::checkCryptography);
        register("authentication", this::checkAuthentication);
        register("data-exposure", this::checkDataExposure);
        register("dependencies", this::checkDependencies);
    }

    @Override
    public DetectorFamily family() {
        return DetectorFamily.SECURITY;
    }

    private List<Issue> checkInjection(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if ((line.contains("query") || line.contains("execute"))
                    && line.contains("+")
                    && SQL_WRITE_OR_READ.matcher(line).find()) {
                issues.add(security(n, Severity.CRITICAL,
                        "Potential SQL injection vulnerability - string concatenation in SQL query",
                        "Use parameterized queries or prepared statements"));
            }

            if (source.isJavaScriptFamily()) {
                if (line.contains("innerHTML") && line.contains("+")) {
                    issues.add(security(n, Severity.HIGH,
                            "Potential XSS vulnerability - dynamic HTML content",
                            "Use textContent or properly sanitize HTML content"));
                }
                if (line.contains("eval(")) {
                    issues.add(security(n, Severity.CRITICAL,
                            "Use of eval() is dangerous and can lead to code injection",
                            "Avoid eval() and use safer alternatives like JSON.parse()"));
                }
            }

            if ((line.contains("exec(") || line.contains("system(") || line.contains("shell_exec("))
                    && (line.contains("+") || line.contains("${"))) {
                issues.add(security(n, Severity.CRITICAL,
                        "Potential command injection vulnerability",
                        "Validate and sanitize input before executing system commands"));
            }

            if (line.contains("../") || line.contains("..\\")) {
                issues.add(security(n, Severity.HIGH,
                        "Potential path traversal vulnerability",
                        "Validate file paths and resolve them against a fixed base directory"));
            }
        }
        return issues;
    }

    private List<Issue> checkCryptography(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (WEAK_HASH.matcher(line.toLowerCase()).find()) {
                issues.add(security(n, Severity.HIGH,
                        "Weak hashing algorithm detected (MD5/SHA1)",
                        "Use stronger hashing algorithms like SHA-256 or bcrypt for passwords"));
            }

            for (Pattern pattern : SECRET_PATTERNS) {
                if (pattern.matcher(line).find()) {
                    issues.add(security(n, Severity.CRITICAL,
                            "Hard-coded secret detected",
                            "Move secrets to environment variables or secure configuration"));
                }
            }

            if (line.contains("Math.random()")) {
                issues.add(security(n, Severity.MEDIUM,
                        "Math.random() is not cryptographically secure",
                        "Use a cryptographically secure random source for security-sensitive values"));
            }

            if (WEAK_CIPHER.matcher(line).find()) {
                issues.add(security(n, Severity.HIGH,
                        "Weak encryption algorithm detected",
                        "Use AES encryption instead of DES/3DES"));
            }
        }
        return issues;
    }

    private List<Issue> checkAuthentication(SourceLines source) {
        var issues = new ArrayList<Issue>();
        boolean fileMentionsAuth = source.textContains("authenticate")
                || source.textContains("auth")
                || source.textContains("verify");

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (line.contains("session") && line.contains("httpOnly: false")) {
                issues.add(security(n, Severity.HIGH,
                        "Session cookies should have httpOnly flag",
                        "Set httpOnly: true for session cookies to prevent XSS access"));
            }
            if (line.contains("session") && line.contains("secure: false")) {
                issues.add(security(n, Severity.HIGH,
                        "Session cookies should have secure flag in production",
                        "Set secure: true for session cookies in HTTPS environments"));
            }
            if (line.contains("jwt.sign") && !line.contains("expiresIn")) {
                issues.add(security(n, Severity.MEDIUM,
                        "JWT token without expiration time",
                        "Set appropriate expiration time for JWT tokens"));
            }
            if (MUTATING_ROUTE.matcher(line).find() && !fileMentionsAuth) {
                issues.add(security(n, Severity.HIGH,
                        "Potential missing authentication for sensitive route",
                        "Add authentication middleware for sensitive operations"));
            }
        }
        return issues;
    }

    private List<Issue> checkDataExposure(SourceLines source) {
        var issues = new ArrayList<Issue>();
        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (line.contains("console.log") || line.contains("logger")) {
                String lower = line.toLowerCase();
                if (SENSITIVE_LOG_TERMS.stream().anyMatch(lower::contains)) {
                    issues.add(security(n, Severity.HIGH,
                            "Potential sensitive data exposure in logs",
                            "Avoid logging sensitive information"));
                }
            }

            if ((line.contains("throw new Error") || line.contains("res.send"))
                    && (line.contains("database") || line.contains("SQL") || line.contains("password"))) {
                issues.add(security(n, Severity.MEDIUM,
                        "Error message may expose sensitive information",
                        "Use generic error messages for client responses"));
            }

            if (line.contains("Access-Control-Allow-Origin") && line.contains("*")) {
                issues.add(security(n, Severity.MEDIUM,
                        "Wildcard CORS policy detected",
                        "Specify allowed origins instead of using wildcard (*)"));
            }
        }
        return issues;
    }

    private List<Issue> checkDependencies(SourceLines source) {
        var issues = new ArrayList<Issue>();
        boolean fileValidatesPaths = source.textContains("path.resolve") || source.textContains("path.join");

        for (int i = 0; i < source.size(); i++) {
            String line = source.trimmed(i);
            int n = SourceLines.lineNumber(i);

            if (line.contains("require(") || line.contains("import")) {
                for (String module : DANGEROUS_MODULES) {
                    if (quotes(line, module)) {
                        issues.add(security(n, Severity.HIGH,
                                "Use of potentially dangerous module: " + module,
                                "Review the necessity and implement proper security measures"));
                    }
                }
                for (String pkg : DEPRECATED_PACKAGES) {
                    if (quotes(line, pkg)) {
                        issues.add(security(n, Severity.MEDIUM,
                                "Deprecated package detected: " + pkg,
                                "Replace with actively maintained alternatives"));
                    }
                }
            }

            if (line.contains("fs.")
                    && (line.contains("readFile") || line.contains("writeFile"))
                    && !fileValidatesPaths) {
                issues.add(security(n, Severity.MEDIUM,
                        "File system operation without path validation",
                        "Use path.resolve() or path.join() to validate file paths"));
            }
        }
        return issues;
    }

    private static boolean quotes(String line, String name) {
        return line.contains("'" + name + "'") || line.contains("\"" + name + "\"");
    }

    private static Issue security(int line, Severity severity, String message, String suggestion) {
        return Issue.at(line, IssueCategory.SECURITY, severity, message, suggestion);
    }
}
