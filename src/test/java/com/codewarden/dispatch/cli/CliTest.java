package com.codewarden.dispatch.cli;

import com.codewarden.core.engine.AnalysisEngine;
import com.codewarden.core.engine.AnalysisProperties;
import com.codewarden.core.engine.SourceFileReader;
import com.codewarden.core.health.HealthCheckService;
import com.codewarden.core.health.HealthStatus;
import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.AnalysisRequest;
import com.codewarden.core.model.Enrichment;
import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the Codewarden CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private AnalysisEngine engine;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        engine = mock(AnalysisEngine.class);
        when(engine.analyze(any(AnalysisRequest.class))).thenReturn(new AnalysisReport(List.of(
                Issue.at(3, IssueCategory.SECURITY, Severity.CRITICAL,
                        "Use of eval() is dangerous and can lead to code injection", "Avoid eval()")),
                62, List.of(), Enrichment.skipped()));

        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("engine", HealthStatus.Status.UP, "Detectors available", Map.of()),
                new HealthStatus("assessment", HealthStatus.Status.DEGRADED,
                        "No assessment model configured; reports carry no summary", Map.of())));
    }

    /**
     * Custom picocli IFactory that provides mock dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AnalyzeCommand.class) {
                    return (K) new AnalyzeCommand(engine,
                            new SourceFileReader(new AnalysisProperties()), new ObjectMapper());
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new CodewardenCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path sourceFile() throws IOException {
        return Files.writeString(tempDir.resolve("app.js"), "const x = 5\nconsole.log(x)\nvar y = eval(x)");
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("analyze", "serve", "health", "languages")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("CODEWARDEN v0.1.0"));
            assertTrue(result.output().contains("Usage: codewarden"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Codewarden 0.1.0"));
        }
    }

    @Nested
    @DisplayName("analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("prints score and findings")
        void analyzeFile() throws IOException {
            Path file = sourceFile();

            CliResult result = execute("analyze", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("62/100"), result.output());
            assertTrue(result.output().contains("CRITICAL"));
            assertTrue(result.output().contains("Use of eval()"));

            var request = ArgumentCaptor.forClass(AnalysisRequest.class);
            verify(engine).analyze(request.capture());
            assertEquals("javascript", request.getValue().language());
            assertEquals(file.toString(), request.getValue().filePath());
        }

        @Test
        @DisplayName("--language and --context are passed to the engine")
        void languageOverride() throws IOException {
            Path file = sourceFile();

            execute("analyze", file.toString(), "-l", "typescript", "--context", "legacy module");

            var request = ArgumentCaptor.forClass(AnalysisRequest.class);
            verify(engine).analyze(request.capture());
            assertEquals("typescript", request.getValue().language());
            assertEquals("legacy module", request.getValue().context());
        }

        @Test
        @DisplayName("--json prints the report as JSON")
        void json() throws IOException {
            CliResult result = execute("analyze", sourceFile().toString(), "--json");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"score\" : 62"), result.output());
            assertFalse(result.output().contains("CODEWARDEN v0.1.0"));
        }

        @Test
        @DisplayName("--min-score above the score exits with 2")
        void minScore() throws IOException {
            assertEquals(2, execute("analyze", sourceFile().toString(), "--min-score", "70").exitCode());
            assertEquals(0, execute("analyze", sourceFile().toString(), "--min-score", "62").exitCode());
        }

        @Test
        @DisplayName("a missing file exits with 1")
        void missingFile() {
            CliResult result = execute("analyze", tempDir.resolve("gone.js").toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Path does not exist"));
            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("other commands")
    class OtherCommands {

        @Test
        @DisplayName("languages lists supported languages")
        void languages() {
            CliResult result = execute("languages");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("javascript"));
            assertTrue(result.output().contains("kotlin"));
        }

        @Test
        @DisplayName("health reports each component")
        void health() {
            CliResult result = execute("health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("engine: Detectors available"));
            assertTrue(result.output().contains("Overall: one or more components degraded or down"));
        }
    }
}
