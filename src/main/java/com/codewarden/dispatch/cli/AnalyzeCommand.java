package com.codewarden.dispatch.cli;

import com.codewarden.core.engine.AnalysisEngine;
import com.codewarden.core.engine.FileTooLargeException;
import com.codewarden.core.engine.PathNotFoundException;
import com.codewarden.core.engine.SourceFileReader;
import com.codewarden.core.model.AnalysisReport;
import com.codewarden.core.model.AnalysisRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: codewarden analyze &lt;file&gt;
 * <p>
 * Analyzes one file and prints its score and findings. Exits with 1 when the
 * file cannot be analyzed, or 2 when the score is below {@code --min-score}.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a source file")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "File to analyze")
    private Path file;

    @Option(names = {"--language", "-l"}, description = "Override the language detected from the extension")
    private String language;

    @Option(names = "--context", description = "Extra context passed to the assessment model")
    private String context;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    @Option(names = "--min-score", description = "Fail when the score is below this value", defaultValue = "0")
    private int minScore;

    private final AnalysisEngine engine;
    private final SourceFileReader fileReader;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(AnalysisEngine engine, SourceFileReader fileReader, ObjectMapper objectMapper) {
        this.engine = engine;
        this.fileReader = fileReader;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        SourceFileReader.SourceFile source;
        try {
            source = fileReader.read(file);
        } catch (PathNotFoundException | FileTooLargeException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        String lang = language != null ? language : source.language();
        AnalysisReport report = engine.analyze(
                new AnalysisRequest(source.content(), lang, file.toString(), context));

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Failed to render report: " + e.getMessage());
                return 1;
            }
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.report(file + " (" + lang + ")", report);
        }
        return report.score() < minScore ? 2 : 0;
    }
}
