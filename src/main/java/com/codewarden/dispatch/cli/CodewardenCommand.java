package com.codewarden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Codewarden.
 * Routes to subcommands: analyze, serve, health, languages.
 */
@Command(
        name = "codewarden",
        mixinStandardHelpOptions = true,
        version = "Codewarden 0.1.0",
        description = "Heuristic code quality, security and performance analyzer",
        subcommands = {
                AnalyzeCommand.class,
                ServeCommand.class,
                HealthCommand.class,
                LanguagesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodewardenCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
