package com.codewarden.dispatch.cli;

import com.codewarden.core.engine.LanguageDetector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: codewarden languages
 */
@Command(name = "languages", mixinStandardHelpOptions = true, description = "List supported languages")
@Component
public class LanguagesCommand implements Runnable {

    @Override
    public void run() {
        LanguageDetector.SUPPORTED_LANGUAGES.forEach(System.out::println);
    }
}
