package com.codewarden.core.llm;

import com.codewarden.core.model.Issue;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;

import java.util.List;

/**
 * Asks a chat model for a summary and an optimised version of the analysed code.
 * <p>
 * Uses {@link BeanOutputConverter} to append a JSON schema for {@link Assessment}
 * to the prompt, falling back to lenient Jackson parsing when the model wraps
 * or decorates its JSON.
 */
public class LlmAssessmentService implements AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(LlmAssessmentService.class);

    private static final String SYSTEM_PROMPT = """
            You are an expert code reviewer. You receive source code together with the findings
            of a static analyzer. Write a short overall quality summary, then provide an improved
            version of the code that addresses the findings. Keep the original behaviour.
            """;

    private static final int MAX_LISTED_ISSUES = 50;

    private final ChatClient chatClient;
    private final String model;

    public LlmAssessmentService(ChatClient.Builder builder, String model) {
        this.chatClient = builder.build();
        this.model = model;
        log.info("LlmAssessmentService initialized (model: {})", model == null || model.isBlank() ? "default" : model);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Assessment summarize(String code, String language, List<Issue> issues, String context) {
        log.debug("Assessment call started for {} ({} issues)", language, issues.size());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(Assessment.class);

        var prompt = chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(userPrompt(code, language, issues, context) + "\n\n" + converter.getFormat());
        if (model != null && !model.isBlank()) {
            prompt = prompt.options(OpenAiChatOptions.builder().model(model).build());
        }
        String response = prompt.call().content();
        log.debug("Assessment call complete ({}ms)", System.currentTimeMillis() - start);

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model returned empty content for assessment of " + language + " code");
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse assessment response: {}", e.getMessage());
            log.debug("Raw model response: {}", response);
            return parseWithJackson(response);
        }
    }

    static String userPrompt(String code, String language, List<Issue> issues, String context) {
        var sb = new StringBuilder();
        sb.append("Language: ").append(language).append('\n');
        if (context != null && !context.isBlank()) {
            sb.append("Context: ").append(context).append('\n');
        }
        sb.append("\nFindings:\n");
        if (issues.isEmpty()) {
            sb.append("(none)\n");
        }
        issues.stream().limit(MAX_LISTED_ISSUES).forEach(issue -> sb
                .append("- [").append(issue.severity().wireName()).append("] ")
                .append(issue.category().wireName())
                .append(issue.line() != null ? " line " + issue.line() : "")
                .append(": ").append(issue.message()).append('\n'));
        if (issues.size() > MAX_LISTED_ISSUES) {
            sb.append("... and ").append(issues.size() - MAX_LISTED_ISSUES).append(" more\n");
        }
        sb.append("\nCode:\n```").append(language).append('\n').append(code).append("\n```\n");
        return sb.toString();
    }

    static Assessment parseWithJackson(String json) {
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
            mapper.registerModule(new ParameterNamesModule());

            String cleaned = json.trim();
            if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7);
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            return mapper.readValue(cleaned.trim(), Assessment.class);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse assessment response: " + e.getMessage(), e);
        }
    }
}
