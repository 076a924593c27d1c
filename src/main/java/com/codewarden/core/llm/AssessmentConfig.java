package com.codewarden.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the model-backed assessment service when a key is configured,
 * otherwise the no-op one.
 */
@Configuration
public class AssessmentConfig {

    private static final Logger log = LoggerFactory.getLogger(AssessmentConfig.class);

    @Bean
    public AssessmentService assessmentService(LlmProperties properties,
                                               ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        if (!properties.isEnabled()) {
            log.info("Assessment disabled by configuration");
            return new NoopAssessmentService();
        }
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if (!properties.hasOpenaiKey() || builder == null) {
            log.warn("No model API key configured; reports will not include an assessment summary");
            return new NoopAssessmentService();
        }
        return new LlmAssessmentService(builder, properties.getModel());
    }
}
