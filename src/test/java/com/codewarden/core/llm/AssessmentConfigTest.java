package com.codewarden.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AssessmentConfigTest {

    private final AssessmentConfig config = new AssessmentConfig();

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ChatClient.Builder> provider(ChatClient.Builder builder) {
        ObjectProvider<ChatClient.Builder> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(builder);
        return provider;
    }

    private static ChatClient.Builder builder() {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(mock(ChatClient.class));
        return builder;
    }

    @Test
    @DisplayName("uses the model when a key is configured")
    void withKey() {
        var properties = new LlmProperties();
        properties.setOpenaiApiKey("sk-test");

        var service = config.assessmentService(properties, provider(builder()));

        assertInstanceOf(LlmAssessmentService.class, service);
        assertTrue(service.isAvailable());
    }

    @Test
    @DisplayName("falls back to the no-op service without a key")
    void withoutKey() {
        var service = config.assessmentService(new LlmProperties(), provider(builder()));
        assertInstanceOf(NoopAssessmentService.class, service);
        assertFalse(service.isAvailable());
        assertThrows(IllegalStateException.class, () -> service.summarize("x", "javascript", java.util.List.of(), null));
    }

    @Test
    @DisplayName("falls back when disabled or when no chat client is available")
    void disabledOrNoClient() {
        var disabled = new LlmProperties();
        disabled.setOpenaiApiKey("sk-test");
        disabled.setEnabled(false);
        assertInstanceOf(NoopAssessmentService.class, config.assessmentService(disabled, provider(builder())));

        var keyed = new LlmProperties();
        keyed.setOpenaiApiKey("sk-test");
        assertInstanceOf(NoopAssessmentService.class, config.assessmentService(keyed, provider(null)));
    }
}
