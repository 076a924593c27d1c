package com.codewarden.core.llm;

import com.codewarden.core.model.Issue;
import com.codewarden.core.model.IssueCategory;
import com.codewarden.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Mocks the {@link ChatClient} chain so no real model calls are made.
 */
class LlmAssessmentServiceTest {

    private static final List<Issue> ISSUES = List.of(
            Issue.at(3, IssueCategory.SECURITY, Severity.CRITICAL, "Use of eval() is dangerous", null));

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmAssessmentService service;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        service = new LlmAssessmentService(mockBuilder, "");
    }

    @Test
    @DisplayName("maps the model's JSON onto an assessment")
    void parsesResponse() {
        when(mockCallResponse.content()).thenReturn("""
                {"summary":"Risky use of eval","optimizedCode":"const y = Number(x);","additionalSuggestions":["Add tests"]}
                """);

        Assessment assessment = service.summarize("var y = eval(x)", "javascript", ISSUES, null);

        assertEquals("Risky use of eval", assessment.summary());
        assertEquals("const y = Number(x);", assessment.optimizedCode());
        assertEquals(List.of("Add tests"), assessment.additionalSuggestions());
    }

    @Test
    @DisplayName("sends the findings and format instructions in the user prompt")
    void promptContents() {
        when(mockCallResponse.content()).thenReturn("{\"summary\":\"ok\"}");

        service.summarize("var y = eval(x)", "javascript", ISSUES, "payment service");

        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        String prompt = userCaptor.getValue();
        assertTrue(prompt.startsWith("Language: javascript\nContext: payment service\n"));
        assertTrue(prompt.contains("- [critical] security line 3: Use of eval() is dangerous"));
        assertTrue(prompt.contains("var y = eval(x)"));
        assertTrue(prompt.contains("optimizedCode"), "format instructions should describe the schema");
        verify(mockRequestSpec, never()).options(any());
    }

    @Test
    @DisplayName("empty content is an error")
    void emptyResponse() {
        when(mockCallResponse.content()).thenReturn("  ");
        assertThrows(LlmEmptyResponseException.class,
                () -> service.summarize("x", "javascript", ISSUES, null));
    }

    @Test
    @DisplayName("unparseable content is an error")
    void garbageResponse() {
        when(mockCallResponse.content()).thenReturn("I think the code is fine.");
        assertThrows(LlmParseException.class,
                () -> service.summarize("x", "javascript", ISSUES, null));
    }

    @Test
    @DisplayName("lenient parsing strips markdown fences")
    void fencedJson() {
        Assessment assessment = LlmAssessmentService.parseWithJackson(
                "```json\n{\"summary\":\"Fine\",\"extra\":1}\n```");
        assertEquals("Fine", assessment.summary());
    }

    @Test
    @DisplayName("long finding lists are truncated in the prompt")
    void truncatesFindings() {
        var many = Collections.nCopies(60,
                Issue.at(1, IssueCategory.STYLE, Severity.LOW, "Missing semicolon", null));
        String prompt = LlmAssessmentService.userPrompt("x", "javascript", many, null);

        assertTrue(prompt.contains("... and 10 more"));
        assertFalse(prompt.contains("Context:"));
        assertTrue(LlmAssessmentService.userPrompt("x", "python", List.of(), null).contains("(none)"));
    }
}
