package com.example.Lily.agent;

import com.example.Lily.config.ChatClientResolver;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.CommitReason;
import com.example.Lily.model.Message;
import com.example.Lily.model.ToolCall;
import com.example.Lily.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryAnalyzerTest {

    private ChatClient chatClient;
    private ChatClientResolver resolver;
    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        resolver = mock(ChatClientResolver.class);
        when(resolver.resolve(anyString())).thenReturn(chatClient);
        analyzer = new QueryAnalyzer(resolver, new ToolRegistry(List.of()), new LilyProperties(), new ObjectMapper());
    }

    @Test
    void shouldParseFencedReplyWithToolCalls() {
        stubReply("""
                Sure, here it is:
                ```json
                {"in_scope": true, "needs_retrieval": "true", "rationale": "asks for a part",
                 "tool_calls": [
                   {"tool": "queryParts", "arguments": {"part_id": "PS11752778", "brand": null}},
                   {"arguments": {"query": "ignored, no tool name"}},
                   {"tool": "searchRAG", "arguments": {"table": "repairs", "query": "ice maker"}}
                 ]}
                ```
                """);

        StepVerifier.create(analyzer.analyze(List.of(), "Is PS11752778 compatible with my WDT780SAEM1?"))
                .assertNext(analysis -> {
                    assertTrue(analysis.inScope());
                    assertTrue(analysis.needsRetrieval());
                    assertFalse(analysis.fallback());
                    assertEquals("asks for a part", analysis.rationale());
                    assertEquals(List.of(
                            new ToolCall("queryParts", Map.of("part_id", "PS11752778")),
                            new ToolCall("searchRAG", Map.of("table", "repairs", "query", "ice maker"))
                    ), analysis.retrievalHints());
                })
                .verifyComplete();

        verify(resolver).resolve("deepseek");
    }

    @Test
    void shouldClassifyOutOfScopeQuery() {
        stubReply("{\"in_scope\": false, \"needs_retrieval\": false, \"rationale\": \"weather\"}");

        StepVerifier.create(analyzer.analyze(List.of(), "What's the weather tomorrow?"))
                .assertNext(analysis -> {
                    assertFalse(analysis.inScope());
                    assertFalse(analysis.needsRetrieval());
                    assertTrue(analysis.retrievalHints().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void shouldFailWhenRequiredFieldIsMissing() {
        stubReply("{\"needs_retrieval\": true}");

        StepVerifier.create(analyzer.analyze(List.of(), "hello"))
                .expectError(AnalysisException.class)
                .verify();
    }

    @Test
    void shouldFailWhenReplyIsNotJson() {
        stubReply("I think this is about a fridge.");

        StepVerifier.create(analyzer.analyze(List.of(), "hello"))
                .expectError(AnalysisException.class)
                .verify();
    }

    @Test
    void shouldWrapModelErrors() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("401 Unauthorized"));

        StepVerifier.create(analyzer.analyze(List.of(), "hello"))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof AnalysisException);
                    assertTrue(e.getMessage().contains("401 Unauthorized"));
                })
                .verify();
    }

    @Test
    void shouldFailOnEmptyReply() {
        stubReply(null);

        StepVerifier.create(analyzer.analyze(List.of(), "hello"))
                .expectError(AnalysisException.class)
                .verify();
    }

    @Test
    void shouldRenderHistoryAndQueryIntoPrompt() {
        List<Message> history = List.of(
                Message.user("My Whirlpool dishwasher won't drain"),
                Message.agent("Check the drain pump.", CommitReason.ACCEPTED)
        );

        String prompt = analyzer.buildPrompt(history, "Which pump fits?");

        assertTrue(prompt.contains("user: My Whirlpool dishwasher won't drain"));
        assertTrue(prompt.contains("assistant: Check the drain pump."));
        assertTrue(prompt.endsWith("User Query: Which pump fits?\n"));
    }

    @Test
    void shouldRejectInvalidJsonWithAnalysisException() {
        assertThrows(AnalysisException.class, () -> analyzer.parse("{\"in_scope\": tru"));
    }

    private void stubReply(String reply) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(reply);
    }
}
