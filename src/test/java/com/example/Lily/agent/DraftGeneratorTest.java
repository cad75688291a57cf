package com.example.Lily.agent;

import com.example.Lily.config.ChatClientResolver;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DraftGeneratorTest {

    private static final QueryAnalysis IN_SCOPE = new QueryAnalysis(true, true, "", List.of(), false);

    private ChatClient chatClient;
    private ChatClientResolver resolver;
    private DraftGenerator generator;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        resolver = mock(ChatClientResolver.class);
        when(resolver.resolve(anyString())).thenReturn(chatClient);
        generator = new DraftGenerator(resolver, new LilyProperties(), new ObjectMapper());
    }

    @Test
    void shouldStreamTokensFromRequestedModel() {
        when(chatClient.prompt().system(anyString()).user(anyString()).stream().content())
                .thenReturn(Flux.just("The ", "bin ", "costs $44.95."));

        StepVerifier.create(generator.generate(List.of(), "price?", IN_SCOPE, List.of(), "openai"))
                .expectNext("The ", "bin ", "costs $44.95.")
                .verifyComplete();

        verify(resolver).resolve("openai");
    }

    @Test
    void shouldUseConfiguredDrafterModelByDefault() {
        when(chatClient.prompt().system(anyString()).user(anyString()).stream().content())
                .thenReturn(Flux.just("ok"));

        StepVerifier.create(generator.generate(List.of(), "hi", IN_SCOPE, List.of(), null))
                .expectNext("ok")
                .verifyComplete();

        verify(resolver).resolve("deepseek");
    }

    @Test
    void shouldMapStreamErrorsToGenerationException() {
        when(chatClient.prompt().system(anyString()).user(anyString()).stream().content())
                .thenReturn(Flux.just("partial").concatWith(Flux.error(new IllegalStateException("stream closed"))));

        StepVerifier.create(generator.generate(List.of(), "hi", IN_SCOPE, List.of(), null))
                .expectNext("partial")
                .expectError(GenerationException.class)
                .verify();
    }

    @Test
    void shouldIncludeEvidenceAndReviewerNotesInPrompt() {
        List<ToolResult> evidence = List.of(
                ToolResult.external("queryParts", List.of(Map.of("part_id", "PS11752778"))),
                ToolResult.failure("searchRAG", "timed out after 10000 ms"),
                ToolResult.judgeFeedback("answer ignores install difficulty")
        );

        String prompt = generator.buildPrompt(List.of(), "How do I install it?", IN_SCOPE, evidence);

        assertTrue(prompt.contains("【source=queryParts, kind=external, status=ok】\n[{\"part_id\":\"PS11752778\"}]"));
        assertTrue(prompt.contains("【source=searchRAG, kind=external, status=failed】\nError calling searchRAG: timed out after 10000 ms"));
        assertTrue(prompt.contains("【source=judge, kind=synthetic, status=ok】\nanswer ignores install difficulty"));
        assertTrue(prompt.contains("are reviewer notes on your previous draft"));
        assertTrue(prompt.contains("(no prior conversation)"));
        assertTrue(prompt.endsWith("User Question: How do I install it?\nAnswer clearly and concisely."));
    }

    @Test
    void shouldNoteOutOfScopeQuestionsWithoutReviewerNotes() {
        QueryAnalysis outOfScope = new QueryAnalysis(false, false, "weather", List.of(), false);

        String prompt = generator.buildPrompt(List.of(), "Will it rain?", outOfScope, List.of());

        assertTrue(prompt.contains("looks outside refrigerator and dishwasher parts"));
        assertTrue(prompt.contains("Retrieved Context:\n(no results)"));
        assertFalse(prompt.contains("reviewer notes"));
    }
}
