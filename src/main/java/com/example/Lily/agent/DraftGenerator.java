package com.example.Lily.agent;

import com.example.Lily.config.ChatClientResolver;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.Message;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

/**
 * Drafts a candidate answer as a token stream.
 * <p>
 * Judge feedback from rejected rounds arrives as synthetic entries in {@code toolResults}
 * and is rendered in the same context section as retrieved evidence.
 */
@Service
@RequiredArgsConstructor
public class DraftGenerator {

    static final String SYSTEM_PROMPT = """
            You are Lily, a helpful PartSelect assistant for refrigerator and dishwasher parts.
            Answer succinctly in the user's language, using only the retrieved context and chat history.
            Mention part numbers, prices, install difficulty and links when the context has them.
            Never invent part numbers, prices or URLs. If the context does not cover the question,
            say so and suggest what the user could share (model number, part number, symptom).
            """;

    private final ChatClientResolver chatClientResolver;
    private final LilyProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @param model optional model override; null uses {@code lily.agent.drafter-model}
     * @return answer tokens; errors are {@link GenerationException}
     */
    public Flux<String> generate(List<Message> history,
                                 String query,
                                 QueryAnalysis analysis,
                                 List<ToolResult> toolResults,
                                 String model) {
        String prompt = buildPrompt(history, query, analysis, toolResults);
        String resolvedModel = Optional.ofNullable(model).orElse(properties.getAgent().getDrafterModel());
        return Flux.defer(() -> chatClientResolver.resolve(resolvedModel)
                        .prompt()
                        .system(SYSTEM_PROMPT)
                        .user(prompt)
                        .stream()
                        .content())
                // Applies to the first token and to every gap between tokens
                .timeout(properties.getAgent().getModelTimeout())
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException("Drafter call failed: " + PromptSupport.describe(e), e));
    }

    /**
     * Build the combined prompt:
     *  - textual conversation history
     *  - analyzer verdict
     *  - retrieved context, reviewer notes included
     *  - user question
     */
    public String buildPrompt(List<Message> history, String query, QueryAnalysis analysis, List<ToolResult> toolResults) {
        boolean hasReviewerNotes = toolResults != null && toolResults.stream().anyMatch(ToolResult::isSynthetic);

        StringBuilder sb = new StringBuilder();
        sb.append("Conversation History:\n")
                .append(PromptSupport.renderHistory(history, properties.getHistory().getPromptWindow()))
                .append("\n\n");
        if (analysis != null && !analysis.inScope()) {
            sb.append("Note: this question looks outside refrigerator and dishwasher parts. ")
                    .append("Politely say what you can help with instead of answering it.\n\n");
        }
        sb.append("Retrieved Context:\n")
                .append(PromptSupport.renderEvidence(toolResults, r -> true, objectMapper))
                .append("\n\n");
        if (hasReviewerNotes) {
            sb.append("Entries with source=").append(ToolResult.JUDGE_SOURCE)
                    .append(" are reviewer notes on your previous draft. Fix every point they raise.\n\n");
        }
        sb.append("User Question: ").append(query).append("\n");
        sb.append("Answer clearly and concisely.");
        return sb.toString();
    }
}
