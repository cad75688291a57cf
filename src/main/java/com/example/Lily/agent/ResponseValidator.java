package com.example.Lily.agent;

import com.example.Lily.config.ChatClientResolver;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ResponseValidation;
import com.example.Lily.model.ToolResult;
import com.example.Lily.util.JsonReplyParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * The judge. Reviews a complete candidate answer in its own model call, with its own prompt and
 * reply schema, against the externally retrieved evidence only.
 */
@Service
@RequiredArgsConstructor
public class ResponseValidator {

    private static final Logger log = LoggerFactory.getLogger(ResponseValidator.class);

    static final String SYSTEM_PROMPT = """
            You review answers written by a PartSelect assistant for refrigerator and dishwasher parts.
            Check three things independently:
            1. in_scope: the answer stays on refrigerator/dishwasher parts, repairs or orders,
               or politely declines an off-topic request.
            2. hallucination_detected: the answer states part numbers, prices, URLs or repair facts
               that contradict or are missing from the evidence.
            3. appropriate: the answer is helpful, polite and safe.
            If any check fails, give feedback: concrete instructions to fix the answer.
            Respond with a single JSON object and nothing else:
            {"in_scope": true|false, "hallucination_detected": true|false, "appropriate": true|false,
             "feedback": "<empty when all checks pass>"}
            """;

    private final ChatClientResolver chatClientResolver;
    private final LilyProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @throws ValidationException (as error signal) when the call fails, times out or the verdict is unreadable
     */
    public Mono<ResponseValidation> validate(String candidateAnswer, List<ToolResult> toolResults, QueryAnalysis analysis) {
        String prompt = buildPrompt(candidateAnswer, toolResults, analysis);
        return Mono.fromCallable(() -> chatClientResolver.resolve(properties.getAgent().getJudgeModel())
                        .prompt()
                        .system(SYSTEM_PROMPT)
                        .user(prompt)
                        .call()
                        .content())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getAgent().getModelTimeout())
                .onErrorMap(e -> new ValidationException("Judge call failed: " + PromptSupport.describe(e), e))
                .switchIfEmpty(Mono.error(() -> new ValidationException("Judge returned no content")))
                .map(this::parse)
                .doOnNext(v -> log.debug("Judge verdict: accepted={}, inScope={}, hallucination={}, appropriate={}",
                        v.accepted(), v.inScope(), v.hallucinationDetected(), v.appropriate()));
    }

    String buildPrompt(String candidateAnswer, List<ToolResult> toolResults, QueryAnalysis analysis) {
        StringBuilder sb = new StringBuilder();
        if (analysis != null) {
            sb.append("Query Classification: ")
                    .append(analysis.inScope() ? "in scope" : "out of scope")
                    .append(analysis.rationale().isBlank() ? "" : " (" + analysis.rationale() + ")")
                    .append("\n\n");
        }
        sb.append("Evidence:\n")
                .append(PromptSupport.renderEvidence(toolResults, r -> !r.isSynthetic(), objectMapper))
                .append("\n\n");
        sb.append("Answer To Review:\n").append(candidateAnswer).append("\n");
        return sb.toString();
    }

    ResponseValidation parse(String reply) {
        String json = JsonReplyParser.extractObject(reply)
                .orElseThrow(() -> new ValidationException("Judge reply holds no JSON object"));
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Judge reply is not valid JSON: " + e.getOriginalMessage(), e);
        }

        boolean inScope = JsonReplyParser.readBoolean(node, "in_scope")
                .orElseThrow(() -> new ValidationException("Judge reply misses in_scope"));
        boolean hallucination = JsonReplyParser.readBoolean(node, "hallucination_detected")
                .orElseThrow(() -> new ValidationException("Judge reply misses hallucination_detected"));
        boolean appropriate = JsonReplyParser.readBoolean(node, "appropriate")
                .orElseThrow(() -> new ValidationException("Judge reply misses appropriate"));

        return ResponseValidation.of(inScope, hallucination, appropriate, JsonReplyParser.readText(node, "feedback"));
    }
}
