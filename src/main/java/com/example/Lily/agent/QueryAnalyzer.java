package com.example.Lily.agent;

import com.example.Lily.config.ChatClientResolver;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.Message;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ToolCall;
import com.example.Lily.tools.ToolRegistry;
import com.example.Lily.util.JsonReplyParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Classifies a new query: in scope or not, and which retrieval calls (if any) it needs.
 * Never touches history; one analyzer-role model call per query.
 */
@Service
@RequiredArgsConstructor
public class QueryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzer.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    static final String SYSTEM_PROMPT = """
            You are the query analyzer of a PartSelect assistant that only covers refrigerator and
            dishwasher parts: finding parts, compatibility, installation, troubleshooting and repairs,
            and orders of such parts.
            Decide whether the latest user query is in scope and whether answering it needs a lookup
            in the tools below. Greetings and follow-ups fully answered by the conversation need none.
            Respond with a single JSON object and nothing else:
            {"in_scope": true|false, "needs_retrieval": true|false, "rationale": "<one sentence>",
             "tool_calls": [{"tool": "<tool name>", "arguments": {"<name>": "<value>"}}]}
            """;

    private final ChatClientResolver chatClientResolver;
    private final ToolRegistry toolRegistry;
    private final LilyProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @throws AnalysisException (as error signal) when the call fails, times out or the reply is unusable
     */
    public Mono<QueryAnalysis> analyze(List<Message> history, String query) {
        String prompt = buildPrompt(history, query);
        return Mono.fromCallable(() -> chatClientResolver.resolve(properties.getAgent().getAnalyzerModel())
                        .prompt()
                        .system(SYSTEM_PROMPT)
                        .user(prompt)
                        .call()
                        .content())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getAgent().getModelTimeout())
                .onErrorMap(e -> new AnalysisException("Analyzer call failed: " + PromptSupport.describe(e), e))
                .switchIfEmpty(Mono.error(() -> new AnalysisException("Analyzer returned no content")))
                .map(this::parse)
                .doOnNext(analysis -> log.debug("Query analysis: inScope={}, needsRetrieval={}, hints={}",
                        analysis.inScope(), analysis.needsRetrieval(), analysis.retrievalHints().size()));
    }

    String buildPrompt(List<Message> history, String query) {
        StringBuilder sb = new StringBuilder();
        sb.append("Available tools:\n").append(toolRegistry.describeTools()).append("\n\n");
        sb.append("Conversation History:\n")
                .append(PromptSupport.renderHistory(history, properties.getHistory().getPromptWindow()))
                .append("\n\n");
        sb.append("User Query: ").append(query).append("\n");
        return sb.toString();
    }

    QueryAnalysis parse(String reply) {
        String json = JsonReplyParser.extractObject(reply)
                .orElseThrow(() -> new AnalysisException("Analyzer reply holds no JSON object"));
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Analyzer reply is not valid JSON: " + e.getOriginalMessage(), e);
        }

        boolean inScope = JsonReplyParser.readBoolean(node, "in_scope")
                .orElseThrow(() -> new AnalysisException("Analyzer reply misses in_scope"));
        boolean needsRetrieval = JsonReplyParser.readBoolean(node, "needs_retrieval")
                .orElseThrow(() -> new AnalysisException("Analyzer reply misses needs_retrieval"));
        String rationale = JsonReplyParser.readText(node, "rationale");

        return new QueryAnalysis(inScope, needsRetrieval, rationale, parseHints(node.get("tool_calls")), false);
    }

    private List<ToolCall> parseHints(JsonNode calls) {
        if (calls == null || !calls.isArray()) {
            return List.of();
        }
        List<ToolCall> hints = new ArrayList<>();
        for (JsonNode call : calls) {
            String tool = JsonReplyParser.readText(call, "tool");
            if (tool == null || tool.isBlank()) {
                continue;
            }
            JsonNode arguments = call.get("arguments");
            Map<String, Object> args = arguments != null && arguments.isObject()
                    ? objectMapper.convertValue(arguments, ARGUMENTS_TYPE)
                    : Map.of();
            hints.add(new ToolCall(tool, args));
        }
        return hints;
    }
}
