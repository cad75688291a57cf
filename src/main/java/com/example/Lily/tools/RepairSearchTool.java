package com.example.Lily.tools;

import com.example.Lily.model.RagQueryRequest;
import com.example.Lily.model.RagRetrievalResult;
import com.example.Lily.model.ToolCall;
import com.example.Lily.service.RagRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Similarity search over the repair guides and blog articles.
 */
@Component
@RequiredArgsConstructor
public class RepairSearchTool implements RetrievalTool {

    public static final String NAME = "searchRAG";
    public static final String TABLE_REPAIRS = "repairs";
    public static final String TABLE_BLOGS = "blogs";

    static final List<String> NO_DOCUMENTS = List.of("No relevant documents found.");

    private static final Set<String> TABLES = Set.of(TABLE_REPAIRS, TABLE_BLOGS);

    private final RagRetrievalService ragRetrievalService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return """
                Semantic search over repair guides or blog articles. The repairs table holds
                appliance, symptom, parts needed, repair guide URL and difficulty. The blogs table
                holds article titles and URLs with how-to content.
                """;
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("table", "\"repairs\" or \"blogs\"");
        params.put("query", "free text describing the symptom, repair or topic");
        return params;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String table = Optional.ofNullable(RetrievalTool.stringArg(arguments, "table"))
                .map(String::toLowerCase)
                .orElse(TABLE_REPAIRS);
        if (!TABLES.contains(table)) {
            throw new RetrievalException("Invalid table: " + table);
        }
        String query = RetrievalTool.stringArg(arguments, "query");
        if (query == null) {
            throw new RetrievalException("Missing query");
        }

        RagRetrievalResult result = ragRetrievalService.retrieve(new RagQueryRequest(query, table, null, null));
        List<String> contents = result.contents();
        return contents.isEmpty() ? NO_DOCUMENTS : contents;
    }

    @Override
    public Optional<ToolCall> defaultCall(String query) {
        return Optional.of(new ToolCall(NAME, Map.of("table", TABLE_REPAIRS, "query", query)));
    }
}
