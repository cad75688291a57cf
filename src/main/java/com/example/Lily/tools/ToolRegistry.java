package com.example.Lily.tools;

import com.example.Lily.model.ToolCall;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Central registry for all retrieval tools.
 */
@Component
public class ToolRegistry {

    private final Map<String, RetrievalTool> toolsByName;

    public ToolRegistry(List<RetrievalTool> tools) {
        // Index by name
        this.toolsByName = tools.stream()
                .collect(Collectors.toUnmodifiableMap(
                        RetrievalTool::name,
                        Function.identity()
                ));
    }

    /**
     * Look up a tool by its name.
     */
    public Optional<RetrievalTool> findByName(String name) {
        return Optional.ofNullable(name).map(toolsByName::get);
    }

    /**
     * One default call per tool that has one, sorted by tool name so the batch order is stable.
     */
    public List<ToolCall> defaultCalls(String query) {
        return toolsByName.values().stream()
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .map(tool -> tool.defaultCall(query))
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Tool catalog as shown to the analyzer, one block per tool.
     */
    public String describeTools() {
        return toolsByName.values().stream()
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .map(tool -> {
                    String params = tool.parameters().entrySet().stream()
                            .map(e -> "    - " + e.getKey() + ": " + e.getValue())
                            .collect(Collectors.joining("\n"));
                    return "- " + tool.name() + ": " + tool.description().strip() + "\n" + params;
                })
                .collect(Collectors.joining("\n"));
    }
}
