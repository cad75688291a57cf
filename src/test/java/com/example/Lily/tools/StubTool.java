package com.example.Lily.tools;

import java.util.Map;
import java.util.function.Function;

class StubTool implements RetrievalTool {

    private final String name;
    private final Function<Map<String, Object>, Object> behaviour;

    StubTool(String name, Function<Map<String, Object>, Object> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return "stub " + name;
    }

    @Override
    public Map<String, String> parameters() {
        return Map.of("query", "text");
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        return behaviour.apply(arguments);
    }
}
