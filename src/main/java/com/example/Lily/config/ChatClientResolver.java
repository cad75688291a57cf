package com.example.Lily.config;

import com.example.Lily.model.ChatRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolve a ChatClient bean by model identifier.
 * Supported lookup keys:
 *  - "<model>ChatClient"
 *  - "<model>"
 * Fallback:
 *  - default model "ChatClient"
 *  - any available ChatClient if nothing matches
 */
@Component
@RequiredArgsConstructor
public class ChatClientResolver {

    private final Map<String, ChatClient> chatClients;

    public ChatClient resolve(String model) {
        String key = Optional.ofNullable(model)
                .map(String::toLowerCase)
                .orElse(ChatRequest.DEFAULT_MODEL);
        if (!chatClients.isEmpty()) {
            if (chatClients.containsKey(key + "ChatClient")) {
                return chatClients.get(key + "ChatClient");
            }
            if (chatClients.containsKey(key)) {
                return chatClients.get(key);
            }
        }
        ChatClient fallback = chatClients.get(ChatRequest.DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }
}
