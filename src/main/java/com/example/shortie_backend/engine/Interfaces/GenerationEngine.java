package com.example.shortie_backend.engine.Interfaces;

import java.util.List;

/**
 * Opaque request/response contract of the text generation capability.
 */
public interface GenerationEngine {
    record Message(String role, String content) {
        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    /**
     * Sends the prompt messages and returns the raw reply text.
     *
     * @param messages ordered prompt messages.
     * @return reply text, never {@code null}.
     * @throws com.example.shortie_backend.engine.GenerationException when the provider is unreachable or answers with an error.
     */
    String complete(List<Message> messages);

    /**
     * @return provider label used in logs.
     */
    String provider();
}
