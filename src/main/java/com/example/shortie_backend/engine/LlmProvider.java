package com.example.shortie_backend.engine;

import com.example.shortie_backend.config.LlmProperties;

import java.util.Locale;

/**
 * Supported generation back ends.
 */
public enum LlmProvider {
    OPENAI,
    ANTHROPIC,
    GROK,
    OLLAMA,
    DUMMY;

    /**
     * Resolves the configured provider. {@code auto} picks the first provider with an API key in the order
     * OpenAI, Anthropic, Grok and falls back to a local Ollama.
     */
    public static LlmProvider resolve(LlmProperties props) {
        String configured = props.getProvider() == null ? "auto" : props.getProvider().trim().toLowerCase(Locale.ROOT);
        if (!configured.isEmpty() && !"auto".equals(configured)) {
            try {
                return LlmProvider.valueOf(configured.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("LLM_PROVIDER_UNKNOWN " + props.getProvider(), e);
            }
        }
        if (props.getOpenai().hasApiKey()) return OPENAI;
        if (props.getAnthropic().hasApiKey()) return ANTHROPIC;
        if (props.getGrok().hasApiKey()) return GROK;
        return OLLAMA;
    }
}
