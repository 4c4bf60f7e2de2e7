package com.example.shortie_backend.engine;

import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Generation engine for OpenAI compatible {@code /v1/chat/completions} endpoints (OpenAI, Grok, Ollama).
 */
public class OpenAiChatGenerationEngine implements GenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiChatGenerationEngine.class);

    private final WebClient client;
    private final String providerLabel;
    private final String model;
    private final double temperature;
    private final Duration timeout;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAiChatGenerationEngine(WebClient client, String providerLabel, String model, double temperature, Duration timeout) {
        this.client = client;
        this.providerLabel = providerLabel;
        this.model = model;
        this.temperature = temperature;
        this.timeout = timeout;
    }

    @Override
    public String complete(List<Message> messages) {
        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);
        ArrayNode arr = body.putArray("messages");
        for (Message message : messages) {
            arr.addObject().put("role", message.role()).put("content", message.content());
        }

        long started = System.nanoTime();
        ResponseWithStatus resp;
        try {
            resp = client.post()
                    .uri("/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body.toString())
                    .exchangeToMono(this::deserializeResponse)
                    .block(timeout);
        } catch (RuntimeException ex) {
            throw new GenerationException("LLM_UNREACHABLE provider=" + providerLabel + " cause=" + ex.getMessage(), ex);
        }
        if (resp == null) {
            throw new GenerationException("LLM_EMPTY_RESPONSE provider=" + providerLabel);
        }
        if (!resp.status().is2xxSuccessful()) {
            LOGGER.error("LLM chat failed provider={} status={} body={}", providerLabel, resp.status().value(), truncate(resp.body(), 2_000));
            throw new GenerationException("LLM_HTTP_ERROR provider=" + providerLabel + " status=" + resp.status().value()
                    + " body=" + truncate(resp.body(), 500));
        }

        JsonNode root = parseJson(resp.body());
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new GenerationException("LLM_MISSING_CONTENT provider=" + providerLabel + " body=" + truncate(resp.body(), 500));
        }
        String text = content.asText();
        LOGGER.debug("LLM chat done provider={} model={} messages={} replyChars={} durMs={}", providerLabel, model,
                messages.size(), text.length(), Duration.ofNanos(System.nanoTime() - started).toMillis());
        return text;
    }

    @Override
    public String provider() {
        return providerLabel;
    }

    private Mono<ResponseWithStatus> deserializeResponse(ClientResponse clientResponse) {
        return clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ResponseWithStatus(clientResponse.statusCode(), body));
    }

    private record ResponseWithStatus(HttpStatusCode status, String body) {}

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            int length = body == null ? 0 : body.length();
            LOGGER.warn("LLM chat parse failure provider={} length={} snippet={}", providerLabel, length, truncate(body, 500));
            throw new GenerationException("LLM_TRUNCATED_RESPONSE provider=" + providerLabel + " length=" + length, e);
        }
    }

    static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }
}
