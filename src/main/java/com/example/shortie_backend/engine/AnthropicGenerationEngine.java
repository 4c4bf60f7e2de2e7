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
 * Generation engine for the Anthropic messages API. System messages are folded into the top level
 * {@code system} field.
 */
public class AnthropicGenerationEngine implements GenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicGenerationEngine.class);
    private static final String PROVIDER = "anthropic";

    private final WebClient client;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;
    private final ObjectMapper om = new ObjectMapper();

    public AnthropicGenerationEngine(WebClient client, String model, double temperature, int maxTokens, Duration timeout) {
        this.client = client;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
    }

    @Override
    public String complete(List<Message> messages) {
        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        StringBuilder system = new StringBuilder();
        ArrayNode arr = body.putArray("messages");
        for (Message message : messages) {
            if ("system".equals(message.role())) {
                if (system.length() > 0) system.append("\n\n");
                system.append(message.content());
            } else {
                arr.addObject().put("role", message.role()).put("content", message.content());
            }
        }
        if (system.length() > 0) {
            body.put("system", system.toString());
        }

        ResponseWithStatus resp;
        try {
            resp = client.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body.toString())
                    .exchangeToMono(this::deserializeResponse)
                    .block(timeout);
        } catch (RuntimeException ex) {
            throw new GenerationException("LLM_UNREACHABLE provider=" + PROVIDER + " cause=" + ex.getMessage(), ex);
        }
        if (resp == null) {
            throw new GenerationException("LLM_EMPTY_RESPONSE provider=" + PROVIDER);
        }
        if (!resp.status().is2xxSuccessful()) {
            LOGGER.error("LLM messages failed provider={} status={} body={}", PROVIDER, resp.status().value(),
                    OpenAiChatGenerationEngine.truncate(resp.body(), 2_000));
            throw new GenerationException("LLM_HTTP_ERROR provider=" + PROVIDER + " status=" + resp.status().value());
        }

        JsonNode root;
        try {
            root = om.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new GenerationException("LLM_TRUNCATED_RESPONSE provider=" + PROVIDER, e);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.length() == 0) {
            throw new GenerationException("LLM_MISSING_CONTENT provider=" + PROVIDER);
        }
        return text.toString();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    private Mono<ResponseWithStatus> deserializeResponse(ClientResponse clientResponse) {
        return clientResponse.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ResponseWithStatus(clientResponse.statusCode(), body));
    }

    private record ResponseWithStatus(HttpStatusCode status, String body) {}
}
