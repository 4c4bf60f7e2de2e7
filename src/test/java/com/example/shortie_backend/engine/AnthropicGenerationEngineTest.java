package com.example.shortie_backend.engine;

import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine.Message;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.example.shortie_backend.engine.OpenAiChatGenerationEngineTest.bodyOf;
import static com.example.shortie_backend.engine.OpenAiChatGenerationEngineTest.client;
import static com.example.shortie_backend.engine.OpenAiChatGenerationEngineTest.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnthropicGenerationEngineTest {

    @Test
    void foldsSystemMessagesAndJoinsTextBlocks() throws Exception {
        AtomicReference<String> sentBody = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            assertThat(request.url().getPath()).isEqualTo("/v1/messages");
            sentBody.set(bodyOf(request));
            return Mono.just(json(HttpStatus.OK,
                    "{\"content\":[{\"type\":\"text\",\"text\":\"{\\\"shorts\\\":\"},{\"type\":\"text\",\"text\":\"[]}\"}]}"));
        };
        GenerationEngine engine = new AnthropicGenerationEngine(client(exchange), "claude-3-haiku-20240307", 0.7, 4096, Duration.ofSeconds(5));

        String reply = engine.complete(List.of(Message.system("rules"), Message.user("transcript")));

        assertThat(reply).isEqualTo("{\"shorts\":[]}");
        assertThat(engine.provider()).isEqualTo("anthropic");
        JsonNode body = new ObjectMapper().readTree(sentBody.get());
        assertThat(body.get("system").asText()).isEqualTo("rules");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.get("messages")).hasSize(1);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("user");
    }

    @Test
    void errorStatusAndEmptyContentFail() {
        GenerationEngine failing = new AnthropicGenerationEngine(
                client(request -> Mono.just(json(HttpStatus.UNAUTHORIZED, "{\"error\":\"bad key\"}"))), "m", 0.7, 10, Duration.ofSeconds(5));
        GenerationEngine empty = new AnthropicGenerationEngine(
                client(request -> Mono.just(json(HttpStatus.OK, "{\"content\":[]}"))), "m", 0.7, 10, Duration.ofSeconds(5));

        assertThatThrownBy(() -> failing.complete(List.of(Message.user("x"))))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("status=401");
        assertThatThrownBy(() -> empty.complete(List.of(Message.user("x"))))
                .hasMessageContaining("LLM_MISSING_CONTENT");
    }
}
