package com.example.shortie_backend.config;

import com.example.shortie_backend.engine.AnthropicGenerationEngine;
import com.example.shortie_backend.engine.DummyGenerationEngine;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.engine.LlmProvider;
import com.example.shortie_backend.engine.OpenAiChatGenerationEngine;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LlmClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Bean
    GenerationEngine generationEngine(LlmProperties props) {
        LlmProvider provider = LlmProvider.resolve(props);
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        LOGGER.info("Configuring generation engine provider={} timeout={}s", provider, timeout.toSeconds());
        return switch (provider) {
            case OPENAI -> new OpenAiChatGenerationEngine(
                    bearerClient(props.getOpenai(), timeout), "openai", props.getOpenai().getModel(), props.getTemperature(), timeout);
            case GROK -> new OpenAiChatGenerationEngine(
                    bearerClient(props.getGrok(), timeout), "grok", props.getGrok().getModel(), props.getTemperature(), timeout);
            case OLLAMA -> new OpenAiChatGenerationEngine(
                    baseBuilder(props.getOllama().getBaseUrl(), timeout).build(), "ollama", props.getOllama().getModel(),
                    props.getTemperature(), timeout);
            case ANTHROPIC -> new AnthropicGenerationEngine(anthropicClient(props.getAnthropic(), timeout),
                    props.getAnthropic().getModel(), props.getTemperature(), props.getMaxTokens(), timeout);
            case DUMMY -> new DummyGenerationEngine();
        };
    }

    private WebClient anthropicClient(LlmProperties.Provider provider, Duration timeout) {
        if (!provider.hasApiKey()) {
            throw new IllegalStateException("LLM_API_KEY_MISSING baseUrl=" + provider.getBaseUrl());
        }
        return baseBuilder(provider.getBaseUrl(), timeout)
                .defaultHeader("x-api-key", provider.getApiKey().trim())
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .build();
    }

    private WebClient bearerClient(LlmProperties.Provider provider, Duration timeout) {
        if (!provider.hasApiKey()) {
            throw new IllegalStateException("LLM_API_KEY_MISSING baseUrl=" + provider.getBaseUrl());
        }
        return baseBuilder(provider.getBaseUrl(), timeout)
                .defaultHeader("Authorization", "Bearer " + provider.getApiKey().trim())
                .build();
    }

    private WebClient.Builder baseBuilder(String baseUrl, Duration timeout) {
        ConnectionProvider pool = ConnectionProvider.builder("llm-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                );

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
    }
}
