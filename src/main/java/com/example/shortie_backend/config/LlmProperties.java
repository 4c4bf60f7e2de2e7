package com.example.shortie_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the text generation providers.
 */
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    private String provider = "auto";
    private double temperature = 0.7;
    private long timeoutSeconds = 120;
    private int maxTokens = 4096;

    private Provider openai = new Provider("https://api.openai.com", "gpt-4o-mini");
    private Provider anthropic = new Provider("https://api.anthropic.com", "claude-3-haiku-20240307");
    private Provider grok = new Provider("https://api.x.ai", "grok-beta");
    private Provider ollama = new Provider("http://localhost:11434", "deepseek-r1:1.5b");

    public LlmProperties() {
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public Provider getOpenai() {
        return openai;
    }

    public void setOpenai(Provider openai) {
        this.openai = openai;
    }

    public Provider getAnthropic() {
        return anthropic;
    }

    public void setAnthropic(Provider anthropic) {
        this.anthropic = anthropic;
    }

    public Provider getGrok() {
        return grok;
    }

    public void setGrok(Provider grok) {
        this.grok = grok;
    }

    public Provider getOllama() {
        return ollama;
    }

    public void setOllama(Provider ollama) {
        this.ollama = ollama;
    }

    public static class Provider {
        private String apiKey;
        private String baseUrl;
        private String model;

        public Provider() {
        }

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
