package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Optional brand context that steers clip selection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrandInfo(String name,
                        String description,
                        @JsonProperty("target_audience") String targetAudience,
                        String tone,
                        @JsonProperty("key_topics") List<String> keyTopics,
                        @JsonProperty("style_preferences") String stylePreferences) {
}
