package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Word level timing emitted by the transcription engine.
 *
 * @param word        spoken token, including leading whitespace when the engine keeps it.
 * @param start       start offset in seconds.
 * @param end         end offset in seconds.
 * @param probability engine confidence, may be {@code null}.
 * @param speaker     diarization label, may be {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptWord(String word,
                             double start,
                             double end,
                             Double probability,
                             String speaker) {
}
