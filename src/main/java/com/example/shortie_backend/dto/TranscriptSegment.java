package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Timestamped transcript segment produced by the transcription and diarization engines.
 *
 * @param start   start offset in seconds.
 * @param end     end offset in seconds.
 * @param text    spoken text.
 * @param speaker optional speaker label.
 * @param words   optional word timings ordered by start.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptSegment(double start,
                                double end,
                                String text,
                                String speaker,
                                List<TranscriptWord> words) {

    public TranscriptSegment {
        text = text == null ? "" : text;
        words = words == null ? null : List.copyOf(words);
    }

    public TranscriptSegment(double start, double end, String text) {
        this(start, end, text, null, null);
    }

    public double midpoint() {
        return (start + end) / 2.0;
    }
}
