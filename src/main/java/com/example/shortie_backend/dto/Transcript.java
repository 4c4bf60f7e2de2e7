package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only transcript handed to the shorts pipeline. Segments are kept ordered by start time.
 *
 * @param text                full transcript text.
 * @param segments            timestamped segments.
 * @param language            detected language code, for example {@code en}.
 * @param languageProbability confidence of the language detection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transcript(String text,
                         List<TranscriptSegment> segments,
                         String language,
                         @JsonProperty("language_probability") Double languageProbability) {

    public Transcript {
        List<TranscriptSegment> sorted = new ArrayList<>(segments == null ? List.of() : segments);
        sorted.sort(Comparator.comparingDouble(TranscriptSegment::start));
        segments = List.copyOf(sorted);
        text = text == null ? "" : text;
    }

    public static Transcript of(List<TranscriptSegment> segments, String language) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment segment : segments) {
            if (!segment.text().isBlank()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(segment.text().trim());
            }
        }
        return new Transcript(sb.toString(), segments, language, null);
    }

    @JsonIgnore
    public boolean hasSegments() {
        return !segments.isEmpty();
    }

    /**
     * @return earliest segment start, or {@code 0} without segments.
     */
    @JsonIgnore
    public double spanStart() {
        return segments.stream().mapToDouble(TranscriptSegment::start).min().orElse(0.0);
    }

    /**
     * @return latest segment end, or {@code 0} without segments.
     */
    @JsonIgnore
    public double spanEnd() {
        return segments.stream().mapToDouble(TranscriptSegment::end).max().orElse(0.0);
    }

    /**
     * Returns a transcript restricted to the segments starting inside {@code [from, to)}.
     */
    public Transcript slice(double from, double to) {
        List<TranscriptSegment> part = segments.stream()
                .filter(seg -> seg.start() >= from && seg.start() < to)
                .toList();
        Transcript sliced = Transcript.of(part, language);
        return new Transcript(sliced.text(), part, language, languageProbability);
    }
}
