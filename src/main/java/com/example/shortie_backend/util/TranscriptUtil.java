package com.example.shortie_backend.util;

import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.dto.TranscriptSegment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TranscriptUtil {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    private TranscriptUtil(){}

    /**
     * Text under a window: every segment overlapping {@code [start, end]}, or the single segment whose
     * midpoint is nearest when none overlaps.
     */
    public static String excerpt(Transcript transcript, double start, double end) {
        List<TranscriptSegment> segments = transcript.segments();
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment seg : segments) {
            if (seg.end() > start && seg.start() < end && !seg.text().isBlank()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(seg.text().trim());
            }
        }
        if (sb.length() > 0) {
            return sb.toString();
        }
        double mid = (start + end) / 2.0;
        return segments.stream()
                .filter(seg -> !seg.text().isBlank())
                .min(Comparator.comparingDouble(seg -> Math.abs(seg.midpoint() - mid)))
                .map(seg -> seg.text().trim())
                .orElse("");
    }

    public static List<String> toSentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String part : SENTENCE_END.split(text.trim())) {
            String sentence = part.trim();
            if (!sentence.isEmpty()) {
                out.add(sentence);
            }
        }
        return out;
    }

    /**
     * Prompt rendering, one {@code [12.00s - 18.50s] SPEAKER: text} line per segment; the speaker is omitted when unknown.
     */
    public static String formatForPrompt(Transcript transcript) {
        if (!transcript.hasSegments()) {
            return transcript.text();
        }
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment seg : transcript.segments()) {
            sb.append(String.format(Locale.ROOT, "[%.2fs - %.2fs] ", seg.start(), seg.end()));
            if (seg.speaker() != null && !seg.speaker().isBlank()) {
                sb.append(seg.speaker()).append(": ");
            }
            sb.append(seg.text().trim()).append('\n');
        }
        return sb.toString();
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
