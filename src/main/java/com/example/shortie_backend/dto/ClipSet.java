package com.example.shortie_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

/**
 * Final clip list ordered by start time.
 *
 * @param shorts      clips ordered by start.
 * @param totalShorts number of clips, always {@code shorts.size()}.
 */
public record ClipSet(List<ClipCandidate> shorts,
                      @JsonProperty("total_shorts") int totalShorts) {

    public ClipSet {
        shorts = shorts == null ? List.of() : List.copyOf(shorts);
        if (totalShorts != shorts.size()) {
            throw new IllegalArgumentException("CLIPSET_COUNT_MISMATCH total=" + totalShorts + " size=" + shorts.size());
        }
    }

    public static ClipSet of(List<ClipCandidate> clips) {
        List<ClipCandidate> ordered = clips.stream()
                .sorted(Comparator.comparingDouble(ClipCandidate::startTime))
                .toList();
        return new ClipSet(ordered, ordered.size());
    }

    public static ClipSet empty() {
        return new ClipSet(List.of(), 0);
    }
}
