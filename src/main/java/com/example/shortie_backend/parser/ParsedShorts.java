package com.example.shortie_backend.parser;

import com.example.shortie_backend.dto.ClipCandidate;

import java.util.List;

/**
 * Coerced candidates plus the declared total, which always equals {@code shorts.size()}.
 */
public record ParsedShorts(List<ClipCandidate> shorts, int totalShorts) {

    public ParsedShorts {
        shorts = List.copyOf(shorts);
    }

    public static ParsedShorts of(List<ClipCandidate> shorts) {
        return new ParsedShorts(shorts, shorts.size());
    }

    public static ParsedShorts empty() {
        return new ParsedShorts(List.of(), 0);
    }

    public boolean isEmpty() {
        return shorts.isEmpty();
    }
}
