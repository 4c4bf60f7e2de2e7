package com.example.shortie_backend.selector;

/**
 * Configuration for the {@link GoodClipSelector}.
 *
 * @param targetShorts  desired number of clips; also the number of timeline buckets.
 * @param minGapSeconds minimum distance between clip midpoints in the spread pass.
 */
public record SelectorConfig(int targetShorts, double minGapSeconds) {

    public static SelectorConfig defaults() {
        return new SelectorConfig(5, 90.0);
    }
}
