package com.example.shortie_backend.selector;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;

import java.util.List;
import java.util.Map;

/**
 * Picks a target-sized, well spread subset of validated candidates.
 */
public interface GoodClipSelector {
    /**
     * Selects at most {@code cfg.targetShorts()} candidates.
     *
     * @param candidates validated candidates for one transcript.
     * @param transcript transcript the candidates refer to; its span drives the bucketing.
     * @param cfg        selector configuration to apply.
     * @return selected candidates ordered by start time.
     */
    List<ClipCandidate> select(List<ClipCandidate> candidates, Transcript transcript, SelectorConfig cfg);

    /**
     * Returns which pass admitted each clip during the last invocation of {@link #select}.
     *
     * @return map keyed by "start-end" strings.
     */
    Map<String, String> explainLast();
}
