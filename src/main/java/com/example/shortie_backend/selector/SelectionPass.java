package com.example.shortie_backend.selector;

/**
 * Selector stage that admitted a clip.
 */
public enum SelectionPass {
    /** Best candidate of its timeline bucket. */
    BUCKET,
    /** Added by score while keeping the minimum midpoint gap. */
    SPREAD,
    /** Added only to reach the target; rejects near-duplicates alone. */
    RELAXED
}
