package com.example.shortie_backend.selector;

import com.example.shortie_backend.dto.ClipCandidate;

/**
 * Candidate paired with the pass that admitted it.
 *
 * @param clip selected candidate.
 * @param pass admitting pass.
 */
public record SelectedClip(ClipCandidate clip, SelectionPass pass) {
}
