package com.example.shortie_backend.parser;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * One step of the extraction cascade. Implementations are pure and never throw for malformed input.
 */
@FunctionalInterface
public interface ExtractionStrategy {
    /**
     * @param text preprocessed generation output.
     * @return payload with a {@code shorts} field, or empty when this strategy does not apply.
     */
    Optional<ObjectNode> extract(String text);
}
