package com.example.shortie_backend.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Untyped candidate as recovered from generation output, tagged with the shape it arrived in.
 *
 * @param shape how the entry was laid out.
 * @param node  the entry itself; for {@link Shape#WRAPPED} the outer object.
 */
public record RawCandidate(Shape shape, JsonNode node) {

    static final List<String> WRAPPER_KEYS = List.of("short", "clip", "item", "candidate");

    public enum Shape {
        /** Plain object carrying the candidate fields. */
        OBJECT,
        /** Object holding the candidate under one of the wrapper keys. */
        WRAPPED,
        /** String item that has to be parsed leniently first. */
        TEXT,
        /** Anything else; always dropped. */
        UNSUPPORTED
    }

    public static RawCandidate classify(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new RawCandidate(Shape.UNSUPPORTED, node);
        }
        if (node.isTextual()) {
            return new RawCandidate(Shape.TEXT, node);
        }
        if (!node.isObject()) {
            return new RawCandidate(Shape.UNSUPPORTED, node);
        }
        if (!hasTimeField(node)) {
            for (String key : WRAPPER_KEYS) {
                if (node.path(key).isObject()) {
                    return new RawCandidate(Shape.WRAPPED, node);
                }
            }
        }
        return new RawCandidate(Shape.OBJECT, node);
    }

    private static boolean hasTimeField(JsonNode node) {
        return node.has("start_time") || node.has("start") || node.has("end_time") || node.has("end");
    }
}
