package com.example.shortie_backend.parser;

import com.example.shortie_backend.dto.ClipCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns an extracted payload into validated {@link ClipCandidate}s. Entries without two parseable
 * time fields, or whose end is not after their start, are dropped.
 */
@Component
public class SchemaCoercer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaCoercer.class);

    public static final String FALLBACK_TITLE = "Untitled Segment";
    public static final String FALLBACK_REASON = "Strong standalone moment";

    private final TimeParser timeParser;
    private final LenientJsonExtractor extractor;

    public SchemaCoercer(TimeParser timeParser, LenientJsonExtractor extractor) {
        this.timeParser = timeParser;
        this.extractor = extractor;
    }

    public ParsedShorts coerce(ObjectNode payload) {
        if (payload == null) {
            return ParsedShorts.empty();
        }
        List<RawCandidate> raw = rawCandidates(payload.get(LenientJsonExtractor.SHORTS_FIELD));
        List<ClipCandidate> out = new ArrayList<>();
        for (RawCandidate candidate : raw) {
            toCandidate(candidate).ifPresent(out::add);
        }
        if (out.size() != raw.size()) {
            LOGGER.debug("Coercer dropped={} kept={} declaredTotal={}",
                    raw.size() - out.size(), out.size(), payload.path(LenientJsonExtractor.TOTAL_FIELD).asText("-"));
        }
        return ParsedShorts.of(out);
    }

    static List<RawCandidate> rawCandidates(JsonNode list) {
        if (list == null) {
            return List.of();
        }
        if (list.isObject()) {
            return List.of(RawCandidate.classify(list));
        }
        if (!list.isArray()) {
            return List.of();
        }
        List<RawCandidate> out = new ArrayList<>(list.size());
        list.forEach(item -> out.add(RawCandidate.classify(item)));
        return out;
    }

    private Optional<ClipCandidate> toCandidate(RawCandidate candidate) {
        JsonNode node = switch (candidate.shape()) {
            case OBJECT -> candidate.node();
            case WRAPPED -> unwrap(candidate.node());
            case TEXT -> extractor.parseLenient(candidate.node().asText()).filter(JsonNode::isObject).orElse(null);
            case UNSUPPORTED -> null;
        };
        if (node == null) {
            LOGGER.trace("Coercer skip shape={}", candidate.shape());
            return Optional.empty();
        }
        OptionalDouble start = time(node, "start_time", "start");
        OptionalDouble end = time(node, "end_time", "end");
        if (start.isEmpty() || end.isEmpty()) {
            LOGGER.trace("Coercer skip missing time node={}", node);
            return Optional.empty();
        }
        if (end.getAsDouble() <= start.getAsDouble()) {
            LOGGER.trace("Coercer skip end<=start start={} end={}", start.getAsDouble(), end.getAsDouble());
            return Optional.empty();
        }
        return Optional.of(new ClipCandidate(
                text(node, "title", FALLBACK_TITLE),
                start.getAsDouble(),
                end.getAsDouble(),
                text(node, "reason", FALLBACK_REASON),
                score(node.get("score"))));
    }

    private static JsonNode unwrap(JsonNode node) {
        for (String key : RawCandidate.WRAPPER_KEYS) {
            JsonNode inner = node.get(key);
            if (inner != null && inner.isObject()) {
                return inner;
            }
        }
        return node;
    }

    private OptionalDouble time(JsonNode node, String primary, String alias) {
        JsonNode value = node.hasNonNull(primary) ? node.get(primary) : node.get(alias);
        return timeParser.parseNode(value);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return fallback;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? fallback : text;
    }

    static int score(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return (int) value.asDouble();
        }
        try {
            double parsed = Double.parseDouble(value.asText().trim());
            return Double.isFinite(parsed) ? (int) parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
