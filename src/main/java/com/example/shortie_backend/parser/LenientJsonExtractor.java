package com.example.shortie_backend.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a {@code {"shorts": [...], "total_shorts": n}} payload from free-form generation output.
 *
 * <p>The text is preprocessed (reasoning blocks and markdown fences removed) and then handed to an ordered
 * cascade of {@link ExtractionStrategy strategies}; the first one that yields a payload wins.
 */
@Component
public class LenientJsonExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(LenientJsonExtractor.class);

    public static final String SHORTS_FIELD = "shorts";
    public static final String TOTAL_FIELD = "total_shorts";
    private static final List<String> LIST_KEYS = List.of("shorts", "clips");

    private static final Pattern KEYED_OBJECT_START = Pattern.compile("\\{\\s*\"(?:shorts|clips)\"\\s*:");
    private static final Pattern LIST_VALUE = Pattern.compile("\"(?:shorts|clips)\"\\s*:\\s*\\[");
    private static final Pattern TOTAL_VALUE = Pattern.compile("\"total_shorts\"\\s*:\\s*\"?(\\d+)");
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*}");
    private static final Pattern SALVAGE_TITLE = field("title", "\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern SALVAGE_REASON = field("reason", "\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern SALVAGE_START = field("(?:start_time|start)", "\"?([^\",}\\n]+)\"?");
    private static final Pattern SALVAGE_END = field("(?:end_time|end)", "\"?([^\",}\\n]+)\"?");
    private static final Pattern SALVAGE_SCORE = field("score", "\"?(-?\\d+(?:\\.\\d+)?)");

    private final TimeParser timeParser;
    private final ObjectMapper mapper;
    private final List<NamedStrategy> cascade;

    public LenientJsonExtractor(TimeParser timeParser) {
        this.timeParser = timeParser;
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
        this.cascade = List.of(
                new NamedStrategy("keyedObject", this::keyedObject),
                new NamedStrategy("outermostBraces", this::outermostBraces),
                new NamedStrategy("listValue", this::listValue),
                new NamedStrategy("bareArray", this::bareArray),
                new NamedStrategy("salvage", this::salvage)
        );
    }

    /**
     * Runs the extraction cascade.
     *
     * @param raw generation output as received.
     * @return payload whose {@code shorts} field holds the raw candidates, or empty when every strategy failed.
     */
    public Optional<ObjectNode> extract(String raw) {
        String text = JsonRepair.preprocess(raw);
        if (text.isEmpty()) {
            LOGGER.debug("Extractor input empty after preprocessing rawLength={}", raw == null ? 0 : raw.length());
            return Optional.empty();
        }
        for (NamedStrategy step : cascade) {
            Optional<ObjectNode> result = step.strategy().extract(text);
            if (result.isPresent()) {
                ObjectNode payload = normalizeListKey(result.get());
                LOGGER.debug("Extractor strategy={} candidates={}", step.name(), payload.path(SHORTS_FIELD).size());
                return Optional.of(payload);
            }
        }
        LOGGER.debug("Extractor exhausted strategies length={}", text.length());
        return Optional.empty();
    }

    /**
     * Parses any JSON object out of the text, with the same preprocessing and repairs as {@link #extract}.
     */
    public Optional<ObjectNode> extractObject(String raw) {
        String text = JsonRepair.preprocess(raw);
        Optional<JsonNode> whole = parseLenient(text).filter(JsonNode::isObject);
        if (whole.isPresent()) {
            return whole.map(ObjectNode.class::cast);
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        return parseLenient(text.substring(open, close + 1)).filter(JsonNode::isObject).map(ObjectNode.class::cast);
    }

    /**
     * Repairs and parses a JSON fragment.
     *
     * @return parsed tree, or empty for text that is still not JSON after repair.
     */
    public Optional<JsonNode> parseLenient(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(JsonRepair.repair(fragment, timeParser));
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            LOGGER.trace("Extractor lenient parse failed length={} error={}", fragment.length(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<ObjectNode> keyedObject(String text) {
        Matcher m = KEYED_OBJECT_START.matcher(text);
        while (m.find()) {
            int close = JsonRepair.findMatching(text, m.start());
            String fragment = close < 0 ? text.substring(m.start()) : text.substring(m.start(), close + 1);
            Optional<ObjectNode> parsed = parseLenient(fragment)
                    .filter(JsonNode::isObject)
                    .map(ObjectNode.class::cast)
                    .filter(LenientJsonExtractor::hasListKey);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> outermostBraces(String text) {
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return Optional.empty();
        }
        Optional<JsonNode> parsed = parseLenient(text.substring(open, close + 1)).filter(JsonNode::isObject);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode object = (ObjectNode) parsed.get();
        if (hasListKey(object)) {
            return Optional.of(object);
        }
        if (looksLikeCandidate(object)) {
            ObjectNode wrapper = mapper.createObjectNode();
            wrapper.putArray(SHORTS_FIELD).add(object);
            return Optional.of(wrapper);
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> listValue(String text) {
        Matcher m = LIST_VALUE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        int open = m.end() - 1;
        int close = JsonRepair.findMatching(text, open);
        if (close < 0) {
            return Optional.empty();
        }
        Optional<JsonNode> array = parseLenient(text.substring(open, close + 1)).filter(JsonNode::isArray);
        if (array.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode payload = mapper.createObjectNode();
        payload.set(SHORTS_FIELD, array.get());
        Matcher total = TOTAL_VALUE.matcher(text);
        if (total.find()) {
            try {
                payload.put(TOTAL_FIELD, Integer.parseInt(total.group(1)));
            } catch (NumberFormatException e) {
                LOGGER.debug("Extractor dropped declared total value={}", total.group(1));
            }
        }
        return Optional.of(payload);
    }

    private Optional<ObjectNode> bareArray(String text) {
        if (!text.startsWith("[") || !text.endsWith("]")) {
            return Optional.empty();
        }
        return parseLenient(text).filter(JsonNode::isArray).map(array -> {
            ObjectNode payload = mapper.createObjectNode();
            payload.set(SHORTS_FIELD, array);
            return payload;
        });
    }

    private Optional<ObjectNode> salvage(String text) {
        ArrayNode salvaged = mapper.createArrayNode();
        int skipped = 0;
        Matcher fragments = FLAT_OBJECT.matcher(text);
        while (fragments.find()) {
            String fragment = fragments.group();
            Matcher title = SALVAGE_TITLE.matcher(fragment);
            Matcher start = SALVAGE_START.matcher(fragment);
            Matcher end = SALVAGE_END.matcher(fragment);
            if (!title.find() || !start.find() || !end.find()) {
                continue;
            }
            OptionalDouble startSec = timeParser.parseText(start.group(1));
            OptionalDouble endSec = timeParser.parseText(end.group(1));
            if (startSec.isEmpty() || endSec.isEmpty() || endSec.getAsDouble() <= startSec.getAsDouble()) {
                skipped++;
                LOGGER.debug("Extractor salvage skip title='{}' start='{}' end='{}'", title.group(1), start.group(1), end.group(1));
                continue;
            }
            ObjectNode candidate = salvaged.addObject();
            candidate.put("title", unescape(title.group(1)));
            candidate.put("start_time", startSec.getAsDouble());
            candidate.put("end_time", endSec.getAsDouble());
            Matcher reason = SALVAGE_REASON.matcher(fragment);
            if (reason.find()) {
                candidate.put("reason", unescape(reason.group(1)));
            }
            Matcher score = SALVAGE_SCORE.matcher(fragment);
            if (score.find()) {
                candidate.put("score", score.group(1));
            }
        }
        if (salvaged.isEmpty()) {
            return Optional.empty();
        }
        LOGGER.info("Extractor salvaged candidates={} skipped={}", salvaged.size(), skipped);
        ObjectNode payload = mapper.createObjectNode();
        payload.set(SHORTS_FIELD, salvaged);
        return Optional.of(payload);
    }

    private static boolean hasListKey(ObjectNode object) {
        return LIST_KEYS.stream().anyMatch(object::has);
    }

    private static boolean looksLikeCandidate(ObjectNode object) {
        return (object.has("start_time") || object.has("start")) && (object.has("end_time") || object.has("end"));
    }

    private static ObjectNode normalizeListKey(ObjectNode payload) {
        if (!payload.has(SHORTS_FIELD)) {
            for (String key : LIST_KEYS) {
                if (payload.has(key)) {
                    payload.set(SHORTS_FIELD, payload.remove(key));
                    break;
                }
            }
        }
        return payload;
    }

    private static Pattern field(String key, String valuePattern) {
        return Pattern.compile("(?:\"" + key + "\"|(?<=[{,])\\s*" + key + ")\\s*:\\s*" + valuePattern);
    }

    private static String unescape(String value) {
        return value.replace("\\\"", "\"").replace("\\n", " ").replace("\\\\", "\\").trim();
    }

    private record NamedStrategy(String name, ExtractionStrategy strategy) {}
}
