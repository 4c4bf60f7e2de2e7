package com.example.shortie_backend.service;

import com.example.shortie_backend.config.ShortsProperties;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.parser.LenientJsonExtractor;
import com.example.shortie_backend.parser.ParsedShorts;
import com.example.shortie_backend.parser.SchemaCoercer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Extraction and coercion of a selection reply, escalating to a single repair request when nothing can
 * be extracted.
 */
@Service
public class ShortsResponseParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortsResponseParser.class);
    private static final int LOG_PREVIEW_CHARS = 200;

    private final LenientJsonExtractor extractor;
    private final SchemaCoercer coercer;
    private final GenerationEngine engine;
    private final ShortsPromptFactory prompts;
    private final ShortsProperties props;

    public ShortsResponseParser(LenientJsonExtractor extractor,
                                SchemaCoercer coercer,
                                GenerationEngine engine,
                                ShortsPromptFactory prompts,
                                ShortsProperties props) {
        this.extractor = extractor;
        this.coercer = coercer;
        this.engine = engine;
        this.prompts = prompts;
        this.props = props;
    }

    /**
     * @return coerced candidates, or empty when no strategy could extract a payload.
     */
    public Optional<ParsedShorts> parse(String raw) {
        return extractor.extract(raw).map(coercer::coerce);
    }

    /**
     * Parses the reply; on extraction failure sends one repair request and parses its reply. A reply that
     * parses to an empty list is accepted as is.
     *
     * @return candidates, empty when the repair attempt also fails.
     * @throws com.example.shortie_backend.engine.GenerationException when the repair request itself fails.
     */
    public ParsedShorts parseOrRepair(String raw) {
        Optional<ParsedShorts> parsed = parse(raw);
        if (parsed.isPresent()) {
            LOGGER.debug("ShortsResponseParser parsed candidates={}", parsed.get().totalShorts());
            return parsed.get();
        }
        LOGGER.warn("ShortsResponseParser extraction failed, requesting repair provider={} preview='{}'",
                engine.provider(), preview(raw));
        String repaired = engine.complete(prompts.repairPrompt(raw, props.getRepairInputMaxChars()));
        Optional<ParsedShorts> second = parse(repaired);
        if (second.isEmpty()) {
            LOGGER.warn("ShortsResponseParser repair failed preview='{}'", preview(repaired));
            return ParsedShorts.empty();
        }
        LOGGER.info("ShortsResponseParser repair succeeded candidates={}", second.get().totalShorts());
        return second.get();
    }

    static String preview(String raw) {
        if (raw == null) {
            return "";
        }
        String flat = raw.replaceAll("\\s+", " ").strip();
        return flat.length() <= LOG_PREVIEW_CHARS ? flat : flat.substring(0, LOG_PREVIEW_CHARS) + "...";
    }
}
