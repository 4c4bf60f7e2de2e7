package com.example.shortie_backend.engine;

import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Offline engine that never proposes clips. The pipeline then falls back to backfilled clips.
 */
public class DummyGenerationEngine implements GenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DummyGenerationEngine.class);

    @Override
    public String complete(List<Message> messages) {
        LOGGER.info("Dummy generation engine invoked messages={}", messages.size());
        return "{\"shorts\": [], \"total_shorts\": 0}";
    }

    @Override
    public String provider() {
        return "dummy";
    }
}
