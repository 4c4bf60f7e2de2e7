package com.example.shortie_backend.service;

import com.example.shortie_backend.config.ShortsProperties;
import com.example.shortie_backend.dto.BrandInfo;
import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.ClipSet;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.parser.ParsedShorts;
import com.example.shortie_backend.refine.ClipBoundaryRefiner;
import com.example.shortie_backend.refine.RefinerConfig;
import com.example.shortie_backend.selector.GoodClipSelector;
import com.example.shortie_backend.selector.SelectorConfig;
import com.example.shortie_backend.service.enrichment.QualityEnricher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the shorts pipeline: prompt, generation, extraction with repair, selection, refinement and enrichment.
 * Long transcripts are processed in time-bounded chunks whose candidates are merged before the global
 * selection.
 */
@Service
public class ShortsSelectionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortsSelectionService.class);

    private final GenerationEngine engine;
    private final ShortsPromptFactory prompts;
    private final ShortsResponseParser responseParser;
    private final GoodClipSelector selector;
    private final ClipBoundaryRefiner refiner;
    private final QualityEnricher enricher;
    private final ShortsProperties props;

    public ShortsSelectionService(GenerationEngine engine,
                                  ShortsPromptFactory prompts,
                                  ShortsResponseParser responseParser,
                                  GoodClipSelector selector,
                                  ClipBoundaryRefiner refiner,
                                  QualityEnricher enricher,
                                  ShortsProperties props) {
        this.engine = engine;
        this.prompts = prompts;
        this.responseParser = responseParser;
        this.selector = selector;
        this.refiner = refiner;
        this.enricher = enricher;
        this.props = props;
    }

    public ClipSet selectShorts(Transcript transcript, BrandInfo brand, Integer targetShorts) {
        return selectShorts(transcript, brand, targetShorts, ChunkProgressListener.NONE);
    }

    /**
     * Runs the pipeline, retrying the whole run up to {@code shorts.max-retries} times.
     *
     * @param transcript   transcript to cut.
     * @param brand        optional brand context.
     * @param targetShorts requested clip count, {@code null} for the configured default.
     * @param listener     chunk progress callback.
     * @return final clip set ordered by start.
     * @throws RuntimeException the last failure once all attempts are exhausted.
     */
    public ClipSet selectShorts(Transcript transcript, BrandInfo brand, Integer targetShorts, ChunkProgressListener listener) {
        int target = targetShorts != null && targetShorts > 0 ? targetShorts : props.getTargetShorts();
        int attempts = Math.max(0, props.getMaxRetries()) + 1;
        RuntimeException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return run(transcript, brand, target, listener == null ? ChunkProgressListener.NONE : listener);
            } catch (RuntimeException e) {
                last = e;
                LOGGER.warn("ShortsSelectionService attempt={} of {} failed provider={} error={}",
                        attempt, attempts, engine.provider(), e.getMessage());
            }
        }
        throw last;
    }

    /**
     * Extraction and coercion only, for diagnosing provider output.
     */
    public ClipSet parseOnly(String content) {
        return responseParser.parse(content)
                .map(parsed -> ClipSet.of(parsed.shorts()))
                .orElseGet(ClipSet::empty);
    }

    private ClipSet run(Transcript transcript, BrandInfo brand, int target, ChunkProgressListener listener) {
        List<ClipCandidate> candidates = isChunked(transcript)
                ? collectChunked(transcript, brand, target, listener)
                : collect(transcript, brand, target);
        LOGGER.info("ShortsSelectionService candidates={} target={} provider={}", candidates.size(), target, engine.provider());

        List<ClipCandidate> selected = selector.select(candidates, transcript, new SelectorConfig(target, props.getMinGapSeconds()));
        LOGGER.debug("ShortsSelectionService selection {}", selector.explainLast());
        List<ClipCandidate> refined = refiner.refine(selected, transcript, RefinerConfig.from(props, target));
        List<ClipCandidate> enriched = enricher.enrich(refined, transcript, props.isEnrichmentEnabled());
        LOGGER.info("ShortsSelectionService selected={} refined={} final={}", selected.size(), refined.size(), enriched.size());
        return ClipSet.of(enriched);
    }

    private List<ClipCandidate> collect(Transcript transcript, BrandInfo brand, int target) {
        String reply = engine.complete(prompts.selectionPrompt(transcript, brand, target, props.getMinGapSeconds()));
        ParsedShorts parsed = responseParser.parseOrRepair(reply);
        return parsed.shorts();
    }

    boolean isChunked(Transcript transcript) {
        double chunkSec = props.getChunkMinutes() * 60.0;
        return chunkSec > 0 && transcript.hasSegments() && transcript.spanEnd() - transcript.spanStart() > chunkSec;
    }

    private List<ClipCandidate> collectChunked(Transcript transcript, BrandInfo brand, int target, ChunkProgressListener listener) {
        double chunkSec = props.getChunkMinutes() * 60.0;
        double spanStart = transcript.spanStart();
        double spanEnd = transcript.spanEnd();
        double span = spanEnd - spanStart;
        int count = (int) Math.ceil(span / chunkSec);
        List<ClipCandidate> merged = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < count; i++) {
            double from = spanStart + i * chunkSec;
            double to = i == count - 1 ? Double.POSITIVE_INFINITY : from + chunkSec;
            Transcript chunk = transcript.slice(from, to);
            if (!chunk.hasSegments()) {
                listener.onChunkDone(i, count);
                continue;
            }
            double chunkSpan = Math.min(chunkSec, spanEnd - from);
            int chunkTarget = Math.max(1, (int) Math.round(target * chunkSpan / span));
            try {
                List<ClipCandidate> found = collect(chunk, brand, chunkTarget);
                List<ClipCandidate> picked = selector.select(found, chunk, new SelectorConfig(chunkTarget, props.getMinGapSeconds()));
                merged.addAll(picked);
                LOGGER.info("ShortsSelectionService chunk={}/{} window={}-{} candidates={} picked={}",
                        i + 1, count, from, Math.min(to, spanEnd), found.size(), picked.size());
            } catch (RuntimeException e) {
                failed++;
                LOGGER.warn("ShortsSelectionService chunk={}/{} failed error={}", i + 1, count, e.getMessage());
            }
            listener.onChunkDone(i, count);
        }
        if (failed == count) {
            LOGGER.warn("ShortsSelectionService all chunks failed count={}, continuing with backfill", count);
        }
        return merged;
    }
}
