package com.example.shortie_backend.service.enrichment;

import com.example.shortie_backend.dto.ClipCandidate;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.engine.GenerationException;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine;
import com.example.shortie_backend.parser.LenientJsonExtractor;
import com.example.shortie_backend.service.ShortsPromptFactory;
import com.example.shortie_backend.util.TranscriptUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces generic, duplicate or wrong-script titles and reasons.
 *
 * <p>Flagged clips go out in one index-addressed enrichment request. Whatever is still flagged after the
 * patches are applied is synthesized locally from the transcript excerpt. The input list is never modified.
 */
@Service
public class QualityEnricher {
    private static final Logger LOGGER = LoggerFactory.getLogger(QualityEnricher.class);

    private final GenerationEngine engine;
    private final ShortsPromptFactory prompts;
    private final LenientJsonExtractor extractor;

    public QualityEnricher(GenerationEngine engine, ShortsPromptFactory prompts, LenientJsonExtractor extractor) {
        this.engine = engine;
        this.prompts = prompts;
        this.extractor = extractor;
    }

    /**
     * @param clips      final clips, ordered by start.
     * @param transcript transcript the clips were cut from.
     * @param remote     whether the enrichment request may be sent; {@code false} goes straight to local synthesis.
     * @return new list with the same windows and scores.
     */
    public List<ClipCandidate> enrich(List<ClipCandidate> clips, Transcript transcript, boolean remote) {
        if (clips == null || clips.isEmpty()) {
            return List.of();
        }
        String language = transcript.language();
        List<String> excerpts = new ArrayList<>(clips.size());
        for (ClipCandidate clip : clips) {
            excerpts.add(TranscriptUtil.excerpt(transcript, clip.startTime(), clip.endTime()));
        }

        List<Flags> flags = assess(clips, language);
        long flagged = flags.stream().filter(Flags::any).count();
        if (flagged == 0) {
            LOGGER.debug("QualityEnricher clips={} flagged=0", clips.size());
            return List.copyOf(clips);
        }

        Map<Integer, Patch> patches = remote ? requestPatches(clips, flags, excerpts) : Map.of();
        List<ClipCandidate> patched = applyPatches(clips, flags, patches, language);

        List<Flags> remaining = assess(patched, language);
        Set<String> takenTitles = new HashSet<>();
        for (int i = 0; i < patched.size(); i++) {
            if (!remaining.get(i).title()) {
                takenTitles.add(TextQuality.normalize(patched.get(i).title()));
            }
        }
        List<ClipCandidate> out = new ArrayList<>(patched.size());
        int synthesized = 0;
        for (int i = 0; i < patched.size(); i++) {
            ClipCandidate clip = patched.get(i);
            Flags f = remaining.get(i);
            if (!f.any()) {
                out.add(clip);
                continue;
            }
            synthesized++;
            String excerpt = excerpts.get(i);
            String title = clip.title();
            String reason = clip.reason();
            if (f.title()) {
                title = synthesizeTitle(excerpt, i, takenTitles);
            }
            if (f.reason()) {
                String local = ExcerptSummarizer.reason(excerpt);
                reason = local.isEmpty() ? ExcerptSummarizer.FALLBACK_REASON : local;
            }
            out.add(clip.withText(title, reason));
        }
        LOGGER.info("QualityEnricher clips={} flagged={} patched={} synthesized={}",
                clips.size(), flagged, patches.size(), synthesized);
        return List.copyOf(out);
    }

    /**
     * First sentence title of the excerpt not already used by another clip, else {@code Clip N}.
     */
    private static String synthesizeTitle(String excerpt, int index, Set<String> takenTitles) {
        for (String candidate : ExcerptSummarizer.titles(excerpt)) {
            if (takenTitles.add(TextQuality.normalize(candidate))) {
                return candidate;
            }
        }
        String fallback = ExcerptSummarizer.fallbackTitle(index + 1);
        takenTitles.add(TextQuality.normalize(fallback));
        return fallback;
    }

    static List<Flags> assess(List<ClipCandidate> clips, String language) {
        List<Flags> out = new ArrayList<>(clips.size());
        Set<String> seenTitles = new HashSet<>();
        for (ClipCandidate clip : clips) {
            String key = TextQuality.normalize(clip.title());
            boolean duplicate = !key.isEmpty() && !seenTitles.add(key);
            out.add(new Flags(duplicate || TextQuality.isWeakTitle(clip.title(), language),
                    TextQuality.isWeakReason(clip.reason(), language)));
        }
        return out;
    }

    private Map<Integer, Patch> requestPatches(List<ClipCandidate> clips, List<Flags> flags, List<String> excerpts) {
        List<EnrichmentItem> items = new ArrayList<>();
        for (int i = 0; i < clips.size(); i++) {
            if (flags.get(i).any() && !excerpts.get(i).isBlank()) {
                ClipCandidate clip = clips.get(i);
                items.add(new EnrichmentItem(i, clip.startTime(), clip.endTime(), clip.title(), clip.reason(), excerpts.get(i)));
            }
        }
        if (items.isEmpty()) {
            return Map.of();
        }
        String reply;
        try {
            reply = engine.complete(prompts.titlesPrompt(items));
        } catch (GenerationException e) {
            LOGGER.warn("QualityEnricher request failed provider={} items={} error={}", engine.provider(), items.size(), e.getMessage());
            return Map.of();
        }
        return parsePatches(reply, clips.size());
    }

    Map<Integer, Patch> parsePatches(String reply, int size) {
        Optional<ObjectNode> parsed = extractor.extractObject(reply);
        JsonNode list = parsed.map(node -> node.path("items")).orElse(null);
        if (list == null || !list.isArray()) {
            LOGGER.warn("QualityEnricher reply unusable length={}", reply == null ? 0 : reply.length());
            return Map.of();
        }
        Map<Integer, Patch> patches = new LinkedHashMap<>();
        for (JsonNode item : list) {
            JsonNode index = item.path("index");
            int i;
            if (index.isIntegralNumber() && index.canConvertToInt()) {
                i = index.asInt();
            } else if (index.isTextual()) {
                i = parseIndex(index.asText());
            } else {
                continue;
            }
            String title = item.path("title").isTextual() ? item.path("title").asText().strip() : "";
            String reason = item.path("reason").isTextual() ? item.path("reason").asText().strip() : "";
            if (i < 0 || i >= size || (title.isEmpty() && reason.isEmpty())) {
                continue;
            }
            patches.put(i, new Patch(title, reason));
        }
        return patches;
    }

    private static int parseIndex(String text) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static List<ClipCandidate> applyPatches(List<ClipCandidate> clips, List<Flags> flags,
                                                    Map<Integer, Patch> patches, String language) {
        List<ClipCandidate> out = new ArrayList<>(clips.size());
        for (int i = 0; i < clips.size(); i++) {
            ClipCandidate clip = clips.get(i);
            Patch patch = patches.get(i);
            if (patch == null || !flags.get(i).any()) {
                out.add(clip);
                continue;
            }
            String title = flags.get(i).title() && !TextQuality.isWeakTitle(patch.title(), language) ? patch.title() : clip.title();
            String reason = flags.get(i).reason() && !TextQuality.isWeakReason(patch.reason(), language) ? patch.reason() : clip.reason();
            out.add(clip.withText(title, reason));
        }
        return out;
    }

    record Flags(boolean title, boolean reason) {
        boolean any() {
            return title || reason;
        }
    }

    record Patch(String title, String reason) {}
}
