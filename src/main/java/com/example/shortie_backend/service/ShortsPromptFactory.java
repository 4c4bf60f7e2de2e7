package com.example.shortie_backend.service;

import com.example.shortie_backend.dto.BrandInfo;
import com.example.shortie_backend.dto.Transcript;
import com.example.shortie_backend.engine.Interfaces.GenerationEngine.Message;
import com.example.shortie_backend.service.enrichment.EnrichmentItem;
import com.example.shortie_backend.util.TranscriptUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the selection, repair and title/reason prompts.
 */
@Component
public class ShortsPromptFactory {
    static final int MAX_EXCERPT_CHARS = 700;

    private static final String SELECTION_SYSTEM = """
            You are an API that converts video transcripts into a JSON array of video clips.

            Your goal is to select engaging segments (15-60 seconds each) from the provided transcript. Each clip must be long enough to stand alone and feel complete, with enough context to be funny, viral, informative, and engaging. Prefer 20-40s when possible; only go near 60s if retention is exceptional.

            A clip should hit at least 3 of these:
            1) Hook strength in the first sentence (clickable, strong statement, question people care about, emotional shift).
            2) Self-contained context (works without backstory).
            3) Emotional or opinion intensity (surprise, disagreement, curiosity, humor, vulnerability).
            4) One clear idea that can be summarized in one sentence.
            5) Quote-ability (would work as a bold on-screen caption).
            6) Loop potential (ends on a punchline, cliffhanger, or unfinished thought).

            Output ONLY valid JSON with this structure:
            {
              "shorts": [
                {
                  "title": "Specific headline",
                  "start_time": 10.5,
                  "end_time": 45.2,
                  "reason": "Brief reason"
                }
              ],
              "total_shorts": 1
            }

            Rules:
            1. "start_time" and "end_time" must be plain numbers of seconds, without units.
            2. Do not use timecodes like HH:MM:SS or 10.56.39.32.
            3. "title" must describe the clip's topic like a headline. No generic or filler titles.
            4. "reason" is required and must reference the actual content (hook, twist, punchline, strong claim, conflict, or payoff).
            5. Avoid back-to-back clips. Spread selections across the full transcript timeline.
            6. If no good clips are found, return {"shorts": [], "total_shorts": 0}.
            7. Allowed keys in each short: "title", "start_time", "end_time", "reason".
            8. Do not output anything else: no <think> tags, no markdown blocks.
            """;

    private static final String REPAIR_SYSTEM = """
            You are a strict JSON repair tool.

            Convert the given text into ONLY a valid JSON object that matches:
            {
              "shorts": [
                {
                  "title": "Specific headline",
                  "start_time": 10.5,
                  "end_time": 45.2,
                  "reason": "Brief reason"
                }
              ],
              "total_shorts": 1
            }

            Rules:
            1. Output ONLY valid JSON, no extra text.
            2. "start_time" and "end_time" must be numbers (seconds).
            3. If the input lacks valid shorts, output: {"shorts": [], "total_shorts": 0}
            """;

    private static final String TITLES_SYSTEM = """
            You generate short, coherent titles and reasons for video clips.

            You will be given multiple clip excerpts, each with its index and transcript window.
            Return ONLY valid JSON. No extra text, no markdown.

            Output format:
            {
              "items": [
                { "index": 0, "title": "Specific headline", "reason": "1-2 sentences that reference the excerpt." }
              ]
            }

            Rules:
            1) Each title must be specific and descriptive (4-12 words). Avoid generic filler.
            2) Each reason must be 1-2 sentences, 90-180 characters, and reference concrete details from the excerpt.
            3) Do not invent facts not present in the excerpt.
            4) Write in the language of the excerpt, in complete sentences.
            """;

    public List<Message> selectionPrompt(Transcript transcript, BrandInfo brand, int targetShorts, double minGapSeconds) {
        String user = String.format(Locale.ROOT, """
                Analyze the following transcript and return the JSON object.
                Return up to %d clips.
                Keep clips at least %.0f seconds apart by start time.

                Transcript:
                %s
                %s""", targetShorts, minGapSeconds, TranscriptUtil.formatForPrompt(transcript), brandContext(brand));
        return List.of(Message.system(SELECTION_SYSTEM), Message.user(user));
    }

    public List<Message> repairPrompt(String failedReply, int maxChars) {
        String content = failedReply == null ? "" : failedReply;
        if (content.length() > maxChars) {
            content = content.substring(0, maxChars);
        }
        return List.of(Message.system(REPAIR_SYSTEM), Message.user("Fix this into valid JSON:\n" + content));
    }

    public List<Message> titlesPrompt(List<EnrichmentItem> items) {
        StringBuilder sb = new StringBuilder("Create titles and reasons for these clips:\n");
        for (EnrichmentItem item : items) {
            String excerpt = item.excerpt().length() > MAX_EXCERPT_CHARS
                    ? item.excerpt().substring(0, MAX_EXCERPT_CHARS)
                    : item.excerpt();
            sb.append(String.format(Locale.ROOT, "%nindex: %d%nwindow: %.2fs - %.2fs%ncurrent title: %s%nexcerpt: %s%n",
                    item.index(), item.startTime(), item.endTime(), item.title(), excerpt));
        }
        return List.of(Message.system(TITLES_SYSTEM), Message.user(sb.toString()));
    }

    static String brandContext(BrandInfo brand) {
        if (brand == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, "Brand Name", brand.name());
        addIfPresent(parts, "Brand Description", brand.description());
        addIfPresent(parts, "Target Audience", brand.targetAudience());
        addIfPresent(parts, "Desired Tone", brand.tone());
        if (brand.keyTopics() != null && !brand.keyTopics().isEmpty()) {
            parts.add("Key Topics: " + String.join(", ", brand.keyTopics()));
        }
        addIfPresent(parts, "Style Preferences", brand.stylePreferences());
        return parts.isEmpty() ? "" : "\nBrand Context:\n" + String.join("\n", parts) + "\n";
    }

    private static void addIfPresent(List<String> parts, String label, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(label + ": " + value);
        }
    }
}
