package com.example.shortie_backend.service.enrichment;

import com.example.shortie_backend.util.TranscriptUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local fallback that derives a title and a reason from the transcript text under a clip.
 */
public final class ExcerptSummarizer {
    public static final String FALLBACK_REASON = "Selected as a standout moment from this part of the video.";
    static final int MAX_TITLE_CHARS = 90;
    static final int MIN_REASON_CHARS = 90;
    static final int MAX_REASON_CHARS = 180;
    private static final int MAX_REASON_SENTENCES = 3;

    private static final Set<String> LEADING_WORDS = Set.of(
            "a", "an", "the", "i", "we", "you", "he", "she", "it", "they", "this", "that",
            "so", "and", "but", "well", "um", "uh", "like", "okay", "yeah");
    private static final Pattern CLAUSE_BREAK = Pattern.compile("[,;:]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[\\s\\p{Punct}]+$");

    private ExcerptSummarizer() {}

    public static String fallbackTitle(int position) {
        return "Clip " + position;
    }

    /**
     * Lead clause of the first sentence, without leading articles or pronouns, capitalized.
     *
     * @return title, or an empty string when the excerpt has no usable words.
     */
    public static String title(String excerpt) {
        List<String> sentences = TranscriptUtil.toSentences(excerpt);
        return sentences.isEmpty() ? "" : titleOf(sentences.get(0));
    }

    /**
     * Titles derived from each sentence of the excerpt in order, empty ones left out.
     */
    public static List<String> titles(String excerpt) {
        List<String> out = new ArrayList<>();
        for (String sentence : TranscriptUtil.toSentences(excerpt)) {
            String title = titleOf(sentence);
            if (!title.isEmpty()) {
                out.add(title);
            }
        }
        return out;
    }

    private static String titleOf(String sentence) {
        String clause = CLAUSE_BREAK.split(sentence, 2)[0].strip();
        if (TextQuality.wordCount(clause) < 3) {
            clause = sentence;
        }
        List<String> words = new ArrayList<>(List.of(WHITESPACE.split(clause.strip())));
        while (words.size() > 1 && LEADING_WORDS.contains(bare(words.get(0)))) {
            words.remove(0);
        }
        String title = truncateAtWord(String.join(" ", words), MAX_TITLE_CHARS);
        title = TRAILING_PUNCT.matcher(title).replaceAll("");
        if (title.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(title.charAt(0)) + title.substring(1);
    }

    /**
     * One to three sentences of the excerpt, joined until about 90 characters, never over 180, ending
     * with a period.
     *
     * @return reason, or an empty string for an empty excerpt.
     */
    public static String reason(String excerpt) {
        List<String> sentences = TranscriptUtil.toSentences(excerpt);
        if (sentences.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sentences.size() && i < MAX_REASON_SENTENCES; i++) {
            if (sb.length() >= MIN_REASON_CHARS) {
                break;
            }
            if (sb.length() > 0) sb.append(' ');
            sb.append(sentences.get(i));
        }
        String reason = truncateAtWord(sb.toString(), MAX_REASON_CHARS - 1);
        reason = TRAILING_PUNCT.matcher(reason).replaceAll("");
        return reason.isEmpty() ? "" : reason + ".";
    }

    private static String bare(String word) {
        return word.replaceAll("\\p{Punct}", "").toLowerCase(Locale.ROOT);
    }

    static String truncateAtWord(String text, int maxChars) {
        String trimmed = text.strip();
        if (trimmed.length() <= maxChars) {
            return trimmed;
        }
        int cut = trimmed.lastIndexOf(' ', maxChars);
        return (cut > 0 ? trimmed.substring(0, cut) : trimmed.substring(0, maxChars)).strip();
    }
}
