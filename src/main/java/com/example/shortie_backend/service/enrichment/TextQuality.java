package com.example.shortie_backend.service.enrichment;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heuristics that decide whether a generated title or reason needs replacing.
 */
public final class TextQuality {
    private static final Set<String> GENERIC_TITLES = Set.of(
            "compelling title", "untitled segment", "untitled", "auto clip", "key moment", "interesting moment",
            "great clip", "clip", "short", "video clip", "highlight", "highlights", "engaging segment",
            "must watch", "title", "specific headline", "viral moment", "funny moment", "best moment");
    private static final Set<String> FILLER_STARTERS = Set.of(
            "and", "but", "so", "or", "because", "um", "uh", "like", "well", "then", "also", "yeah", "okay");
    private static final String AUTO_MARKER = "auto-generated";
    private static final Set<String> LATIN_SCRIPT_LANGUAGES = Set.of(
            "en", "es", "fr", "de", "it", "pt", "nl", "sv", "da", "no", "nb", "nn", "fi", "pl", "cs", "sk",
            "ro", "hu", "tr", "id", "ms", "ca", "hr", "sl", "et", "lv", "lt", "sw", "tl", "af", "ga", "is");
    private static final Pattern EDGE_PUNCT = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double MIN_ASCII_LETTER_RATIO = 0.6;
    static final int MIN_REASON_WORDS = 5;

    private TextQuality() {}

    public static boolean isGenericTitle(String title) {
        return GENERIC_TITLES.contains(normalize(title));
    }

    public static boolean startsWithFiller(String title) {
        String trimmed = title == null ? "" : title.strip();
        if (trimmed.isEmpty() || !Character.isLowerCase(trimmed.charAt(0))) {
            return false;
        }
        String first = EDGE_PUNCT.matcher(WHITESPACE.split(trimmed, 2)[0]).replaceAll("");
        return FILLER_STARTERS.contains(first);
    }

    /**
     * Title check without the duplicate rule, which needs the whole set.
     */
    public static boolean isWeakTitle(String title, String language) {
        return title == null || title.isBlank()
                || isGenericTitle(title)
                || startsWithFiller(title)
                || isForeignScript(title, language);
    }

    public static boolean isWeakReason(String reason, String language) {
        if (reason == null || reason.isBlank()) {
            return true;
        }
        String trimmed = reason.strip();
        return wordCount(trimmed) < MIN_REASON_WORDS
                || trimmed.toLowerCase(Locale.ROOT).startsWith(AUTO_MARKER)
                || isForeignScript(trimmed, language);
    }

    /**
     * Coarse script check, applied only for Latin-script transcript languages or when the language is unknown.
     * Flags Arabic or Devanagari code points, or fewer than 60% ASCII letters among all letters.
     */
    public static boolean isForeignScript(String text, String language) {
        if (text == null || text.isBlank() || !expectsLatinScript(language)) {
            return false;
        }
        int letters = 0;
        int ascii = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            if (script == Character.UnicodeScript.ARABIC || script == Character.UnicodeScript.DEVANAGARI) {
                return true;
            }
            if (Character.isLetter(cp)) {
                letters++;
                if (cp < 128) {
                    ascii++;
                }
            }
        }
        return letters > 0 && (double) ascii / letters < MIN_ASCII_LETTER_RATIO;
    }

    static boolean expectsLatinScript(String language) {
        if (language == null || language.isBlank()) {
            return true;
        }
        String code = language.strip().toLowerCase(Locale.ROOT);
        int dash = code.indexOf('-');
        if (dash > 0) {
            code = code.substring(0, dash);
        }
        return LATIN_SCRIPT_LANGUAGES.contains(code);
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
        return EDGE_PUNCT.matcher(collapsed).replaceAll("");
    }

    static int wordCount(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
