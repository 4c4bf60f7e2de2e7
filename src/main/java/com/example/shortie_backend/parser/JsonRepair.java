package com.example.shortie_backend.parser;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text level clean-up applied to generated output before it is handed to Jackson.
 */
public final class JsonRepair {
    private JsonRepair() {}

    private static final Pattern REASONING_BLOCK =
            Pattern.compile("<(think|thinking|reasoning)>.*?</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FENCE = Pattern.compile("```[A-Za-z0-9_-]*");
    private static final String TIME_KEY = "\"(?:start_time|end_time|start|end|startTime|endTime)\"";
    private static final Pattern TIMECODE_VALUE = Pattern.compile(
            "(" + TIME_KEY + "\\s*:\\s*)\"?((?:\\d+:){1,3}\\d+(?:\\.\\d+)?|\\d+(?:\\.\\d+){2,3})\\s*(?:secs|sec|s)?\"?");
    private static final Pattern QUOTED_SECONDS = Pattern.compile(
            "(" + TIME_KEY + "\\s*:\\s*)\"\\s*(-?\\d+(?:\\.\\d+)?)\\s*(?:seconds|secs|sec|s)?\\s*\"");
    private static final Pattern MISSING_OBJECT_COMMA = Pattern.compile("\\}(\\s*)\\{");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");

    /**
     * Removes reasoning blocks and markdown fences, then trims.
     */
    public static String preprocess(String raw) {
        if (raw == null) {
            return "";
        }
        String text = REASONING_BLOCK.matcher(raw).replaceAll("");
        text = FENCE.matcher(text).replaceAll("");
        return text.trim();
    }

    /**
     * Applies every structural repair in a fixed order.
     */
    public static String repair(String candidate, TimeParser timeParser) {
        String text = stripComments(candidate);
        text = fixTimecodes(text, timeParser);
        text = stripTimeUnits(text);
        text = insertMissingCommas(text);
        return removeTrailingCommas(text);
    }

    /**
     * Drops {@code //} line comments and {@code /* *}{@code /} block comments that sit outside string literals.
     * Both double and single quoted literals are recognised.
     */
    public static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        boolean escaped = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                out.append(c);
                i++;
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Rewrites timecode shaped values of time fields ({@code "start_time": "01:02:03"}) to numeric seconds.
     */
    public static String fixTimecodes(String text, TimeParser timeParser) {
        return replaceOutsideLiterals(text, TIMECODE_VALUE, m -> {
            OptionalDouble seconds = timeParser.parseText(m.group(2));
            return seconds.isPresent() ? m.group(1) + formatSeconds(seconds.getAsDouble()) : m.group();
        });
    }

    /**
     * Turns quoted numeric time values such as {@code "12.5s"} into numeric literals.
     */
    public static String stripTimeUnits(String text) {
        return replaceOutsideLiterals(text, QUOTED_SECONDS, m -> m.group(1) + m.group(2));
    }

    public static String insertMissingCommas(String text) {
        return replaceOutsideLiterals(text, MISSING_OBJECT_COMMA, m -> "}," + m.group(1) + "{");
    }

    public static String removeTrailingCommas(String text) {
        return replaceOutsideLiterals(text, TRAILING_COMMA, m -> m.group(1));
    }

    /**
     * Finds the bracket closing the one at {@code openIndex}, skipping string literals.
     *
     * @return index of the closing bracket or {@code -1} when unbalanced.
     */
    public static int findMatching(String text, int openIndex) {
        char open = text.charAt(openIndex);
        char close = open == '{' ? '}' : ']';
        boolean[] literal = literalMask(text, openIndex);
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            if (literal[i]) {
                continue;
            }
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Applies {@code replacement} to every match of {@code pattern} that starts outside a string literal.
     */
    private static String replaceOutsideLiterals(String text, Pattern pattern, Function<Matcher, String> replacement) {
        boolean[] literal = literalMask(text, 0);
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = literal[m.start()] ? m.group() : replacement.apply(m);
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Marks the characters that belong to a string literal body, closing quote included. Opening quotes stay
     * unmarked so a pattern anchored on a quoted key still counts as outside. Scanning starts at {@code from},
     * so apostrophes in leading prose do not open a literal.
     */
    static boolean[] literalMask(String text, int from) {
        boolean[] literal = new boolean[text.length()];
        char quote = 0;
        boolean escaped = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote == 0) {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                continue;
            }
            literal[i] = true;
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == quote) {
                quote = 0;
            }
        }
        return literal;
    }

    static String formatSeconds(double seconds) {
        return BigDecimal.valueOf(seconds).stripTrailingZeros().toPlainString();
    }
}
