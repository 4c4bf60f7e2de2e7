package com.example.shortie_backend.parser;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Normalizes the time notations found in generated clip descriptions into seconds.
 *
 * <p>Accepted forms: numbers, plain decimals with an optional {@code s}/{@code sec}/{@code secs} suffix,
 * {@code MM:SS(.ff)}, {@code HH:MM:SS(.ff)}, {@code HH:MM:SS:FF} and dotted variants such as
 * {@code 10.56.39.32}. In the four part form the last component counts hundredths of a second.
 */
@Component
public class TimeParser {
    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\s*(?:seconds|secs|sec|s)$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");

    public OptionalDouble parse(Object value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value instanceof Number number) {
            return finite(number.doubleValue());
        }
        if (value instanceof JsonNode node) {
            return parseNode(node);
        }
        return parseText(value.toString());
    }

    public OptionalDouble parseNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return finite(node.asDouble());
        }
        if (node.isTextual()) {
            return parseText(node.asText());
        }
        return OptionalDouble.empty();
    }

    public OptionalDouble parseText(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String text = UNIT_SUFFIX.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceFirst("").trim();
        if (text.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (PLAIN_NUMBER.matcher(text).matches()) {
            return finite(Double.parseDouble(text));
        }

        String[] parts;
        if (text.indexOf(':') >= 0) {
            parts = text.split(":", -1);
        } else if (text.chars().filter(c -> c == '.').count() >= 2) {
            parts = text.split("\\.", -1);
        } else {
            return OptionalDouble.empty();
        }

        try {
            return switch (parts.length) {
                case 2 -> finite(number(parts[0]) * 60 + number(parts[1]));
                case 3 -> finite(number(parts[0]) * 3600 + number(parts[1]) * 60 + number(parts[2]));
                // hundredths, not milliseconds
                case 4 -> finite(number(parts[0]) * 3600 + number(parts[1]) * 60 + number(parts[2]) + number(parts[3]) / 100.0);
                default -> OptionalDouble.empty();
            };
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static double number(String part) {
        String trimmed = part.trim();
        if (!PLAIN_NUMBER.matcher(trimmed).matches()) {
            throw new NumberFormatException("not a time component: '" + part + "'");
        }
        return Double.parseDouble(trimmed);
    }

    private static OptionalDouble finite(double value) {
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
