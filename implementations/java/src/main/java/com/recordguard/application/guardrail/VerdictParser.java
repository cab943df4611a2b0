package com.recordguard.application.guardrail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tolerant line parser turning free oracle text into a typed verdict.
 *
 * <p>Fail-closed contract:
 * <ul>
 *   <li>Unknown or malformed lines are ignored.</li>
 *   <li>A boolean is true only when its line carries the token {@code true} and
 *       not the token {@code false}; a repeated boolean must be true every time.</li>
 *   <li>For other fields the first occurrence wins.</li>
 *   <li>Nothing escapes this class: any failure yields the schema's safe default.</li>
 * </ul>
 */
@Component
@Slf4j
public class VerdictParser {

    static final String PARSE_FAILURE_PREFIX = "Error parsing response: ";

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String LEADING_DECORATION = "-*#> \t";

    public <V> V parse(String raw, VerdictSchema<V> schema) {
        try {
            if (log.isDebugEnabled()) {
                log.debug("Parsing {} response:\n{}", schema.getName(), raw);
            }
            return schema.assemble(extract(raw == null ? "" : raw, schema));
        } catch (RuntimeException e) {
            log.warn("Unparseable {} response, falling back to safe default: {}",
                schema.getName(), e.toString());
            return schema.safeDefault(PARSE_FAILURE_PREFIX + e.getMessage());
        }
    }

    private <V> ParsedFields extract(String raw, VerdictSchema<V> schema) {
        Map<String, Object> values = new HashMap<>();
        Set<String> seen = new HashSet<>();

        for (String line : LINE_BREAK.split(raw)) {
            String content = stripDecoration(line);
            int colon = content.indexOf(':');
            if (colon <= 0) {
                continue;
            }

            String key = normalizeKey(content.substring(0, colon));
            FieldSpec field = schema.field(key).orElse(null);
            if (field == null) {
                continue;
            }

            String remainder = content.substring(colon + 1).trim();
            if (field.type() == FieldType.BOOLEAN) {
                boolean value = parseBoolean(remainder);
                boolean previous = !seen.contains(key) || Boolean.TRUE.equals(values.get(key));
                values.put(key, previous && value);
            } else if (!seen.contains(key)) {
                values.put(key, parseValue(field.type(), remainder));
            }
            seen.add(key);
        }

        ParsedFields.Builder builder = ParsedFields.builder();
        for (FieldSpec field : schema.getFields()) {
            if (values.containsKey(field.name())) {
                builder.put(field.name(), values.get(field.name()));
            } else if (field.type() == FieldType.TEXT) {
                builder.text(field.name(), VerdictSchema.DEFAULT_REASON);
            }
        }
        return builder.build();
    }

    private Object parseValue(FieldType type, String remainder) {
        return switch (type) {
            case TEXT -> VerdictSchema.unescape(remainder);
            case STRING_SET -> parseSet(remainder);
            case NULLABLE_STRING -> parseNullable(remainder);
            case BOOLEAN -> parseBoolean(remainder);
        };
    }

    static boolean parseBoolean(String remainder) {
        Set<String> tokens = new HashSet<>(Arrays.asList(
            NON_LETTERS.split(remainder.toLowerCase(Locale.ROOT))));
        return tokens.contains("true") && !tokens.contains("false");
    }

    static Set<String> parseSet(String remainder) {
        String body = remainder.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : body.split(",")) {
            String cleaned = stripQuotes(token.trim()).trim().toLowerCase(Locale.ROOT);
            if (!cleaned.isEmpty()) {
                tokens.add(cleaned);
            }
        }
        return Set.copyOf(tokens);
    }

    static String parseNullable(String remainder) {
        String value = stripQuotes(remainder.trim()).trim();
        if (value.isEmpty()
                || value.equalsIgnoreCase("null")
                || value.equalsIgnoreCase("none")) {
            return null;
        }
        return VerdictSchema.unescape(value);
    }

    private static String stripDecoration(String line) {
        String content = line.trim();
        int start = 0;
        while (start < content.length() && LEADING_DECORATION.indexOf(content.charAt(start)) >= 0) {
            start++;
        }
        return content.substring(start);
    }

    private static String normalizeKey(String key) {
        String bare = key.replace("*", "").replace("`", "").trim().toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(bare).replaceAll("_");
    }

    private static String stripQuotes(String value) {
        String result = value;
        while (result.length() >= 2 && isQuote(result.charAt(0))
                && result.charAt(result.length() - 1) == result.charAt(0)) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '`' || c == '"' || c == '\'';
    }
}
