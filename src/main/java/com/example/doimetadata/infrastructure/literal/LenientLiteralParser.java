package com.example.doimetadata.infrastructure.literal;

import com.example.doimetadata.domain.model.LiteralListResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Infrastructure helper that reads the stringified structures dataset forms store in text fields.
 * Hides the Jackson configuration from the extractor: single-quoted strings, trailing commas and
 * the Python constants {@code None}, {@code True} and {@code False} are accepted, values that are
 * already lists or mappings are validated as they are.
 */
@Component
public class LenientLiteralParser {

    private static final Map<String, String> PYTHON_CONSTANTS = Map.of(
            "None", "null",
            "True", "true",
            "False", "false");

    private final ObjectMapper literalMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    /**
     * Reads a list of mappings, validating the shape before anything is destructured.
     *
     * @param raw stringified literal or an already materialized list
     * @return parsed entries, or a failure describing why the value is not a list of mappings
     */
    public LiteralListResult parseList(Object raw) {
        if (raw == null) {
            return LiteralListResult.failed("Expected a list of mappings but the value is missing", null);
        }
        Object value;
        try {
            value = materialize(raw);
        } catch (JsonProcessingException ex) {
            return LiteralListResult.failed("Malformed list literal: " + ex.getOriginalMessage(), ex);
        }
        if (!(value instanceof List<?> list)) {
            return LiteralListResult.failed("Expected a list of mappings but found " + describe(value), null);
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (int index = 0; index < list.size(); index++) {
            if (!(list.get(index) instanceof Map<?, ?> entry)) {
                return LiteralListResult.failed(
                        "Entry " + index + " is not a mapping: " + describe(list.get(index)), null);
            }
            entries.add(stringKeys(entry));
        }
        return LiteralListResult.parsed(entries);
    }

    /**
     * Reads a single mapping such as a GeoJSON feature collection.
     *
     * @param raw JSON text or an already materialized mapping
     * @return mapping with string keys
     * @throws IllegalArgumentException when the value is missing, malformed or not a mapping
     */
    public Map<String, Object> parseMapping(Object raw) {
        Object value;
        try {
            value = materialize(raw);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed mapping literal: " + ex.getOriginalMessage(), ex);
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a mapping but found " + describe(value));
        }
        return stringKeys(map);
    }

    private Object materialize(Object raw) throws JsonProcessingException {
        if (raw instanceof String text) {
            return literalMapper.readValue(toJsonConstants(text), Object.class);
        }
        return raw;
    }

    /**
     * Rewrites bare {@code None}/{@code True}/{@code False} words to their JSON spelling.
     * Text inside single- or double-quoted strings is copied untouched.
     */
    static String toJsonConstants(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
            } else if (c == '\'' || c == '"') {
                quote = c;
                out.append(c);
                i++;
            } else if (Character.isLetter(c)) {
                int end = i;
                while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
                    end++;
                }
                String word = text.substring(i, end);
                out.append(PYTHON_CONSTANTS.getOrDefault(word, word));
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }

    private String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
