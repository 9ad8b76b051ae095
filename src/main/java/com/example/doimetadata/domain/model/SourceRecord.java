package com.example.doimetadata.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view over the loosely structured dataset record handed in by the caller.
 * No key is guaranteed to exist and values keep whatever shape the upstream store produced.
 */
public final class SourceRecord {

    private final Map<String, Object> values;

    /**
     * Wraps a copy of the supplied values; {@code null} values are preserved so that
     * "present but empty" stays distinguishable from "absent".
     *
     * @param values raw key/value pairs, may be {@code null}
     */
    public SourceRecord(Map<String, ?> values) {
        this.values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    /**
     * @param key source key
     * @return raw value or {@code null} when absent
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * @param key          source key
     * @param defaultValue value returned when the key is absent
     * @return raw value, the default only when the key is absent (not when it maps to {@code null})
     */
    public Object getOrDefault(String key, Object defaultValue) {
        return values.containsKey(key) ? values.get(key) : defaultValue;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "SourceRecord" + values.keySet();
    }
}
