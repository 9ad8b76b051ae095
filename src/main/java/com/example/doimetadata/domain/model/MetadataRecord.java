package com.example.doimetadata.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Internal metadata record produced by the field extractor.
 * Always holds every {@link MetadataField}; values start at the field default and are overwritten
 * as derivations succeed. Instances are mutable and live for a single pipeline invocation.
 */
public final class MetadataRecord {

    private final EnumMap<MetadataField, Object> values = new EnumMap<>(MetadataField.class);

    /**
     * Creates a record with every field set to its default value.
     */
    public MetadataRecord() {
        for (MetadataField field : MetadataField.values()) {
            values.put(field, field.newDefault());
        }
    }

    private MetadataRecord(EnumMap<MetadataField, Object> source) {
        values.putAll(source);
    }

    public Object get(MetadataField field) {
        return values.get(field);
    }

    public MetadataRecord put(MetadataField field, Object value) {
        values.put(field, value);
        return this;
    }

    /**
     * Resets every optional field whose value is {@code null} back to its default.
     *
     * @return this record
     */
    public MetadataRecord fillOptionalDefaults() {
        for (MetadataField field : MetadataField.optional()) {
            if (values.get(field) == null) {
                values.put(field, field.newDefault());
            }
        }
        return this;
    }

    /**
     * Copies the record so an extension can rewrite it without touching the previous state.
     * Collections and maps are copied recursively; leaf values are shared.
     *
     * @return independent copy
     */
    public MetadataRecord copy() {
        EnumMap<MetadataField, Object> copied = new EnumMap<>(MetadataField.class);
        values.forEach((field, value) -> copied.put(field, deepCopy(value)));
        return new MetadataRecord(copied);
    }

    /**
     * @return ordered map keyed by the wire names of the fields
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((field, value) -> map.put(field.key(), value));
        return map;
    }

    static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, deepCopy(nested)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(nested -> copy.add(deepCopy(nested)));
            return copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return "MetadataRecord" + asMap();
    }
}
