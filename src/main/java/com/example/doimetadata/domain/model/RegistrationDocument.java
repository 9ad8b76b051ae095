package com.example.doimetadata.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document shaped for the DataCite kernel-4 schema, ready to be handed to a serializer.
 * Keys appear in insertion order; optional keys are only present when they carry a value.
 */
public final class RegistrationDocument {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public Object get(String key) {
        return values.get(key);
    }

    public RegistrationDocument put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public RegistrationDocument remove(String key) {
        values.remove(key);
        return this;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public RegistrationDocument copy() {
        RegistrationDocument copy = new RegistrationDocument();
        values.forEach((key, value) -> copy.values.put(key, MetadataRecord.deepCopy(value)));
        return copy;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "RegistrationDocument" + values;
    }
}
