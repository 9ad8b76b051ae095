package com.example.doimetadata.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Error map built while extracting metadata, keyed by field.
 * Extensions that repair a field are expected to {@link #resolve(MetadataField) resolve} its entry.
 */
public final class ExtractionErrors {

    private final EnumMap<MetadataField, FieldError> errors = new EnumMap<>(MetadataField.class);

    public ExtractionErrors record(FieldError error) {
        errors.put(error.field(), error);
        return this;
    }

    /**
     * Removes the error recorded for a field.
     *
     * @param field field that has been corrected
     * @return the removed error, if any
     */
    public Optional<FieldError> resolve(MetadataField field) {
        return Optional.ofNullable(errors.remove(field));
    }

    public Optional<FieldError> get(MetadataField field) {
        return Optional.ofNullable(errors.get(field));
    }

    public boolean contains(MetadataField field) {
        return errors.containsKey(field);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * @return errors recorded against required fields, in field order
     */
    public Map<MetadataField, FieldError> required() {
        return filter(MetadataField::isRequired);
    }

    /**
     * @return errors recorded against optional fields, in field order
     */
    public Map<MetadataField, FieldError> optional() {
        return filter(field -> !field.isRequired());
    }

    public Map<MetadataField, FieldError> asMap() {
        return Collections.unmodifiableMap(errors);
    }

    public ExtractionErrors copy() {
        ExtractionErrors copy = new ExtractionErrors();
        copy.errors.putAll(errors);
        return copy;
    }

    private Map<MetadataField, FieldError> filter(Predicate<MetadataField> predicate) {
        EnumMap<MetadataField, FieldError> filtered = new EnumMap<>(MetadataField.class);
        errors.forEach((field, error) -> {
            if (predicate.test(field)) {
                filtered.put(field, error);
            }
        });
        return Collections.unmodifiableMap(filtered);
    }

    @Override
    public String toString() {
        return "ExtractionErrors" + errors.keySet();
    }
}
