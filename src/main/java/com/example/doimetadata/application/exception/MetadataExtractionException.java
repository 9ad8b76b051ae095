package com.example.doimetadata.application.exception;

import com.example.doimetadata.domain.model.FieldError;
import com.example.doimetadata.domain.model.MetadataField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Raised when one or more required metadata fields could not be derived.
 * Every failed key is reported together; the individual causes are attached as suppressed
 * exceptions and exposed through {@link #getFieldErrors()}.
 */
public class MetadataExtractionException extends ApplicationException {

    private final Map<MetadataField, FieldError> fieldErrors;

    /**
     * Creates the exception from the errors recorded against required fields.
     *
     * @param fieldErrors required-field errors, in field order
     */
    public MetadataExtractionException(Map<MetadataField, FieldError> fieldErrors) {
        super("Could not extract metadata for the following required keys: " + joinKeys(fieldErrors));
        EnumMap<MetadataField, FieldError> copy = new EnumMap<>(MetadataField.class);
        copy.putAll(fieldErrors);
        this.fieldErrors = Collections.unmodifiableMap(copy);
        fieldErrors.values().stream()
                .map(FieldError::cause)
                .filter(Objects::nonNull)
                .forEach(this::addSuppressed);
    }

    /**
     * @return failed required fields and what went wrong for each
     */
    public Map<MetadataField, FieldError> getFieldErrors() {
        return fieldErrors;
    }

    private static String joinKeys(Map<MetadataField, FieldError> fieldErrors) {
        return fieldErrors.keySet().stream()
                .map(MetadataField::key)
                .collect(Collectors.joining(", "));
    }
}
