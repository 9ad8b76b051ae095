package com.example.doimetadata.interfaces.api;

import com.example.doimetadata.domain.model.ExtractionResult;
import com.example.doimetadata.domain.model.FieldError;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API-layer DTO exposing the validated metadata record and the optional fields that could not be derived.
 */
public record MetadataPreviewResponse(
        Map<String, Object> metadata,
        Map<String, String> optionalErrors
) {
    /**
     * @param result validated extraction result
     * @return response with errors keyed by field name
     */
    public static MetadataPreviewResponse from(ExtractionResult result) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : result.errors().optional().values()) {
            errors.put(error.field().key(), error.message());
        }
        return new MetadataPreviewResponse(result.record().asMap(), errors);
    }
}
