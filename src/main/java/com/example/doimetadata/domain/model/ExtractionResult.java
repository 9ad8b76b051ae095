package com.example.doimetadata.domain.model;

import java.util.Objects;

/**
 * Pair returned by each extraction stage: the metadata record and the errors collected so far.
 */
public record ExtractionResult(
        MetadataRecord record,
        ExtractionErrors errors
) {
    public ExtractionResult {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(errors, "errors");
    }

    /**
     * @return independent copy of both the record and the error map
     */
    public ExtractionResult copy() {
        return new ExtractionResult(record.copy(), errors.copy());
    }
}
