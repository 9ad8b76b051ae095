package com.example.doimetadata.application.extension;

import com.example.doimetadata.domain.model.ExtractionResult;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.RegistrationDocument;
import com.example.doimetadata.domain.model.SourceRecord;

/**
 * Extension point for deployments that need to override or repair individual fields.
 * <p>
 * Implementations are Spring beans, applied in {@link org.springframework.core.annotation.Order @Order}
 * sequence; each one sees the output of the previous one. Both hooks receive copies they may mutate
 * freely and return the state the next stage should see.
 */
public interface MetadataExtension {

    /**
     * Runs after the base field extraction.
     * An implementation that corrects a field must also
     * {@link com.example.doimetadata.domain.model.ExtractionErrors#resolve resolve} its error entry,
     * otherwise the stale error still counts when required fields are judged.
     *
     * @param source  original dataset record
     * @param current record and errors produced so far
     * @return record and errors for the next extension
     */
    default ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
        return current;
    }

    /**
     * Runs after the record has been projected into the registration document.
     *
     * @param record   validated metadata record
     * @param document document produced so far
     * @return document for the next extension
     */
    default RegistrationDocument afterProjection(MetadataRecord record, RegistrationDocument document) {
        return document;
    }
}
