package com.example.doimetadata.application.service;

import com.example.doimetadata.application.exception.MetadataExtractionException;
import com.example.doimetadata.application.extension.MetadataExtension;
import com.example.doimetadata.application.extension.MetadataExtensionRegistry;
import com.example.doimetadata.domain.exception.SourceRecordRequiredException;
import com.example.doimetadata.domain.model.ExtractionErrors;
import com.example.doimetadata.domain.model.ExtractionResult;
import com.example.doimetadata.domain.model.FieldError;
import com.example.doimetadata.domain.model.MetadataField;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.RegistrationDocument;
import com.example.doimetadata.domain.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Application-layer service that orchestrates the DOI metadata pipeline.
 * <p>
 * Source record → field extraction → extension pass → required-field check → projection →
 * extension pass → registration document. Each call is self-contained; the only shared state is
 * the read-only configuration and the extension list fixed at start-up.
 */
@Service
public class DoiMetadataService {

    private static final Logger log = LoggerFactory.getLogger(DoiMetadataService.class);
    static final String REQUIRED_NULL_MESSAGE = "Required field cannot be null";

    private final MetadataFieldExtractor extractor;
    private final SchemaProjector projector;
    private final MetadataExtensionRegistry extensionRegistry;

    /**
     * Creates the service with its pipeline stages.
     *
     * @param extractor         base field extractor
     * @param projector         projection into the registration document
     * @param extensionRegistry ordered extensions applied after each stage
     */
    public DoiMetadataService(MetadataFieldExtractor extractor,
                              SchemaProjector projector,
                              MetadataExtensionRegistry extensionRegistry) {
        this.extractor = extractor;
        this.projector = projector;
        this.extensionRegistry = extensionRegistry;
    }

    /**
     * Runs the full pipeline.
     *
     * @param source dataset record
     * @return registration document
     * @throws SourceRecordRequiredException when {@code source} is null
     * @throws MetadataExtractionException   when any required field could not be derived
     */
    public RegistrationDocument build(SourceRecord source) {
        return buildDocument(buildMetadata(source).record());
    }

    /**
     * Extracts the metadata record, lets every extension revise it and enforces the required fields.
     *
     * @param source dataset record
     * @return validated record and the optional-field errors that were tolerated
     * @throws SourceRecordRequiredException when {@code source} is null
     * @throws MetadataExtractionException   when any required field has an error, listing all of them
     */
    public ExtractionResult buildMetadata(SourceRecord source) {
        if (source == null) {
            throw new SourceRecordRequiredException();
        }
        ExtractionResult current = extractor.extract(source);
        for (MetadataExtension extension : extensionRegistry.extensions()) {
            log.debug("Applying {} after extraction", extension.getClass().getSimpleName());
            current = Objects.requireNonNull(extension.afterExtraction(source, current.copy()),
                    () -> extension.getClass().getName() + " returned no extraction result");
        }

        MetadataRecord record = current.record();
        ExtractionErrors errors = current.errors();
        for (MetadataField field : MetadataField.required()) {
            if (record.get(field) == null && !errors.contains(field)) {
                errors.record(FieldError.of(field, REQUIRED_NULL_MESSAGE));
            }
        }

        Map<MetadataField, FieldError> requiredErrors = errors.required();
        if (!requiredErrors.isEmpty()) {
            MetadataExtractionException failure = new MetadataExtractionException(requiredErrors);
            log.error(failure.getMessage());
            requiredErrors.forEach((field, error) -> log.error("{}: {}", field.key(), error.message(), error.cause()));
            throw failure;
        }

        Map<MetadataField, FieldError> optionalErrors = errors.optional();
        if (!optionalErrors.isEmpty()) {
            log.debug("Could not extract metadata for the following optional keys: {}", keys(optionalErrors));
            optionalErrors.forEach((field, error) -> log.debug("{}: {}", field.key(), error.message(), error.cause()));
        }

        record.fillOptionalDefaults();
        return new ExtractionResult(record, errors);
    }

    /**
     * Projects a validated record and lets every extension revise the document.
     * The extension pass runs even when no optional field was emitted.
     *
     * @param record validated metadata record
     * @return registration document
     */
    public RegistrationDocument buildDocument(MetadataRecord record) {
        RegistrationDocument document = projector.project(record);
        for (MetadataExtension extension : extensionRegistry.extensions()) {
            log.debug("Applying {} after projection", extension.getClass().getSimpleName());
            document = Objects.requireNonNull(extension.afterProjection(record, document.copy()),
                    () -> extension.getClass().getName() + " returned no document");
        }
        return document;
    }

    private static String keys(Map<MetadataField, FieldError> errors) {
        return errors.keySet().stream().map(MetadataField::key).collect(Collectors.joining(", "));
    }
}
