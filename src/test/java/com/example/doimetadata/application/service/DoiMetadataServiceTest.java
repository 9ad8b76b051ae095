package com.example.doimetadata.application.service;

import com.example.doimetadata.TestDatasets;
import com.example.doimetadata.application.exception.MetadataExtractionException;
import com.example.doimetadata.application.extension.MetadataExtension;
import com.example.doimetadata.application.extension.MetadataExtensionRegistry;
import com.example.doimetadata.application.port.MetadataSettings;
import com.example.doimetadata.domain.exception.SourceRecordRequiredException;
import com.example.doimetadata.domain.model.ExtractionResult;
import com.example.doimetadata.domain.model.MetadataField;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.RegistrationDocument;
import com.example.doimetadata.domain.model.SourceRecord;
import com.example.doimetadata.infrastructure.literal.LenientLiteralParser;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the pipeline orchestration: required-field enforcement and the extension passes.
 */
class DoiMetadataServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    /**
     * Ensures a missing source record is rejected before any extraction happens.
     */
    @Test
    void buildRequiresSourceRecord() {
        DoiMetadataService service = service(List.of());

        assertThrows(SourceRecordRequiredException.class, () -> service.build(null));
    }

    /**
     * Verifies a complete dataset record turns into a document with every section populated.
     */
    @Test
    void buildProducesDocumentForCompleteRecord() {
        Map<String, Object> dataset = TestDatasets.completeDataset();
        dataset.put("license_id", "cc-by-4.0-international");

        RegistrationDocument document = service(List.of()).build(new SourceRecord(dataset));

        assertThat(document.get("schemaVersion")).isEqualTo("http://datacite.org/schema/kernel-4");
        assertThat(document.get("publicationYear")).isEqualTo("2021");
        assertThat(document.get("types")).isEqualTo(Map.of("resourceType", "dataset", "resourceTypeGeneral", "Dataset"));
        assertThat(document.asMap()).containsKeys("creators", "titles", "publisher", "subjects", "contributors",
                "dates", "language", "alternateIdentifiers", "relatedIdentifiers", "sizes", "formats", "version",
                "rightsList", "descriptions", "geoLocations", "fundingReferences");
    }

    /**
     * Ensures every failed required key is reported in a single exception.
     */
    @Test
    void buildReportsAllRequiredFailuresTogether() {
        Map<String, Object> dataset = TestDatasets.minimalDataset();
        dataset.put("author", "not a literal");
        dataset.remove("title");
        dataset.remove("type");
        DoiMetadataService service = new DoiMetadataService(
                extractor(new Settings(null, "https://data.example.org")),
                new SchemaProjector(),
                MetadataExtensionRegistry.empty());

        MetadataExtractionException ex = assertThrows(MetadataExtractionException.class,
                () -> service.build(new SourceRecord(dataset)));

        assertThat(ex.getMessage()).isEqualTo("Could not extract metadata for the following required keys: "
                + "creators, titles, publisher, resourceType");
        assertThat(ex.getFieldErrors()).containsOnlyKeys(
                MetadataField.CREATORS, MetadataField.TITLES, MetadataField.PUBLISHER, MetadataField.RESOURCE_TYPE);
        assertThat(ex.getFieldErrors().get(MetadataField.TITLES).message())
                .isEqualTo(DoiMetadataService.REQUIRED_NULL_MESSAGE);
    }

    /**
     * Ensures optional failures are tolerated and their fields hold defaults afterwards.
     */
    @Test
    void buildMetadataToleratesOptionalFailures() {
        Map<String, Object> dataset = TestDatasets.minimalDataset();
        dataset.put("funder", "[{'funder_name': 'Wellcome Trust'");

        ExtractionResult result = service(List.of()).buildMetadata(new SourceRecord(dataset));

        assertThat(result.errors().optional()).containsOnlyKeys(MetadataField.FUNDING_REFERENCES);
        assertThat(result.record().get(MetadataField.FUNDING_REFERENCES)).isEqualTo(List.of());
        assertThat(result.record().get(MetadataField.VERSION)).isEqualTo("");
    }

    /**
     * Verifies extensions run in registration order and each sees the previous one's output.
     */
    @Test
    void extensionsRunInOrder() {
        MetadataExtension first = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.VERSION, "2.0");
                return current;
            }

            @Override
            public RegistrationDocument afterProjection(MetadataRecord record, RegistrationDocument document) {
                return document.put("identifier", Map.of("identifier", "10.1234/abc", "identifierType", "DOI"));
            }
        };
        MetadataExtension second = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.VERSION, current.record().get(MetadataField.VERSION) + "-rc");
                return current;
            }

            @Override
            public RegistrationDocument afterProjection(MetadataRecord record, RegistrationDocument document) {
                return document.put("identified", document.containsKey("identifier"));
            }
        };

        RegistrationDocument document = service(List.of(first, second))
                .build(new SourceRecord(TestDatasets.minimalDataset()));

        assertThat(document.get("version")).isEqualTo("2.0-rc");
        assertThat(document.get("identified")).isEqualTo(true);
    }

    /**
     * Ensures an extension can repair a required field when it also resolves the recorded error.
     */
    @Test
    void extensionCanRepairRequiredField() {
        Map<String, Object> dataset = TestDatasets.minimalDataset();
        dataset.put("author", "broken");
        MetadataExtension repair = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.CREATORS, new ArrayList<>(List.of(Map.of("name", "Curator"))));
                current.errors().resolve(MetadataField.CREATORS);
                return current;
            }
        };

        RegistrationDocument document = service(List.of(repair)).build(new SourceRecord(dataset));

        assertThat(document.get("creators")).isEqualTo(List.of(Map.of("name", "Curator")));
    }

    /**
     * Ensures a repaired value alone does not clear an error the extension left in place.
     */
    @Test
    void repairWithoutResolvingStillFails() {
        Map<String, Object> dataset = TestDatasets.minimalDataset();
        dataset.put("author", "broken");
        MetadataExtension repair = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.CREATORS, new ArrayList<>(List.of(Map.of("name", "Curator"))));
                return current;
            }
        };

        MetadataExtractionException ex = assertThrows(MetadataExtractionException.class,
                () -> service(List.of(repair)).build(new SourceRecord(dataset)));

        assertThat(ex.getFieldErrors()).containsOnlyKeys(MetadataField.CREATORS);
    }

    /**
     * Ensures a required field nulled by an extension is caught with a synthesized error.
     */
    @Test
    void extensionNullingRequiredFieldFails() {
        MetadataExtension eraser = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.RESOURCE_TYPE, null);
                return current;
            }
        };

        MetadataExtractionException ex = assertThrows(MetadataExtractionException.class,
                () -> service(List.of(eraser)).build(new SourceRecord(TestDatasets.minimalDataset())));

        assertThat(ex.getFieldErrors().get(MetadataField.RESOURCE_TYPE).message())
                .isEqualTo(DoiMetadataService.REQUIRED_NULL_MESSAGE);
    }

    /**
     * Ensures optional fields nulled by an extension are reset to their defaults.
     */
    @Test
    void extensionNullingOptionalFieldRestoresDefault() {
        MetadataExtension eraser = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                current.record().put(MetadataField.SUBJECTS, null).put(MetadataField.LANGUAGE, null);
                return current;
            }
        };

        ExtractionResult result = service(List.of(eraser)).buildMetadata(new SourceRecord(TestDatasets.minimalDataset()));

        assertThat(result.record().get(MetadataField.SUBJECTS)).isEqualTo(List.of());
        assertThat(result.record().get(MetadataField.LANGUAGE)).isEqualTo("");
    }

    /**
     * Ensures extensions receive a copy and cannot alter the state handed to them once they return something else.
     */
    @Test
    void extensionsWorkOnCopies() {
        List<ExtractionResult> seen = new ArrayList<>();
        MetadataExtension replacing = new MetadataExtension() {
            @Override
            public ExtractionResult afterExtraction(SourceRecord source, ExtractionResult current) {
                seen.add(current);
                ExtractionResult replacement = current.copy();
                current.record().put(MetadataField.VERSION, "discarded");
                return replacement;
            }
        };

        ExtractionResult result = service(List.of(replacing)).buildMetadata(new SourceRecord(TestDatasets.minimalDataset()));

        assertThat(seen).hasSize(1);
        assertThat(result.record().get(MetadataField.VERSION)).isEqualTo("");
    }

    /**
     * Ensures the projection pass runs for a record with nothing optional to emit.
     */
    @Test
    void projectionExtensionsRunForMinimalDocument() {
        MetadataRecord record = new MetadataRecord()
                .put(MetadataField.CREATORS, List.of(Map.of("name", "Ada")))
                .put(MetadataField.TITLES, List.of(Map.of("title", "Minimal")))
                .put(MetadataField.PUBLISHER, "Natural History Museum")
                .put(MetadataField.PUBLICATION_YEAR, "2024")
                .put(MetadataField.RESOURCE_TYPE, "dataset");
        MetadataExtension marker = new MetadataExtension() {
            @Override
            public RegistrationDocument afterProjection(MetadataRecord current, RegistrationDocument document) {
                return document.put("url", "https://data.example.org/dataset/min-1");
            }
        };

        RegistrationDocument document = service(List.of(marker)).buildDocument(record);

        assertThat(document.asMap()).containsOnlyKeys("creators", "titles", "publisher", "publicationYear",
                "types", "schemaVersion", "url");
    }

    private DoiMetadataService service(List<MetadataExtension> extensions) {
        return new DoiMetadataService(
                extractor(new Settings("Natural History Museum", "https://data.example.org")),
                new SchemaProjector(),
                new MetadataExtensionRegistry(extensions));
    }

    private MetadataFieldExtractor extractor(MetadataSettings settings) {
        return new MetadataFieldExtractor(settings, id -> Optional.empty(), () -> "en", new LenientLiteralParser(), CLOCK);
    }

    private record Settings(String publisher, String siteUrl) implements MetadataSettings {
    }
}
