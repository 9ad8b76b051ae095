package com.example.doimetadata.application.service;

import com.example.doimetadata.domain.model.MetadataField;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.RegistrationDocument;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the DataCite projection of a validated metadata record.
 */
class SchemaProjectorTest {

    private final SchemaProjector projector = new SchemaProjector();

    /**
     * Ensures required keys, types and the schema version are always present and optional defaults are left out.
     */
    @Test
    void projectEmitsRequiredKeysAndSkipsEmptyOptionals() {
        MetadataRecord record = requiredOnly().fillOptionalDefaults();

        RegistrationDocument document = projector.project(record);

        assertThat(document.asMap()).containsOnlyKeys(
                "creators", "titles", "publisher", "publicationYear", "types", "schemaVersion");
        assertThat(document.get("types")).isEqualTo(Map.of("resourceType", "dataset", "resourceTypeGeneral", "Dataset"));
        assertThat(document.get("schemaVersion")).isEqualTo(SchemaProjector.SCHEMA_VERSION);
    }

    /**
     * Ensures the publication year is emitted as a string whatever type the record holds.
     */
    @Test
    void projectStringifiesPublicationYear() {
        MetadataRecord record = requiredOnly().put(MetadataField.PUBLICATION_YEAR, 2024);

        assertThat(projector.project(record).get("publicationYear")).isEqualTo("2024");
    }

    /**
     * Ensures optional values with content are emitted as they are and values without a length are dropped.
     */
    @Test
    void projectEmitsOptionalValuesWithContent() {
        List<Object> formats = new ArrayList<>(List.of("CSV"));
        MetadataRecord record = requiredOnly()
                .put(MetadataField.FORMATS, formats)
                .put(MetadataField.LANGUAGE, "en")
                .put(MetadataField.VERSION, 2);

        RegistrationDocument document = projector.project(record);

        assertThat(document.get("formats")).isSameAs(formats);
        assertThat(document.get("language")).isEqualTo("en");
        assertThat(document.containsKey("version")).isFalse();
    }

    /**
     * Verifies dates are rendered as text on copies, leaving the record untouched.
     */
    @Test
    void projectRendersDatesOnCopies() {
        Map<String, Object> created = new HashMap<>();
        created.put("dateType", "Created");
        created.put("date", LocalDateTime.of(2020, 1, 2, 3, 4, 5));
        Map<String, Object> issued = new HashMap<>();
        issued.put("dateType", "Issued");
        issued.put("date", LocalDate.of(2021, 5, 10));
        Map<String, Object> missing = new HashMap<>();
        missing.put("dateType", "Updated");
        missing.put("date", null);
        MetadataRecord record = requiredOnly().put(MetadataField.DATES, new ArrayList<>(List.of(created, issued, missing)));

        RegistrationDocument document = projector.project(record);

        assertThat(document.get("dates")).isEqualTo(List.of(
                Map.of("dateType", "Created", "date", "2020-01-02T03:04:05"),
                Map.of("dateType", "Issued", "date", "2021-05-10"),
                Map.of("dateType", "Updated", "date", "")));
        assertThat(created.get("date")).isEqualTo(LocalDateTime.of(2020, 1, 2, 3, 4, 5));
    }

    /**
     * Verifies the presence rule used for optional values.
     */
    @Test
    void hasValueChecksLength() {
        assertThat(SchemaProjector.hasValue(null)).isFalse();
        assertThat(SchemaProjector.hasValue("")).isFalse();
        assertThat(SchemaProjector.hasValue(List.of())).isFalse();
        assertThat(SchemaProjector.hasValue(Map.of())).isFalse();
        assertThat(SchemaProjector.hasValue(new String[0])).isFalse();
        assertThat(SchemaProjector.hasValue(5)).isFalse();
        assertThat(SchemaProjector.hasValue("x")).isTrue();
        assertThat(SchemaProjector.hasValue(List.of("x"))).isTrue();
        assertThat(SchemaProjector.hasValue(Map.of("k", "v"))).isTrue();
    }

    /**
     * @return record with every required field populated and optional fields at their defaults
     */
    private MetadataRecord requiredOnly() {
        return new MetadataRecord()
                .put(MetadataField.CREATORS, List.of(Map.of("name", "Ada Lovelace")))
                .put(MetadataField.TITLES, List.of(Map.of("title", "Bird observations")))
                .put(MetadataField.PUBLISHER, "Natural History Museum")
                .put(MetadataField.PUBLICATION_YEAR, "2021")
                .put(MetadataField.RESOURCE_TYPE, "dataset");
    }
}
