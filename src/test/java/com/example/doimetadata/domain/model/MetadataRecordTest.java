package com.example.doimetadata.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the internal metadata record and its field partition.
 */
class MetadataRecordTest {

    /**
     * Ensures every key belongs to exactly one partition.
     */
    @Test
    void fieldsArePartitioned() {
        assertThat(MetadataField.required()).containsExactly(MetadataField.CREATORS, MetadataField.TITLES,
                MetadataField.PUBLISHER, MetadataField.PUBLICATION_YEAR, MetadataField.RESOURCE_TYPE);
        assertThat(MetadataField.optional()).hasSize(13).doesNotContainAnyElementsOf(MetadataField.required());
    }

    /**
     * Verifies a new record holds every field at its default, with fresh collections per record.
     */
    @Test
    void newRecordHoldsDefaults() {
        MetadataRecord first = new MetadataRecord();
        MetadataRecord second = new MetadataRecord();

        assertThat(first.asMap()).hasSize(MetadataField.values().length);
        assertThat(first.get(MetadataField.PUBLISHER)).isNull();
        assertThat(first.get(MetadataField.LANGUAGE)).isEqualTo("");
        assertThat(first.get(MetadataField.SUBJECTS)).isEqualTo(List.of()).isNotSameAs(second.get(MetadataField.SUBJECTS));
    }

    /**
     * Ensures only null optional values are reset; required nulls are left for validation.
     */
    @Test
    void fillOptionalDefaultsResetsNullOptionals() {
        MetadataRecord record = new MetadataRecord()
                .put(MetadataField.VERSION, null)
                .put(MetadataField.FORMATS, List.of("CSV"))
                .put(MetadataField.TITLES, null);

        record.fillOptionalDefaults();

        assertThat(record.get(MetadataField.VERSION)).isEqualTo("");
        assertThat(record.get(MetadataField.FORMATS)).isEqualTo(List.of("CSV"));
        assertThat(record.get(MetadataField.TITLES)).isNull();
    }

    /**
     * Ensures a copy shares no mutable structure with the original.
     */
    @Test
    void copyIsIndependent() {
        List<Object> subjects = new ArrayList<>(List.of(Map.of("subject", "birds")));
        MetadataRecord original = new MetadataRecord().put(MetadataField.SUBJECTS, subjects);

        MetadataRecord copy = original.copy();
        ((List<?>) copy.get(MetadataField.SUBJECTS)).clear();

        assertThat(original.get(MetadataField.SUBJECTS)).isEqualTo(List.of(Map.of("subject", "birds")));
        assertThat(copy.get(MetadataField.SUBJECTS)).isEqualTo(List.of());
    }
}
