package com.example.doimetadata.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Domain enumeration of every key the internal metadata record may hold.
 * Each key belongs to exactly one {@link Partition}; required keys must resolve to a non-null value,
 * optional keys fall back to their default when they cannot be derived.
 */
public enum MetadataField {
    CREATORS("creators", Partition.REQUIRED, ArrayList::new),
    TITLES("titles", Partition.REQUIRED, ArrayList::new),
    PUBLISHER("publisher", Partition.REQUIRED, () -> null),
    PUBLICATION_YEAR("publicationYear", Partition.REQUIRED, () -> null),
    RESOURCE_TYPE("resourceType", Partition.REQUIRED, () -> null),

    SUBJECTS("subjects", Partition.OPTIONAL, ArrayList::new),
    CONTRIBUTORS("contributors", Partition.OPTIONAL, ArrayList::new),
    DATES("dates", Partition.OPTIONAL, ArrayList::new),
    LANGUAGE("language", Partition.OPTIONAL, () -> ""),
    ALTERNATE_IDENTIFIERS("alternateIdentifiers", Partition.OPTIONAL, ArrayList::new),
    RELATED_IDENTIFIERS("relatedIdentifiers", Partition.OPTIONAL, ArrayList::new),
    SIZES("sizes", Partition.OPTIONAL, ArrayList::new),
    FORMATS("formats", Partition.OPTIONAL, ArrayList::new),
    VERSION("version", Partition.OPTIONAL, () -> ""),
    RIGHTS_LIST("rightsList", Partition.OPTIONAL, ArrayList::new),
    DESCRIPTIONS("descriptions", Partition.OPTIONAL, ArrayList::new),
    GEO_LOCATIONS("geoLocations", Partition.OPTIONAL, ArrayList::new),
    FUNDING_REFERENCES("fundingReferences", Partition.OPTIONAL, ArrayList::new);

    /**
     * Whether a missing value aborts the pipeline or silently falls back to the default.
     */
    public enum Partition {
        REQUIRED,
        OPTIONAL
    }

    private final String key;
    private final Partition partition;
    private final Supplier<Object> defaultValue;

    MetadataField(String key, Partition partition, Supplier<Object> defaultValue) {
        this.key = key;
        this.partition = partition;
        this.defaultValue = defaultValue;
    }

    /**
     * @return key used in the metadata record and the registration document
     */
    public String key() {
        return key;
    }

    public boolean isRequired() {
        return partition == Partition.REQUIRED;
    }

    /**
     * Creates a fresh default value; mutable collections are never shared between records.
     *
     * @return new default value, possibly {@code null} for required scalar keys
     */
    public Object newDefault() {
        return defaultValue.get();
    }

    /**
     * @return required keys in declaration order
     */
    public static List<MetadataField> required() {
        return inPartition(Partition.REQUIRED);
    }

    /**
     * @return optional keys in declaration order
     */
    public static List<MetadataField> optional() {
        return inPartition(Partition.OPTIONAL);
    }

    private static List<MetadataField> inPartition(Partition partition) {
        return Arrays.stream(values())
                .filter(field -> field.partition == partition)
                .toList();
    }
}
