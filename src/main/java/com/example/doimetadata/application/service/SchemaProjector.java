package com.example.doimetadata.application.service;

import com.example.doimetadata.domain.model.MetadataField;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.RegistrationDocument;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects a validated metadata record into the DataCite kernel-4 document shape.
 * Required keys are always emitted; optional keys only when {@link #hasValue(Object) they carry a value}.
 */
@Component
public class SchemaProjector {

    static final String SCHEMA_VERSION = "http://datacite.org/schema/kernel-4";
    static final String RESOURCE_TYPE_GENERAL = "Dataset";

    /**
     * @param record validated metadata record
     * @return registration document; {@code dates} entries are copied with string dates,
     *         every other optional value is shared with the record
     */
    public RegistrationDocument project(MetadataRecord record) {
        RegistrationDocument document = new RegistrationDocument()
                .put("creators", record.get(MetadataField.CREATORS))
                .put("titles", record.get(MetadataField.TITLES))
                .put("publisher", record.get(MetadataField.PUBLISHER))
                .put("publicationYear", String.valueOf(record.get(MetadataField.PUBLICATION_YEAR)));

        Map<String, Object> types = new LinkedHashMap<>();
        types.put("resourceType", record.get(MetadataField.RESOURCE_TYPE));
        types.put("resourceTypeGeneral", RESOURCE_TYPE_GENERAL);
        document.put("types", types)
                .put("schemaVersion", SCHEMA_VERSION);

        for (MetadataField field : MetadataField.optional()) {
            Object value = record.get(field);
            if (!hasValue(value)) {
                continue;
            }
            document.put(field.key(), field == MetadataField.DATES && value instanceof Collection<?> dates
                    ? stringifyDates(dates)
                    : value);
        }
        return document;
    }

    /**
     * A value is present when it is non-null and has a non-zero length; values without a length
     * (numbers, booleans, arbitrary objects) count as absent.
     *
     * @param value record value
     * @return {@code true} when the value should be emitted
     */
    static boolean hasValue(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return false;
    }

    private List<Object> stringifyDates(Collection<?> dates) {
        List<Object> copies = new ArrayList<>(dates.size());
        for (Object date : dates) {
            if (date instanceof Map<?, ?> entry) {
                Map<Object, Object> copy = new LinkedHashMap<>(entry);
                copy.put("date", DateValues.format(entry.get("date")));
                copies.add(copy);
            } else {
                copies.add(date);
            }
        }
        return copies;
    }
}
