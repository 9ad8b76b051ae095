package com.example.doimetadata.application.service;

import com.example.doimetadata.application.port.LanguageResolver;
import com.example.doimetadata.application.port.LicenseRegistry;
import com.example.doimetadata.application.port.MetadataSettings;
import com.example.doimetadata.domain.model.ExtractionErrors;
import com.example.doimetadata.domain.model.ExtractionResult;
import com.example.doimetadata.domain.model.FieldError;
import com.example.doimetadata.domain.model.LicenseEntry;
import com.example.doimetadata.domain.model.LiteralListResult;
import com.example.doimetadata.domain.model.MetadataField;
import com.example.doimetadata.domain.model.MetadataRecord;
import com.example.doimetadata.domain.model.SourceRecord;
import com.example.doimetadata.infrastructure.literal.LenientLiteralParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import static com.example.doimetadata.domain.model.MetadataField.ALTERNATE_IDENTIFIERS;
import static com.example.doimetadata.domain.model.MetadataField.CONTRIBUTORS;
import static com.example.doimetadata.domain.model.MetadataField.CREATORS;
import static com.example.doimetadata.domain.model.MetadataField.DATES;
import static com.example.doimetadata.domain.model.MetadataField.DESCRIPTIONS;
import static com.example.doimetadata.domain.model.MetadataField.FORMATS;
import static com.example.doimetadata.domain.model.MetadataField.FUNDING_REFERENCES;
import static com.example.doimetadata.domain.model.MetadataField.GEO_LOCATIONS;
import static com.example.doimetadata.domain.model.MetadataField.LANGUAGE;
import static com.example.doimetadata.domain.model.MetadataField.PUBLICATION_YEAR;
import static com.example.doimetadata.domain.model.MetadataField.PUBLISHER;
import static com.example.doimetadata.domain.model.MetadataField.RELATED_IDENTIFIERS;
import static com.example.doimetadata.domain.model.MetadataField.RESOURCE_TYPE;
import static com.example.doimetadata.domain.model.MetadataField.RIGHTS_LIST;
import static com.example.doimetadata.domain.model.MetadataField.SIZES;
import static com.example.doimetadata.domain.model.MetadataField.SUBJECTS;
import static com.example.doimetadata.domain.model.MetadataField.TITLES;
import static com.example.doimetadata.domain.model.MetadataField.VERSION;

/**
 * Application-layer service that derives the internal metadata record from a dataset record.
 * <p>
 * Every field is derived in isolation: a failure is captured as a {@link FieldError} under that
 * field's key and the field keeps its default value, so one malformed input never hides the others.
 * Extension passes and required-field enforcement are left to {@link DoiMetadataService}.
 */
@Service
public class MetadataFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataFieldExtractor.class);

    static final String CC_BY_4_INTERNATIONAL = "cc-by-4.0-international";
    static final String CONTACT_PERSON = "ContactPerson";
    private static final Set<String> UNSUPPORTED_FUNDER_ID_TYPES = Set.of("Wikidata", "");

    private final MetadataSettings settings;
    private final LicenseRegistry licenseRegistry;
    private final LanguageResolver languageResolver;
    private final LenientLiteralParser literalParser;
    private final Clock clock;

    /**
     * Creates the extractor with its read-only collaborators.
     *
     * @param settings         publisher and site URL
     * @param licenseRegistry  license lookup used for the rights list
     * @param languageResolver language of the calling context
     * @param literalParser    reader for stringified list fields
     * @param clock            clock used for the publication year fallback
     */
    public MetadataFieldExtractor(MetadataSettings settings,
                                  LicenseRegistry licenseRegistry,
                                  LanguageResolver languageResolver,
                                  LenientLiteralParser literalParser,
                                  Clock clock) {
        this.settings = settings;
        this.licenseRegistry = licenseRegistry;
        this.languageResolver = languageResolver;
        this.literalParser = literalParser;
        this.clock = clock;
    }

    /**
     * Derives every field of the metadata record. Never throws for individual field failures.
     *
     * @param source dataset record
     * @return record with defaults for failed fields, plus the errors captured along the way
     */
    public ExtractionResult extract(SourceRecord source) {
        MetadataRecord record = new MetadataRecord();
        ExtractionErrors errors = new ExtractionErrors();
        FieldCollector collector = new FieldCollector(record, errors);

        // required
        collector.derive(CREATORS, () -> people(source, CREATORS));
        collector.derive(TITLES, () -> titles(source));
        collector.derive(PUBLISHER, this::publisher);
        collector.derive(PUBLICATION_YEAR, () -> publicationYear(source));
        collector.derive(RESOURCE_TYPE, () -> source.get("type"));

        // optional
        collector.derive(SUBJECTS, () -> subjects(source));
        collector.derive(CONTRIBUTORS, () -> people(source, CONTRIBUTORS));
        extractDates(source, record, errors);
        collector.derive(LANGUAGE, languageResolver::currentLanguage);
        collector.derive(ALTERNATE_IDENTIFIERS, () -> alternateIdentifiers(source));
        // absent, null or empty literals leave the default without recording an error
        if (hasLiteral(source.get("related_resource"))) {
            collector.derive(RELATED_IDENTIFIERS, () -> relatedIdentifiers(source));
        }
        collector.derive(SIZES, () -> sizes(source));
        collector.derive(FORMATS, () -> formats(source));
        record.put(VERSION, source.get("version"));
        collector.derive(RIGHTS_LIST, () -> rightsList(source));
        record.put(DESCRIPTIONS, descriptions(source));
        Object locationChoice = source.get("location_choice");
        if ("point".equals(locationChoice)) {
            collector.derive(GEO_LOCATIONS, () -> geoPoints(source));
        } else if ("area".equals(locationChoice)) {
            collector.derive(GEO_LOCATIONS, () -> geoBoxes(source));
        }
        // same rule as related_resource
        if (hasLiteral(source.get("funder"))) {
            collector.derive(FUNDING_REFERENCES, () -> fundingReferences(source));
        }

        log.debug("Extracted metadata from {} with {} field error(s)", source, errors.asMap().size());
        return new ExtractionResult(record, errors);
    }

    /**
     * Builds creator or contributor entries from the stringified {@code author} list.
     * Contributors carry the fixed {@value #CONTACT_PERSON} role.
     */
    private List<Object> people(SourceRecord source, MetadataField field) {
        List<Object> people = new ArrayList<>();
        int index = 0;
        for (Map<String, Object> author : parsedList(source.get("author"))) {
            String context = "author entry " + index++;
            Map<String, Object> affiliation = entry(
                    "name", require(author, "author_affiliation", context),
                    "affiliationIdentifier", require(author, "author_affiliation_identifier", context),
                    "affiliationIdentifierScheme", require(author, "author_affiliation_identifier_type", context));
            Map<String, Object> nameIdentifier = entry(
                    "nameIdentifier", require(author, "author_identifier", context),
                    "nameIdentifierScheme", require(author, "author_identifier_type", context));

            Map<String, Object> person = new LinkedHashMap<>();
            person.put("name", require(author, "author_name", context));
            if (field == CONTRIBUTORS) {
                person.put("contributorType", CONTACT_PERSON);
            }
            person.put("nameType", require(author, "author_name_type", context));
            person.put("affiliation", listOf(affiliation));
            person.put("nameIdentifiers", listOf(nameIdentifier));
            people.add(person);
        }
        return people;
    }

    /**
     * A missing title yields {@code null} so the required-field check reports it.
     */
    private List<Object> titles(SourceRecord source) {
        Object title = source.get("title");
        return title == null ? null : listOf(entry("title", title));
    }

    private String publisher() {
        String publisher = settings.publisher();
        if (publisher == null) {
            throw new IllegalStateException("Publisher is not configured (doi.publisher)");
        }
        return publisher;
    }

    /**
     * Uses the first four characters of {@code doi_date_published} when they are all digits,
     * the current year otherwise.
     */
    private String publicationYear(SourceRecord source) {
        Object published = source.get("doi_date_published");
        if (published != null) {
            String text = published.toString();
            if (text.length() >= 4 && text.substring(0, 4).chars().allMatch(Character::isDigit)) {
                return text.substring(0, 4);
            }
        }
        return String.valueOf(Year.now(clock).getValue());
    }

    private List<Object> subjects(SourceRecord source) {
        Set<String> tags = new TreeSet<>();
        Object tagString = source.get("tag_string");
        if (tagString != null) {
            if (!(tagString instanceof String text)) {
                throw new IllegalArgumentException("tag_string must be text but was " + typeOf(tagString));
            }
            for (String tag : text.split(",")) {
                tags.add(tag.trim());
            }
        }
        for (Object tag : listValue(source.get("tags"), "tags")) {
            if (tag instanceof String name) {
                tags.add(name);
            } else if (tag instanceof Map<?, ?> map && map.get("name") instanceof String name) {
                tags.add(name);
            } else {
                throw new IllegalArgumentException("Tag must be a string or a mapping with a name: " + tag);
            }
        }
        tags.remove("");
        List<Object> subjects = new ArrayList<>();
        tags.forEach(tag -> subjects.add(entry("subject", tag)));
        return subjects;
    }

    /**
     * Created, Updated and (when the key exists at all) Issued dates. Each date fails on its own;
     * the dates that could be read are kept and the failures are reported together.
     */
    private void extractDates(SourceRecord source, MetadataRecord record, ExtractionErrors errors) {
        List<Object> dates = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        RuntimeException firstFailure = null;

        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("Created", "metadata_created");
        sources.put("Updated", "metadata_modified");
        if (source.containsKey("doi_date_published")) {
            sources.put("Issued", "doi_date_published");
        }
        for (Map.Entry<String, String> dateSource : sources.entrySet()) {
            try {
                dates.add(entry(
                        "dateType", dateSource.getKey(),
                        "date", DateValues.dateOrNull(source.get(dateSource.getValue()))));
            } catch (RuntimeException ex) {
                failures.add(dateSource.getKey() + " (" + dateSource.getValue() + "): " + ex.getMessage());
                if (firstFailure == null) {
                    firstFailure = ex;
                }
            }
        }
        record.put(DATES, dates);
        if (!failures.isEmpty()) {
            errors.record(new FieldError(DATES, "Could not read date(s): " + String.join("; ", failures), firstFailure));
        }
    }

    private List<Object> alternateIdentifiers(SourceRecord source) {
        String siteUrl = settings.siteUrl();
        if (siteUrl == null) {
            throw new IllegalStateException("Site URL is not configured (doi.site-url)");
        }
        Object id = source.get("id");
        if (id == null) {
            throw new IllegalArgumentException("Dataset id is missing");
        }
        return listOf(entry(
                "alternateIdentifierType", "URL",
                "alternateIdentifier", siteUrl + "/dataset/" + id));
    }

    private List<Object> relatedIdentifiers(SourceRecord source) {
        List<Object> related = new ArrayList<>();
        int index = 0;
        for (Map<String, Object> resource : parsedList(source.get("related_resource"))) {
            String context = "related_resource entry " + index++;
            related.add(entry(
                    "relatedIdentifier", require(resource, "related_resource_url", context),
                    "relatedIdentifierType", "URL",
                    "relationType", require(resource, "relation_type", context)));
        }
        return related;
    }

    /**
     * Total resource size in kilobytes; missing, {@code null} and empty sizes count as zero.
     */
    private List<Object> sizes(SourceRecord source) {
        long totalBytes = 0;
        for (Map<?, ?> resource : resources(source)) {
            totalBytes += byteCount(resource.get("size"));
        }
        return listOf(totalBytes / 1024 + " kb");
    }

    private List<Object> formats(SourceRecord source) {
        Set<Object> formats = new LinkedHashSet<>();
        for (Map<?, ?> resource : resources(source)) {
            Object format = resource.get("format");
            if (format != null && !"".equals(format)) {
                formats.add(format);
            }
        }
        return new ArrayList<>(formats);
    }

    /**
     * Rights precedence: the CC-BY-4.0 international literal maps to its SPDX entry, any other
     * identifier is looked up in the registry (unknown ones yield nothing), an empty identifier is
     * passed through under a generic {@code rights} key.
     */
    private List<Object> rightsList(SourceRecord source) {
        Object licenseId = source.get("license_id");
        if (licenseId == null) {
            licenseId = source.getOrDefault("license", "");
        }
        if (CC_BY_4_INTERNATIONAL.equals(licenseId)) {
            return listOf(entry(
                    "rightsUri", "https://spdx.org/licenses/CC-BY-4.0.html",
                    "rightsIdentifier", "CC-BY-4.0",
                    "rightsIdentifierScheme", "SPDX"));
        }
        if (licenseId != null && !"".equals(licenseId)) {
            Optional<LicenseEntry> license = licenseRegistry.findById(licenseId.toString());
            List<Object> rights = new ArrayList<>();
            license.ifPresent(found -> rights.add(entry(
                    "rightsUri", found.url(),
                    "rightsIdentifier", found.id())));
            return rights;
        }
        return listOf(entry("rights", licenseId));
    }

    private List<Object> descriptions(SourceRecord source) {
        Object notes = source.get("notes");
        return listOf(entry(
                "descriptionType", "Other",
                "description", notes == null ? "" : notes));
    }

    private List<Object> geoPoints(SourceRecord source) {
        List<Object> points = new ArrayList<>();
        for (Map<?, ?> geometry : geometries(source, "Point")) {
            List<?> coordinates = listValue(geometry.get("coordinates"), "coordinates");
            points.add(entry("geoLocationPoint", entry(
                    "pointLongitude", coordinate(coordinates.get(0)),
                    "pointLatitude", coordinate(coordinates.get(1)))));
        }
        return points;
    }

    /**
     * Bounding box from the first ring of each polygon: west/south from point 0,
     * east from point 2, north from point 1.
     */
    private List<Object> geoBoxes(SourceRecord source) {
        List<Object> boxes = new ArrayList<>();
        for (Map<?, ?> geometry : geometries(source, "Polygon")) {
            List<?> ring = listValue(listValue(geometry.get("coordinates"), "coordinates").get(0), "ring");
            List<?> first = listValue(ring.get(0), "point");
            List<?> second = listValue(ring.get(1), "point");
            List<?> third = listValue(ring.get(2), "point");
            boxes.add(entry("geoLocationBox", entry(
                    "westBoundLongitude", coordinate(first.get(0)),
                    "eastBoundLongitude", coordinate(third.get(0)),
                    "southBoundLatitude", coordinate(first.get(1)),
                    "northBoundLatitude", coordinate(second.get(1)))));
        }
        return boxes;
    }

    private List<Object> fundingReferences(SourceRecord source) {
        List<Object> funding = new ArrayList<>();
        int index = 0;
        for (Map<String, Object> funder : parsedList(source.get("funder"))) {
            String context = "funder entry " + index++;
            Object idType = require(funder, "funder_identifier_type", context);
            funding.add(entry(
                    "funderName", require(funder, "funder_name", context),
                    "funderIdentifier", require(funder, "funder_identifier", context),
                    "funderIdentifierType", normalizeFunderIdType(idType)));
        }
        return funding;
    }

    /**
     * Kernel 4.3 does not accept {@code Wikidata} as a funder identifier type.
     *
     * @param idType raw identifier type
     * @return {@code Other} for unsupported or empty types, the raw value otherwise
     */
    static Object normalizeFunderIdType(Object idType) {
        return idType instanceof String text && UNSUPPORTED_FUNDER_ID_TYPES.contains(text) ? "Other" : idType;
    }

    private List<Map<String, Object>> parsedList(Object raw) {
        LiteralListResult result = literalParser.parseList(raw);
        if (!result.isParsed()) {
            throw new IllegalArgumentException(result.failure(), result.cause());
        }
        return result.entries();
    }

    private List<Map<?, ?>> resources(SourceRecord source) {
        List<Map<?, ?>> resources = new ArrayList<>();
        for (Object resource : listValue(source.get("resources"), "resources")) {
            if (!(resource instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Resource must be a mapping but was " + typeOf(resource));
            }
            resources.add(map);
        }
        return resources;
    }

    private List<Map<?, ?>> geometries(SourceRecord source, String geometryType) {
        Map<String, Object> locationData = literalParser.parseMapping(source.get("location_data"));
        List<Map<?, ?>> geometries = new ArrayList<>();
        for (Object feature : listValue(locationData.get("features"), "features")) {
            if (!(feature instanceof Map<?, ?> featureMap)
                    || !(featureMap.get("geometry") instanceof Map<?, ?> geometry)) {
                throw new IllegalArgumentException("Feature has no geometry mapping: " + feature);
            }
            if (geometryType.equals(geometry.get("type"))) {
                geometries.add(geometry);
            }
        }
        return geometries;
    }

    private long byteCount(Object size) {
        if (size == null || "".equals(size)) {
            return 0;
        }
        if (size instanceof Number number) {
            return number.longValue();
        }
        if (size instanceof String text) {
            return Long.parseLong(text.trim());
        }
        throw new IllegalArgumentException("Resource size must be numeric but was " + typeOf(size));
    }

    private String coordinate(Object value) {
        if (value instanceof Number number) {
            return plainDecimal(number.doubleValue());
        }
        if (value instanceof String text) {
            return plainDecimal(Double.parseDouble(text.trim()));
        }
        throw new IllegalArgumentException("Coordinate must be numeric but was " + typeOf(value));
    }

    /**
     * Decimal notation without an exponent; whole numbers keep a trailing {@code .0}.
     */
    static String plainDecimal(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static Object require(Map<String, Object> entry, String key, String context) {
        if (!entry.containsKey(key)) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + context);
        }
        return entry.get(key);
    }

    private static List<?> listValue(Object value, String name) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(name + " must be a list but was " + typeOf(value));
        }
        return list;
    }

    /**
     * Stringified list fields are skipped entirely when absent or empty.
     */
    private static boolean hasLiteral(Object raw) {
        return raw != null && !"".equals(raw);
    }

    private static Map<String, Object> entry(Object... keyValues) {
        Map<String, Object> entry = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            entry.put((String) keyValues[i], keyValues[i + 1]);
        }
        return entry;
    }

    private static List<Object> listOf(Object value) {
        List<Object> list = new ArrayList<>(1);
        list.add(value);
        return list;
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Runs one field derivation and turns any failure into a {@link FieldError}.
     */
    private static final class FieldCollector {
        private final MetadataRecord record;
        private final ExtractionErrors errors;

        FieldCollector(MetadataRecord record, ExtractionErrors errors) {
            this.record = record;
            this.errors = errors;
        }

        void derive(MetadataField field, Supplier<?> derivation) {
            try {
                record.put(field, derivation.get());
            } catch (RuntimeException ex) {
                errors.record(FieldError.of(field, ex));
            }
        }
    }
}
