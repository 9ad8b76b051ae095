package com.example.doimetadata.infrastructure.license;

import com.example.doimetadata.application.port.LicenseRegistry;
import com.example.doimetadata.domain.model.LicenseEntry;
import com.example.doimetadata.infrastructure.config.DoiProperties;
import com.example.doimetadata.infrastructure.exception.LicenseRegistryException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * License registry backed by a JSON array of license descriptors ({@code id}, {@code title}, {@code url}).
 * The file is read once when the bean is created; unknown attributes in the file are ignored.
 */
@Component
public class ClasspathLicenseRegistry implements LicenseRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClasspathLicenseRegistry.class);

    private final Map<String, LicenseEntry> licenses;

    /**
     * Loads the registry from the location configured under {@code doi.license-registry}.
     *
     * @param resourceLoader Spring resource loader
     * @param properties     DOI settings
     */
    @Autowired
    public ClasspathLicenseRegistry(ResourceLoader resourceLoader, DoiProperties properties) {
        this(resourceLoader, properties.getLicenseRegistry());
    }

    /**
     * @param resourceLoader resource loader used to resolve {@code location}
     * @param location       Spring resource location such as {@code classpath:licenses.json}
     * @throws LicenseRegistryException when the file is missing or malformed
     */
    public ClasspathLicenseRegistry(ResourceLoader resourceLoader, String location) {
        this.licenses = load(resourceLoader.getResource(location), location);
        log.info("Loaded {} license(s) from {}", licenses.size(), location);
    }

    @Override
    public Optional<LicenseEntry> findById(String licenseId) {
        if (licenseId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(licenses.get(licenseId));
    }

    private Map<String, LicenseEntry> load(Resource resource, String location) {
        if (!resource.exists()) {
            throw new LicenseRegistryException("License registry not found at " + location, null);
        }
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream input = resource.getInputStream()) {
            List<LicenseEntry> entries = mapper.readValue(input, new TypeReference<List<LicenseEntry>>() {
            });
            Map<String, LicenseEntry> byId = new LinkedHashMap<>();
            for (LicenseEntry entry : entries) {
                if (entry == null || entry.id() == null || entry.id().isBlank()) {
                    log.warn("Skipping license entry without an id in {}", location);
                    continue;
                }
                byId.put(entry.id(), entry);
            }
            return Collections.unmodifiableMap(byId);
        } catch (IOException ex) {
            throw new LicenseRegistryException("Unable to read the license registry at " + location, ex);
        }
    }
}
