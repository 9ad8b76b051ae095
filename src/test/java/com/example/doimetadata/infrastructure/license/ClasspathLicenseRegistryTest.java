package com.example.doimetadata.infrastructure.license;

import com.example.doimetadata.domain.model.LicenseEntry;
import com.example.doimetadata.infrastructure.exception.LicenseRegistryException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the JSON-backed license registry.
 */
class ClasspathLicenseRegistryTest {

    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    /**
     * Verifies the bundled registry resolves known licenses and ignores unknown ones.
     */
    @Test
    void findByIdResolvesBundledLicenses() {
        ClasspathLicenseRegistry registry = new ClasspathLicenseRegistry(resourceLoader, "classpath:licenses.json");

        assertThat(registry.findById("cc-by"))
                .map(LicenseEntry::url)
                .hasValue("http://www.opendefinition.org/licenses/cc-by");
        assertThat(registry.findById("no-such-license")).isEmpty();
        assertThat(registry.findById(null)).isEmpty();
    }

    /**
     * Ensures entries without an id are skipped and unknown attributes are ignored.
     */
    @Test
    void loadSkipsEntriesWithoutId() {
        ClasspathLicenseRegistry registry =
                new ClasspathLicenseRegistry(resourceLoader, "classpath:licenses/partial-licenses.json");

        assertThat(registry.findById("local-license"))
                .hasValue(new LicenseEntry("local-license", "Local licence", "https://example.org/licence"));
        assertThat(registry.findById("")).isEmpty();
    }

    /**
     * Ensures a missing or malformed registry fails at start-up.
     */
    @Test
    void loadFailsForMissingOrMalformedFile() {
        assertThrows(LicenseRegistryException.class,
                () -> new ClasspathLicenseRegistry(resourceLoader, "classpath:licenses/absent.json"));
        assertThrows(LicenseRegistryException.class,
                () -> new ClasspathLicenseRegistry(resourceLoader, "classpath:licenses/malformed-licenses.json"));
    }
}
