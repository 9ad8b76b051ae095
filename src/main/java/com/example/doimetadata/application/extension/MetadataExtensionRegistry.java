package com.example.doimetadata.application.extension;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ordered, immutable list of {@link MetadataExtension} beans, resolved once at start-up.
 */
@Component
public class MetadataExtensionRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtensionRegistry.class);

    private final List<MetadataExtension> extensions;

    /**
     * Collects every extension bean in {@code @Order} sequence.
     *
     * @param extensions provider of the extension beans declared in the context
     */
    @Autowired
    public MetadataExtensionRegistry(ObjectProvider<MetadataExtension> extensions) {
        this(extensions.orderedStream().toList());
    }

    /**
     * @param extensions extensions in the order they should run
     */
    public MetadataExtensionRegistry(List<MetadataExtension> extensions) {
        this.extensions = List.copyOf(extensions);
        log.info("Registered {} metadata extension(s): {}", this.extensions.size(),
                this.extensions.stream().map(extension -> extension.getClass().getSimpleName()).toList());
    }

    /**
     * @return a registry without extensions
     */
    public static MetadataExtensionRegistry empty() {
        return new MetadataExtensionRegistry(List.of());
    }

    public List<MetadataExtension> extensions() {
        return extensions;
    }
}
