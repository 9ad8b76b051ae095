package com.example.doimetadata.infrastructure.config;

import com.example.doimetadata.application.port.MetadataSettings;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DOI metadata settings bound from the {@code doi} prefix.
 * <ul>
 *   <li>{@code publisher}: publisher name sent with every registration</li>
 *   <li>{@code site-url}: base URL of the catalogue, used for dataset permalinks</li>
 *   <li>{@code license-registry}: resource location of the license list (default {@code classpath:licenses.json})</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "doi")
public class DoiProperties implements MetadataSettings {

    private static final Logger log = LoggerFactory.getLogger(DoiProperties.class);

    private String publisher;
    private String siteUrl;
    private String licenseRegistry = "classpath:licenses.json";

    @PostConstruct
    void validate() {
        if (publisher() == null) {
            log.warn("doi.publisher is not set; every metadata build will fail on the publisher field");
        }
        if (siteUrl() == null) {
            log.warn("doi.site-url is not set; dataset permalinks will not be generated");
        }
    }

    @Override
    public String publisher() {
        return publisher == null || publisher.isBlank() ? null : publisher.trim();
    }

    @Override
    public String siteUrl() {
        if (siteUrl == null || siteUrl.isBlank()) {
            return null;
        }
        String trimmed = siteUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getPublisher() {
        return publisher;
    }

    public void setPublisher(String publisher) {
        this.publisher = publisher;
    }

    public String getSiteUrl() {
        return siteUrl;
    }

    public void setSiteUrl(String siteUrl) {
        this.siteUrl = siteUrl;
    }

    public String getLicenseRegistry() {
        return licenseRegistry;
    }

    public void setLicenseRegistry(String licenseRegistry) {
        this.licenseRegistry = licenseRegistry;
    }
}
