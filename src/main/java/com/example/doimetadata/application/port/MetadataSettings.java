package com.example.doimetadata.application.port;

/**
 * Deployment-wide settings read by the field extractor.
 * Values are read-only for the lifetime of the process.
 */
public interface MetadataSettings {

    /**
     * @return publisher name registered with every DOI, or {@code null} when not configured
     */
    String publisher();

    /**
     * @return site base URL without a trailing slash, or {@code null} when not configured
     */
    String siteUrl();
}
