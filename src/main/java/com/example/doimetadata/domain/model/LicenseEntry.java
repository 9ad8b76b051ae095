package com.example.doimetadata.domain.model;

/**
 * License descriptor resolved from the license registry.
 */
public record LicenseEntry(
        String id,
        String title,
        String url
) {
}
