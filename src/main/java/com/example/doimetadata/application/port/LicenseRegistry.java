package com.example.doimetadata.application.port;

import com.example.doimetadata.domain.model.LicenseEntry;

import java.util.Optional;

/**
 * Lookup of license descriptors by identifier.
 */
public interface LicenseRegistry {

    /**
     * @param licenseId license identifier stored on the dataset
     * @return descriptor or empty when the identifier is unknown
     */
    Optional<LicenseEntry> findById(String licenseId);
}
