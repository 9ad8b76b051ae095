package com.example.doimetadata.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals the license registry file could not be loaded.
 */
public class LicenseRegistryException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from Jackson or the resource loader.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or parsing exception
	 */
    public LicenseRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
