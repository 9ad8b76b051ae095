package com.example.doimetadata.domain.model;

/**
 * Failure captured while deriving a single metadata field.
 * Carries the field, a readable message and the underlying cause (which may be {@code null}).
 */
public record FieldError(
        MetadataField field,
        String message,
        Throwable cause
) {
    /**
     * Wraps an exception thrown during a field derivation.
     *
     * @param field field whose derivation failed
     * @param cause exception raised by the derivation
     * @return captured error
     */
    public static FieldError of(MetadataField field, Throwable cause) {
        String message = cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
        return new FieldError(field, message, cause);
    }

    /**
     * @param field   field whose derivation failed
     * @param message readable explanation
     * @return captured error without an underlying exception
     */
    public static FieldError of(MetadataField field, String message) {
        return new FieldError(field, message, null);
    }
}
