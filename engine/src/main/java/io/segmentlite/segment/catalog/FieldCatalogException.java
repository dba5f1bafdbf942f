package io.segmentlite.segment.catalog;

/**
 * Thrown when the field catalog configuration cannot be read or is invalid.
 */
public class FieldCatalogException extends RuntimeException {

    public FieldCatalogException(String message) {
        super(message);
    }

    public FieldCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
