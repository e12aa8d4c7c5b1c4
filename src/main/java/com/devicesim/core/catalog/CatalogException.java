package com.devicesim.core.catalog;

/**
 * Thrown when a lookup names a domain, device type or action the catalog does not hold.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
