package com.unit.catalog.store;

/**
 * A persistence operation failed. Raised inside a transaction, it rolls that transaction
 * back; the caller decides whether the failure is fatal to the run.
 */
public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
