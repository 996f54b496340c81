package com.unit.catalog.store;

/**
 * The transaction lost a deadlock or serialization conflict with a concurrent one and
 * was rolled back. Nothing it wrote persists, so running the same work again is safe.
 */
public class StoreConflictException extends CatalogStoreException {

    public StoreConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
