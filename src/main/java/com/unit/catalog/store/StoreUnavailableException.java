package com.unit.catalog.store;

/**
 * The store could not be reached at all, as opposed to one operation failing.
 * Callers treat this as fatal to the run rather than to a single record.
 */
public class StoreUnavailableException extends CatalogStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
