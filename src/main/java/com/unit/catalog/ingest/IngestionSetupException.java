package com.unit.catalog.ingest;

/**
 * A failure that makes the whole run impossible: the archive cannot be read, the
 * database cannot be reached, or the reference catalog cannot be seeded. Unlike
 * per-unit failures this aborts the run immediately.
 */
public class IngestionSetupException extends RuntimeException {

    public IngestionSetupException(String message) {
        super(message);
    }

    public IngestionSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
