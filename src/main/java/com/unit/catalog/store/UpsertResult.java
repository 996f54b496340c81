package com.unit.catalog.store;

/**
 * Row id plus what an upsert did to it.
 */
public record UpsertResult(long id, Status status) {

    public enum Status {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    public static UpsertResult created(long id) {
        return new UpsertResult(id, Status.CREATED);
    }

    public static UpsertResult updated(long id) {
        return new UpsertResult(id, Status.UPDATED);
    }

    public static UpsertResult unchanged(long id) {
        return new UpsertResult(id, Status.UNCHANGED);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }

    public boolean isChanged() {
        return status != Status.UNCHANGED;
    }
}
