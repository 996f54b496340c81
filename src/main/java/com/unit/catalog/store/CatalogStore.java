package com.unit.catalog.store;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Transactional access to the persisted unit catalog.
 *
 * <p>Each call to {@link #inTransaction(Function)} runs its work atomically: either every
 * write becomes visible or none does. Transactions are independent of each other, so
 * callers may run them from several threads.</p>
 */
public interface CatalogStore extends AutoCloseable {

    <T> T inTransaction(Function<CatalogSession, T> work);

    default void execute(Consumer<CatalogSession> work) {
        inTransaction(session -> {
            work.accept(session);
            return null;
        });
    }

    @Override
    void close();
}
