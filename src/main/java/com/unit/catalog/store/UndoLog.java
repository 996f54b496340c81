package com.unit.catalog.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensation log for one in-memory transaction. Every write registers the action that
 * reverses it; unless {@link #commit()} is called, closing the log runs those actions in
 * reverse order.
 *
 * <pre>
 * try (UndoLog undo = new UndoLog()) {
 *     rows.put(id, row);
 *     undo.record("insert unit " + id, () -&gt; rows.remove(id));
 *     undo.commit();
 * }
 * </pre>
 */
final class UndoLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UndoLog.class);

    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private boolean committed = false;
    private boolean closed = false;

    void record(String description, Runnable undo) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        compensations.push(new Compensation(description, undo));
    }

    void commit() {
        committed = true;
    }

    boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (!closed && !committed && !compensations.isEmpty()) {
            log.debug("store.rollback steps={}", compensations.size());
            while (!compensations.isEmpty()) {
                Compensation compensation = compensations.pop();
                log.trace("store.undo step='{}'", compensation.description());
                compensation.undo().run();
            }
        }
        compensations.clear();
        closed = true;
    }

    private record Compensation(String description, Runnable undo) {}
}
