package com.unit.catalog.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.LongFunction;
import java.util.function.Predicate;

/**
 * One table of the in-memory store: rows by id, an optional unique key, and a sequence
 * that is never rolled back (like a database sequence).
 */
final class InMemoryTable<R> {

    private final String name;
    private final Function<R, String> uniqueKey;
    private final Map<Long, R> rows = new LinkedHashMap<>();
    private final Map<String, Long> index = new HashMap<>();
    private long sequence;

    InMemoryTable(String name, Function<R, String> uniqueKey) {
        this.name = name;
        this.uniqueKey = uniqueKey;
    }

    InMemoryTable(String name) {
        this(name, null);
    }

    String name() {
        return name;
    }

    long insert(LongFunction<R> factory, UndoLog undo) {
        long id = ++sequence;
        R row = factory.apply(id);
        String key = keyOf(row);
        if (key != null && index.containsKey(key)) {
            throw new CatalogStoreException("duplicate key '" + key + "' in " + name);
        }
        rows.put(id, row);
        if (key != null) {
            index.put(key, id);
        }
        undo.record("insert " + name + " " + id, () -> {
            rows.remove(id);
            if (key != null) {
                index.remove(key);
            }
        });
        return id;
    }

    void update(long id, R row, UndoLog undo) {
        R previous = rows.get(id);
        if (previous == null) {
            throw new CatalogStoreException("no row " + id + " in " + name);
        }
        String oldKey = keyOf(previous);
        String newKey = keyOf(row);
        if (newKey != null && !newKey.equals(oldKey) && index.containsKey(newKey)) {
            throw new CatalogStoreException("duplicate key '" + newKey + "' in " + name);
        }
        rows.put(id, row);
        reindex(id, oldKey, newKey);
        undo.record("update " + name + " " + id, () -> {
            rows.put(id, previous);
            reindex(id, newKey, oldKey);
        });
    }

    void delete(long id, UndoLog undo) {
        R previous = rows.remove(id);
        if (previous == null) {
            return;
        }
        String key = keyOf(previous);
        if (key != null) {
            index.remove(key);
        }
        undo.record("delete " + name + " " + id, () -> {
            rows.put(id, previous);
            if (key != null) {
                index.put(key, id);
            }
        });
    }

    void deleteWhere(Predicate<R> predicate, UndoLog undo) {
        List<Long> ids = new ArrayList<>();
        rows.forEach((id, row) -> {
            if (predicate.test(row)) {
                ids.add(id);
            }
        });
        ids.forEach(id -> delete(id, undo));
    }

    Optional<R> get(long id) {
        return Optional.ofNullable(rows.get(id));
    }

    Optional<Long> idOf(String key) {
        return Optional.ofNullable(index.get(key));
    }

    Optional<R> byKey(String key) {
        Long id = index.get(key);
        return id == null ? Optional.empty() : Optional.of(rows.get(id));
    }

    Collection<R> all() {
        return rows.values();
    }

    List<R> where(Predicate<R> predicate) {
        List<R> result = new ArrayList<>();
        for (R row : rows.values()) {
            if (predicate.test(row)) {
                result.add(row);
            }
        }
        return result;
    }

    int size() {
        return rows.size();
    }

    private String keyOf(R row) {
        return uniqueKey == null ? null : uniqueKey.apply(row);
    }

    private void reindex(long id, String from, String to) {
        if (from != null) {
            index.remove(from);
        }
        if (to != null) {
            index.put(to, id);
        }
    }
}
