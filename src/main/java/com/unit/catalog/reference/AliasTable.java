package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the persisted alias tables: for each category, normalized alias to
 * canonical type, plus slug to canonical type for the standard-entry lookup.
 *
 * <p>Two different canonical types may never share a normalized alias within a category;
 * {@link #add(String, ComponentTypeRef)} rejects such a conflict.</p>
 */
public class AliasTable {

    private final Map<ComponentCategory, Map<String, ComponentTypeRef>> byAlias = new EnumMap<>(ComponentCategory.class);
    private final Map<ComponentCategory, Map<String, ComponentTypeRef>> bySlug = new EnumMap<>(ComponentCategory.class);

    /**
     * Normalizes a raw label for lookup: trimmed and case-folded.
     */
    public static String normalize(String label) {
        return label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
    }

    public AliasTable addType(ComponentTypeRef type) {
        bySlug.computeIfAbsent(type.category(), c -> new HashMap<>()).put(type.slug(), type);
        return this;
    }

    public AliasTable add(String alias, ComponentTypeRef type) {
        addType(type);
        String key = normalize(alias);
        Map<String, ComponentTypeRef> aliases = byAlias.computeIfAbsent(type.category(), c -> new HashMap<>());
        ComponentTypeRef existing = aliases.get(key);
        if (existing != null && existing.id() != type.id()) {
            throw new IllegalStateException("Alias '" + alias + "' in category " + type.category()
                    + " maps to both " + existing.slug() + " and " + type.slug());
        }
        aliases.put(key, type);
        return this;
    }

    public Optional<ComponentTypeRef> lookup(ComponentCategory category, String label) {
        return Optional.ofNullable(byAlias.getOrDefault(category, Map.of()).get(normalize(label)));
    }

    public Optional<ComponentTypeRef> bySlug(ComponentCategory category, String slug) {
        return Optional.ofNullable(bySlug.getOrDefault(category, Map.of()).get(slug));
    }

    public Map<String, ComponentTypeRef> aliases(ComponentCategory category) {
        return Collections.unmodifiableMap(byAlias.getOrDefault(category, Map.of()));
    }

    public int size() {
        return byAlias.values().stream().mapToInt(Map::size).sum();
    }
}
