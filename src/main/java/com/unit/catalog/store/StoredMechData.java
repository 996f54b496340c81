package com.unit.catalog.store;

import com.unit.catalog.core.model.ComponentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mechanical attributes as persisted: raw labels next to resolved type ids.
 */
public record StoredMechData(
        String config,
        boolean omnimech,
        Integer engineRating,
        Integer walkMp,
        Integer jumpMp,
        Integer heatSinkCount,
        Map<ComponentCategory, String> labels,
        Map<ComponentCategory, Long> typeIds
) {
    public StoredMechData {
        labels = Collections.unmodifiableMap(labels.isEmpty()
                ? new EnumMap<>(ComponentCategory.class) : new EnumMap<>(labels));
        typeIds = Collections.unmodifiableMap(typeIds.isEmpty()
                ? new EnumMap<>(ComponentCategory.class) : new EnumMap<>(typeIds));
    }

    public Long typeId(ComponentCategory category) {
        return typeIds.get(category);
    }

    public String label(ComponentCategory category) {
        return labels.get(category);
    }
}
