package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The resolution of every construction category for one unit.
 */
public class ResolvedComponents {

    private final Map<ComponentCategory, ComponentResolution> resolutions;

    ResolvedComponents(Map<ComponentCategory, ComponentResolution> resolutions) {
        this.resolutions = Collections.unmodifiableMap(new EnumMap<>(resolutions));
    }

    public ComponentResolution get(ComponentCategory category) {
        return resolutions.get(category);
    }

    /**
     * @return the canonical type id for the category, or null when not resolved
     */
    public Long typeId(ComponentCategory category) {
        ComponentResolution resolution = resolutions.get(category);
        return resolution == null ? null : resolution.typeId();
    }

    public List<ComponentResolution> gaps() {
        return resolutions.values().stream()
                .filter(ComponentResolution::isGap)
                .collect(Collectors.toList());
    }

    public Map<ComponentCategory, ComponentResolution> asMap() {
        return resolutions;
    }

    @Override
    public String toString() {
        return "ResolvedComponents{" + resolutions.values().stream()
                .map(r -> r.category().getKey() + "=" + r.status())
                .collect(Collectors.joining(", ")) + "}";
    }
}
