package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.MechAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw construction labels to canonical component type ids.
 *
 * <p>Lookup is exact on the trimmed, case-folded label. When a gyro, cockpit or myomer
 * label is absent the category's standard entry is used. A label that is present but
 * unknown is never defaulted: the reference stays empty and the gap is reported.</p>
 */
public class AliasResolver {

    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    private final AliasTable aliasTable;

    public AliasResolver(AliasTable aliasTable) {
        if (aliasTable == null) {
            throw new IllegalArgumentException("aliasTable must not be null");
        }
        this.aliasTable = aliasTable;
    }

    public ComponentResolution resolve(ComponentCategory category, String label) {
        if (label == null || label.isBlank()) {
            if (category.defaultsToStandard()) {
                Optional<ComponentTypeRef> standard = aliasTable.bySlug(category, ReferenceCatalog.STANDARD_SLUG);
                if (standard.isPresent()) {
                    return ComponentResolution.defaulted(category, standard.get().id());
                }
                log.warn("alias.noStandardEntry category={}", category.getKey());
            }
            return ComponentResolution.missing(category);
        }
        Optional<ComponentTypeRef> match = aliasTable.lookup(category, label);
        if (match.isPresent()) {
            return ComponentResolution.resolved(category, match.get().id(), label);
        }
        log.debug("alias.unresolved category={} label='{}'", category.getKey(), label);
        return ComponentResolution.unresolved(category, label);
    }

    public ResolvedComponents resolveAll(MechAttributes attributes) {
        Map<ComponentCategory, ComponentResolution> result = new EnumMap<>(ComponentCategory.class);
        for (ComponentCategory category : ComponentCategory.values()) {
            result.put(category, resolve(category, attributes.getLabel(category)));
        }
        return new ResolvedComponents(result);
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }
}
