package com.unit.catalog.store;

import com.unit.catalog.core.model.EquipmentCategory;
import com.unit.catalog.core.model.Slugs;
import com.unit.catalog.core.model.TechBase;

/**
 * Identity and classification of an equipment entry, derived from its raw label.
 * The slug is the content address; two labels with the same slug are the same equipment.
 */
public record EquipmentRecord(String slug, String name, EquipmentCategory category, TechBase techBase) {

    public static EquipmentRecord fromLabel(String label) {
        String name = label.trim();
        return new EquipmentRecord(Slugs.toSlug(name), name,
                EquipmentCategory.classify(name), EquipmentCategory.techBaseOf(name));
    }
}
