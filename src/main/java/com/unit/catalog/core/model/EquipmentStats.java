package com.unit.catalog.core.model;

/**
 * Combat statistics for one equipment entry. Any component may be null when unknown.
 */
public record EquipmentStats(
        Double tonnage,
        Integer crits,
        String damage,
        Integer heat,
        Integer rangeMin,
        Integer rangeShort,
        Integer rangeMedium,
        Integer rangeLong,
        Integer bv
) {
    public static final EquipmentStats EMPTY =
            new EquipmentStats(null, null, null, null, null, null, null, null, null);

    /**
     * Fills every null component of this record from {@code other}.
     */
    public EquipmentStats fillFrom(EquipmentStats other) {
        return new EquipmentStats(
                tonnage != null ? tonnage : other.tonnage,
                crits != null ? crits : other.crits,
                damage != null ? damage : other.damage,
                heat != null ? heat : other.heat,
                rangeMin != null ? rangeMin : other.rangeMin,
                rangeShort != null ? rangeShort : other.rangeShort,
                rangeMedium != null ? rangeMedium : other.rangeMedium,
                rangeLong != null ? rangeLong : other.rangeLong,
                bv != null ? bv : other.bv);
    }
}
