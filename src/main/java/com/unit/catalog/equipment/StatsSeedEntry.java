package com.unit.catalog.equipment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.unit.catalog.core.model.EquipmentStats;

/**
 * One entry of the equipment statistics seed file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatsSeedEntry(
        @JsonProperty("slug") String slug,
        @JsonProperty("tonnage") Double tonnage,
        @JsonProperty("crits") Integer crits,
        @JsonProperty("damage") String damage,
        @JsonProperty("heat") Integer heat,
        @JsonProperty("range_min") Integer rangeMin,
        @JsonProperty("range_short") Integer rangeShort,
        @JsonProperty("range_medium") Integer rangeMedium,
        @JsonProperty("range_long") Integer rangeLong,
        @JsonProperty("bv") Integer bv
) {

    public EquipmentStats stats() {
        return new EquipmentStats(tonnage, crits, damage, heat, rangeMin, rangeShort, rangeMedium, rangeLong, bv);
    }
}
