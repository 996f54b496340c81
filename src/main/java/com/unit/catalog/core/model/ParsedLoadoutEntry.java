package com.unit.catalog.core.model;

/**
 * One equipment placement on a unit.
 *
 * @param equipment  equipment label as written in the source file
 * @param location   mounting location, or null when the source gives none
 * @param quantity   number of identical items at this location and facing
 * @param rearFacing whether the item fires to the rear
 */
public record ParsedLoadoutEntry(String equipment, LocationName location, int quantity, boolean rearFacing) {

    public ParsedLoadoutEntry {
        if (equipment == null || equipment.isBlank()) {
            throw new IllegalArgumentException("equipment must not be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be > 0");
        }
    }

    /**
     * Returns true if both entries place the same item at the same location and facing.
     */
    public boolean samePlacement(ParsedLoadoutEntry other) {
        return equipment.equals(other.equipment)
                && location == other.location
                && rearFacing == other.rearFacing;
    }

    public ParsedLoadoutEntry withQuantity(int newQuantity) {
        return new ParsedLoadoutEntry(equipment, location, newQuantity, rearFacing);
    }
}
