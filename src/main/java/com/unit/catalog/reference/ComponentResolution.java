package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;

import java.util.Optional;

/**
 * Outcome of resolving one construction label against the alias tables.
 *
 * @param category category the label belongs to
 * @param status   how the label was resolved
 * @param typeId   canonical type id; null unless RESOLVED or DEFAULTED
 * @param label    the raw label as parsed; null when absent
 */
public record ComponentResolution(ComponentCategory category, Status status, Long typeId, String label) {

    public enum Status {
        /** The label matched a known alias. */
        RESOLVED,
        /** No label was present and the category defaults to its standard entry. */
        DEFAULTED,
        /** A label was present but no alias matched it. */
        UNRESOLVED,
        /** No label was present and the category has no default. */
        MISSING
    }

    public static ComponentResolution resolved(ComponentCategory category, long typeId, String label) {
        return new ComponentResolution(category, Status.RESOLVED, typeId, label);
    }

    public static ComponentResolution defaulted(ComponentCategory category, long typeId) {
        return new ComponentResolution(category, Status.DEFAULTED, typeId, null);
    }

    public static ComponentResolution unresolved(ComponentCategory category, String label) {
        return new ComponentResolution(category, Status.UNRESOLVED, null, label);
    }

    public static ComponentResolution missing(ComponentCategory category) {
        return new ComponentResolution(category, Status.MISSING, null, null);
    }

    public Optional<Long> getTypeId() {
        return Optional.ofNullable(typeId);
    }

    /**
     * A gap is a label that was present but unknown. Missing labels without a default
     * are not gaps: the source simply did not state them.
     */
    public boolean isGap() {
        return status == Status.UNRESOLVED;
    }
}
