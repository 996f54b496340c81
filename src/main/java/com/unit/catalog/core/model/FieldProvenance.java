package com.unit.catalog.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The single source-priority rule for provenance-tracked fields.
 *
 * <p>An incoming value is written when the field is unset, when the incoming source has
 * at least the priority of the source that set it, or when forced. A null incoming value
 * never clears a field.</p>
 */
public final class FieldProvenance {

    private FieldProvenance() {
    }

    /**
     * @return the value to write, or empty when the current value must be kept
     */
    public static Optional<FieldValue> decide(FieldValue current, Object incoming,
                                              FieldSource incomingSource, boolean force) {
        if (incoming == null) {
            return Optional.empty();
        }
        FieldValue candidate = FieldValue.of(incoming, incomingSource);
        if (current == null || !current.isSet()) {
            return Optional.of(candidate);
        }
        if (Objects.equals(current.value(), incoming) && current.source() == incomingSource) {
            return Optional.empty();
        }
        if (force || current.source() == null
                || incomingSource.getPriority() >= current.source().getPriority()) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
