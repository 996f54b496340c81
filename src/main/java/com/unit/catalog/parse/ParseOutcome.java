package com.unit.catalog.parse;

import com.unit.catalog.core.model.ParsedUnit;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing one unit file: either a parsed unit or an explicit rejection with
 * the reason the block could not be interpreted. Parsers never throw for bad input.
 */
public final class ParseOutcome {
    private final ParsedUnit unit;
    private final String rejectionReason;

    private ParseOutcome(ParsedUnit unit, String rejectionReason) {
        this.unit = unit;
        this.rejectionReason = rejectionReason;
    }

    public static ParseOutcome parsed(ParsedUnit unit) {
        return new ParseOutcome(Objects.requireNonNull(unit, "unit"), null);
    }

    public static ParseOutcome rejected(String reason) {
        return new ParseOutcome(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isParsed() {
        return unit != null;
    }

    public Optional<ParsedUnit> getUnit() {
        return Optional.ofNullable(unit);
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    @Override
    public String toString() {
        return isParsed() ? "ParseOutcome{parsed=" + unit.getSlug() + '}'
                : "ParseOutcome{rejected='" + rejectionReason + "'}";
    }
}
