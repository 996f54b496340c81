package com.unit.catalog.parse;

import com.unit.catalog.core.model.UnitType;

import java.util.Locale;
import java.util.Optional;

/**
 * A unit file inside the source archive, with the parser that should read it.
 *
 * @param name            entry path inside the archive
 * @param format          file format
 * @param defaultUnitType unit category assumed for tag files without a recognised type
 * @param content         raw file bytes
 */
public record ArchiveEntry(String name, UnitFileFormat format, UnitType defaultUnitType, byte[] content) {

    /**
     * Classifies an archive path. Returns empty for directories and non-unit files.
     * For tag files the default category comes from the parent directory name.
     */
    public static Optional<Classification> classify(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith("/")) {
            return Optional.empty();
        }
        if (lower.endsWith(".mtf")) {
            return Optional.of(new Classification(UnitFileFormat.MTF, UnitType.MECH));
        }
        if (lower.endsWith(".blk")) {
            String[] segments = lower.split("/");
            String parent = segments.length >= 2 ? segments[segments.length - 2] : "";
            UnitType type;
            if (parent.contains("vehicle") || parent.contains("vee")) {
                type = UnitType.VEHICLE;
            } else if (parent.contains("fighter") || parent.contains("aero")) {
                type = UnitType.FIGHTER;
            } else {
                type = UnitType.OTHER;
            }
            return Optional.of(new Classification(UnitFileFormat.BLK, type));
        }
        return Optional.empty();
    }

    /**
     * Returns the parser for this entry.
     */
    public UnitFileParser parser() {
        return format == UnitFileFormat.MTF ? new MtfParser() : new BlkParser(defaultUnitType);
    }

    public ParseOutcome parse() {
        return parser().parse(content);
    }

    /**
     * Format and default category derived from an archive path.
     */
    public record Classification(UnitFileFormat format, UnitType defaultUnitType) {}
}
