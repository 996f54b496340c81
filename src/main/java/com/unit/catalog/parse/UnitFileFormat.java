package com.unit.catalog.parse;

/**
 * The two unit file formats found in the source archive.
 */
public enum UnitFileFormat {
    /** Line-oriented {@code key:value} mech files. */
    MTF,
    /** Tag-delimited files for every other unit category. */
    BLK
}
