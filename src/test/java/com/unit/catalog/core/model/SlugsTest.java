package com.unit.catalog.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Slugs Tests")
class SlugsTest {

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', value = {
            "Atlas AS7-D|atlas-as7-d",
            "Medium Laser|medium-laser",
            "  Clan ER Large Laser  |clan-er-large-laser",
            "Dasher (Fire Moth) A|dasher-fire-moth-a",
            "LRM 20 (Artemis IV)|lrm-20-artemis-iv",
            "IS Ammo AC/10|is-ammo-ac-10",
            "Mad Cat Mk II|mad-cat-mk-ii"
    })
    @DisplayName("toSlug lowercases and collapses non-alphanumeric runs")
    void toSlug(String input, String expected) {
        assertEquals(expected, Slugs.toSlug(input));
    }

    @Test
    @DisplayName("toSlug of null or punctuation-only text is empty")
    void emptySlugs() {
        assertEquals("", Slugs.toSlug(null));
        assertEquals("", Slugs.toSlug("---"));
        assertEquals("", Slugs.toSlug(""));
    }

    @Test
    @DisplayName("Non-ASCII letters act as separators")
    void nonAsciiIsSeparator() {
        assertEquals("m-ller", Slugs.toSlug("Müller"));
    }

    @Test
    @DisplayName("fullName joins chassis and model, omitting a blank model")
    void fullName() {
        assertEquals("Atlas AS7-D", Slugs.fullName("Atlas", "AS7-D"));
        assertEquals("Atlas", Slugs.fullName("Atlas", ""));
        assertEquals("Atlas", Slugs.fullName("Atlas", null));
    }

    @Test
    @DisplayName("Chassis slugs are qualified by unit type")
    void chassisSlugIncludesUnitType() {
        String mech = Slugs.chassisSlug("Atlas", UnitType.MECH);
        String vehicle = Slugs.chassisSlug("Atlas", UnitType.VEHICLE);
        assertNotEquals(mech, vehicle);
        assertTrue(mech.startsWith("atlas-"));
    }
}
