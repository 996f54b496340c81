package com.unit.catalog.match;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManualOverrides Tests")
class ManualOverridesTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads external id to slug mappings")
    void load() throws IOException {
        Path file = Files.writeString(tempDir.resolve("overrides.json"),
                "{\"42\": \"fire-moth-prime\", \" 142 \": \" atlas-as7-d-dc \"}");

        ManualOverrides overrides = ManualOverrides.load(file);

        assertEquals(2, overrides.size());
        assertEquals(Optional.of("fire-moth-prime"), overrides.target(42));
        assertEquals(Optional.of("atlas-as7-d-dc"), overrides.target(142));
        assertTrue(overrides.target(7).isEmpty());
    }

    @Test
    @DisplayName("Rejects keys that are not ids and blank targets")
    void invalid() throws IOException {
        Path badKey = Files.writeString(tempDir.resolve("bad-key.json"), "{\"atlas\": \"atlas-as7-d\"}");
        Path blank = Files.writeString(tempDir.resolve("blank.json"), "{\"42\": \" \"}");

        assertThrows(IllegalArgumentException.class, () -> ManualOverrides.load(badKey));
        assertThrows(IllegalArgumentException.class, () -> ManualOverrides.load(blank));
        assertThrows(UncheckedIOException.class, () -> ManualOverrides.load(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("Empty overrides match nothing")
    void empty() {
        assertEquals(0, ManualOverrides.empty().size());
        assertTrue(ManualOverrides.empty().target(42).isEmpty());
    }
}
