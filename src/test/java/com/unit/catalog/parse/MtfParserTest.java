package com.unit.catalog.parse;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLoadoutEntry;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.TechBase;
import com.unit.catalog.core.model.UnitType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MtfParser Tests")
class MtfParserTest {

    static final String ATLAS = String.join("\n",
            "chassis:Atlas",
            "model:AS7-D",
            "mul id:140",
            "Config:Biped",
            "techbase:Inner Sphere",
            "era:2755",
            "source:TRO 3025",
            "rules level:2",
            "mass:100",
            "engine:300 Fusion Engine",
            "structure:IS Standard",
            "myomer:Standard",
            "heat sinks:20 Single",
            "walk mp:3",
            "jump mp:0",
            "armor:Standard(Inner Sphere)",
            "LA armor:34",
            "RA armor:34",
            "LT armor:32",
            "RT armor:32",
            "CT armor:47",
            "HD armor:9",
            "LL armor:41",
            "RL armor:41",
            "RTL armor:10",
            "RTR armor:10",
            "RTC armor:14",
            "Weapons:5",
            "Autocannon/20, Right Torso, Ammo:10",
            "LRM 20, Left Torso",
            "4 Medium Laser, Left Arm",
            "SRM 6, Left Torso",
            "Medium Laser, Center Torso (R)",
            "",
            "Left Arm:",
            "Shoulder",
            "Upper Arm Actuator",
            "Medium Laser",
            "Medium Laser",
            "Heat Sink",
            "-Empty-",
            "",
            "Right Torso:",
            "Fusion Engine",
            "Autocannon/20",
            "IS Ammo AC/20",
            "IS Ammo AC/20",
            "",
            "quirk:command_mech",
            "overview:\"The Atlas is a legend.\"");

    private final MtfParser parser = new MtfParser();

    private ParsedUnit parseAtlas() {
        ParseOutcome outcome = parser.parse(ATLAS);
        assertTrue(outcome.isParsed(), () -> "rejected: " + outcome.getRejectionReason());
        return outcome.getUnit().orElseThrow();
    }

    @Nested
    @DisplayName("Unit fields")
    class UnitFields {

        @Test
        @DisplayName("Should read identity and classification fields")
        void identity() {
            ParsedUnit unit = parseAtlas();
            assertEquals("Atlas", unit.getChassis());
            assertEquals("AS7-D", unit.getModel());
            assertEquals("atlas-as7-d", unit.getSlug());
            assertEquals(UnitType.MECH, unit.getUnitType());
            assertEquals(140, unit.getExternalId().orElseThrow());
            assertEquals(100.0, unit.getTonnage());
            assertEquals(2755, unit.getIntroYear());
            assertEquals("TRO 3025", unit.getSource());
            assertEquals(TechBase.INNER_SPHERE, unit.getTechBase());
            assertEquals(RulesLevel.ADVANCED, unit.getRulesLevel());
        }

        @Test
        @DisplayName("Should slug quirks and strip quotes from the overview")
        void quirksAndOverview() {
            ParsedUnit unit = parseAtlas();
            assertEquals(List.of("command-mech"), unit.getQuirks());
            assertEquals("The Atlas is a legend.", unit.getDescription());
        }

        @Test
        @DisplayName("Should read front and rear armor per location")
        void armor() {
            ParsedUnit unit = parseAtlas();
            assertEquals(8, unit.getLocations().size());
            ParsedLocation leftTorso = unit.getLocations().stream()
                    .filter(l -> l.location() == LocationName.LEFT_TORSO).findFirst().orElseThrow();
            assertEquals(32, leftTorso.armor());
            assertEquals(10, leftTorso.rearArmor());
            ParsedLocation head = unit.getLocations().stream()
                    .filter(l -> l.location() == LocationName.HEAD).findFirst().orElseThrow();
            assertEquals(9, head.armor());
            assertNull(head.rearArmor());
        }

        @Test
        @DisplayName("Should read mechanical attributes and component labels")
        void mechAttributes() {
            MechAttributes mech = parseAtlas().getMechAttributes().orElseThrow();
            assertEquals(300, mech.getEngineRating());
            assertEquals("Fusion Engine", mech.getLabel(ComponentCategory.ENGINE));
            assertEquals(20, mech.getHeatSinkCount());
            assertEquals("Single", mech.getLabel(ComponentCategory.HEAT_SINK));
            assertEquals(3, mech.getWalkMp());
            assertEquals(0, mech.getJumpMp());
            assertFalse(mech.isOmnimech());
            assertNull(mech.getLabel(ComponentCategory.GYRO));
        }
    }

    @Nested
    @DisplayName("Loadout")
    class Loadout {

        @Test
        @DisplayName("Weapons list is authoritative; critical slots add the rest")
        void weaponsListAndSlots() {
            List<ParsedLoadoutEntry> loadout = parseAtlas().getLoadout();
            assertTrue(loadout.contains(new ParsedLoadoutEntry("Autocannon/20", LocationName.RIGHT_TORSO, 1, false)));
            assertTrue(loadout.contains(new ParsedLoadoutEntry("Medium Laser", LocationName.LEFT_ARM, 4, false)));
            assertTrue(loadout.contains(new ParsedLoadoutEntry("Medium Laser", LocationName.CENTER_TORSO, 1, true)));
            assertTrue(loadout.contains(new ParsedLoadoutEntry("Heat Sink", LocationName.LEFT_ARM, 1, false)));
            assertTrue(loadout.contains(new ParsedLoadoutEntry("IS Ammo AC/20", LocationName.RIGHT_TORSO, 2, false)));
            assertEquals(7, loadout.size());
        }

        @Test
        @DisplayName("Structural slots are not loadout")
        void structuralSlotsIgnored() {
            List<ParsedLoadoutEntry> loadout = parseAtlas().getLoadout();
            assertTrue(loadout.stream().noneMatch(e -> e.equipment().equals("Shoulder")));
            assertTrue(loadout.stream().noneMatch(e -> e.equipment().contains("Engine")));
            assertTrue(loadout.stream().noneMatch(e -> e.equipment().equals("-Empty-")));
        }

        @Test
        @DisplayName("Omnipod suffix is dropped from slot names")
        void omnipodSuffix() {
            String omni = "chassis:Dasher\nmodel:Prime\nConfig:Biped Omnimech\nmass:20\n"
                    + "Right Arm:\nER Small Laser (omnipod)\nER Small Laser (omnipod)\n";
            ParsedUnit unit = parser.parse(omni).getUnit().orElseThrow();
            assertTrue(unit.getMechAttributes().orElseThrow().isOmnimech());
            assertEquals(List.of(new ParsedLoadoutEntry("ER Small Laser", LocationName.RIGHT_ARM, 2, false)),
                    unit.getLoadout());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Missing chassis is rejected")
        void missingChassis() {
            ParseOutcome outcome = parser.parse("model:AS7-D\nmass:100\n");
            assertFalse(outcome.isParsed());
            assertEquals("missing chassis", outcome.getRejectionReason());
        }

        @Test
        @DisplayName("Unreadable mass is rejected")
        void badMass() {
            ParseOutcome outcome = parser.parse("chassis:Atlas\nmass:heavy\n");
            assertFalse(outcome.isParsed());
            assertEquals("missing or invalid mass", outcome.getRejectionReason());
        }

        @Test
        @DisplayName("A weapon quantity too large for an int drops only that line")
        void oversizedQuantity() {
            ParseOutcome outcome = parser.parse("chassis:Locust\nmodel:LCT-1V\nmass:20\n"
                    + "Weapons:2\n99999999999 Medium Laser, Center Torso\n2 Machine Gun, Left Arm\n");

            ParsedUnit unit = outcome.getUnit().orElseThrow();
            assertEquals(1, unit.getLoadout().size());
            assertEquals("Machine Gun", unit.getLoadout().get(0).equipment());
            assertEquals(2, unit.getLoadout().get(0).quantity());
        }

        @Test
        @DisplayName("Quantities that overflow when summed reject the file")
        void summedQuantityOverflow() {
            ParseOutcome outcome = parser.parse("chassis:Locust\nmodel:LCT-1V\nmass:20\n"
                    + "Weapons:2\n2147483647 Medium Laser, Center Torso\n1 Medium Laser, Center Torso\n");

            assertFalse(outcome.isParsed());
            assertEquals("quantity overflow for Medium Laser", outcome.getRejectionReason());
        }

        @Test
        @DisplayName("Empty content is rejected")
        void empty() {
            assertFalse(parser.parse("   ").isParsed());
        }

        @Test
        @DisplayName("Bytes that are not UTF-8 are rejected, not decoded")
        void invalidUtf8() {
            byte[] content = "chassis:Atlas\nmass:100\n".getBytes(StandardCharsets.UTF_8);
            byte[] corrupted = new byte[content.length + 1];
            System.arraycopy(content, 0, corrupted, 0, content.length);
            corrupted[content.length] = (byte) 0xC3;
            ParseOutcome outcome = parser.parse(corrupted);
            assertFalse(outcome.isParsed());
            assertEquals("content is not valid UTF-8", outcome.getRejectionReason());
        }
    }

    @Test
    @DisplayName("Parsing is deterministic")
    void deterministic() {
        assertEquals(parser.parse(ATLAS).getUnit().orElseThrow().getLoadout(),
                parser.parse(ATLAS).getUnit().orElseThrow().getLoadout());
    }
}
