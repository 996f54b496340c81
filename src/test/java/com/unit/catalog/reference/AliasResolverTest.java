package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.MechAttributes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AliasResolver Tests")
class AliasResolverTest {

    private static final ComponentTypeRef FUSION = new ComponentTypeRef(1, ComponentCategory.ENGINE, "standard-fusion");
    private static final ComponentTypeRef XL = new ComponentTypeRef(2, ComponentCategory.ENGINE, "xl-is");
    private static final ComponentTypeRef STANDARD_GYRO = new ComponentTypeRef(10, ComponentCategory.GYRO, "standard");
    private static final ComponentTypeRef XL_GYRO = new ComponentTypeRef(11, ComponentCategory.GYRO, "xl");
    private static final ComponentTypeRef STANDARD_COCKPIT = new ComponentTypeRef(20, ComponentCategory.COCKPIT, "standard");
    private static final ComponentTypeRef STANDARD_MYOMER = new ComponentTypeRef(30, ComponentCategory.MYOMER, "standard");

    private AliasResolver resolver;

    @BeforeEach
    void setUp() {
        AliasTable table = new AliasTable()
                .add("Fusion Engine", FUSION)
                .add("Fusion", FUSION)
                .add("XL Engine", XL)
                .add("Standard", STANDARD_GYRO)
                .add("XL Gyro", XL_GYRO)
                .add("Standard", STANDARD_COCKPIT)
                .add("Standard", STANDARD_MYOMER);
        resolver = new AliasResolver(table);
    }

    @Nested
    @DisplayName("Label lookup")
    class LabelLookup {

        @ParameterizedTest
        @ValueSource(strings = {"Fusion Engine", "fusion engine", "  FUSION ENGINE  ", "Fusion"})
        @DisplayName("Lookup is case-insensitive and trims whitespace")
        void caseInsensitive(String label) {
            ComponentResolution resolution = resolver.resolve(ComponentCategory.ENGINE, label);
            assertEquals(ComponentResolution.Status.RESOLVED, resolution.status());
            assertEquals(1L, resolution.typeId());
        }

        @Test
        @DisplayName("Unknown label is unresolved and reported as a gap")
        void unknownLabel() {
            ComponentResolution resolution = resolver.resolve(ComponentCategory.ENGINE, "Warp Core");
            assertEquals(ComponentResolution.Status.UNRESOLVED, resolution.status());
            assertTrue(resolution.isGap());
            assertTrue(resolution.getTypeId().isEmpty());
            assertEquals("Warp Core", resolution.label());
        }

        @Test
        @DisplayName("Aliases are scoped to their category")
        void categoryScoped() {
            assertEquals(ComponentResolution.Status.UNRESOLVED,
                    resolver.resolve(ComponentCategory.ENGINE, "XL Gyro").status());
        }
    }

    @Nested
    @DisplayName("Default fill")
    class DefaultFill {

        @Test
        @DisplayName("Absent gyro label is filled with the standard gyro")
        void absentGyroDefaults() {
            ComponentResolution resolution = resolver.resolve(ComponentCategory.GYRO, null);
            assertEquals(ComponentResolution.Status.DEFAULTED, resolution.status());
            assertEquals(10L, resolution.typeId());
            assertFalse(resolution.isGap());
        }

        @Test
        @DisplayName("Unknown gyro label is not defaulted")
        void unknownGyroNotDefaulted() {
            ComponentResolution resolution = resolver.resolve(ComponentCategory.GYRO, "Quantum Gyro");
            assertEquals(ComponentResolution.Status.UNRESOLVED, resolution.status());
            assertNull(resolution.typeId());
        }

        @Test
        @DisplayName("Absent engine label stays missing")
        void absentEngineMissing() {
            ComponentResolution resolution = resolver.resolve(ComponentCategory.ENGINE, "");
            assertEquals(ComponentResolution.Status.MISSING, resolution.status());
            assertFalse(resolution.isGap());
        }
    }

    @Test
    @DisplayName("resolveAll covers every category and collects gaps")
    void resolveAll() {
        MechAttributes attributes = MechAttributes.builder()
                .label(ComponentCategory.ENGINE, "XL Engine")
                .label(ComponentCategory.ARMOR, "Unobtainium")
                .build();
        ResolvedComponents resolved = resolver.resolveAll(attributes);

        assertEquals(ComponentCategory.values().length, resolved.asMap().size());
        assertEquals(2L, resolved.typeId(ComponentCategory.ENGINE));
        assertEquals(10L, resolved.typeId(ComponentCategory.GYRO));
        assertEquals(20L, resolved.typeId(ComponentCategory.COCKPIT));
        assertEquals(30L, resolved.typeId(ComponentCategory.MYOMER));
        assertNull(resolved.typeId(ComponentCategory.STRUCTURE));
        assertEquals(1, resolved.gaps().size());
        assertEquals(ComponentCategory.ARMOR, resolved.gaps().get(0).category());
    }

    @Test
    @DisplayName("An alias bound to two different types is rejected")
    void conflictingAlias() {
        AliasTable table = new AliasTable().add("Fusion", FUSION);
        assertThrows(IllegalStateException.class, () -> table.add("FUSION", XL));
    }

    @Test
    @DisplayName("Null alias table is rejected")
    void nullTable() {
        assertThrows(IllegalArgumentException.class, () -> new AliasResolver(null));
    }
}
