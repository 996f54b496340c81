package com.unit.catalog.reference;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.TechBase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.unit.catalog.core.model.ComponentCategory.*;
import static com.unit.catalog.core.model.RulesLevel.*;
import static com.unit.catalog.core.model.TechBase.CLAN;
import static com.unit.catalog.core.model.TechBase.INNER_SPHERE;

/**
 * The closed, versioned set of canonical component types and their aliases.
 *
 * <p>Bump {@link #VERSION} whenever an entry or alias changes. Seeding is idempotent:
 * existing types and aliases are left as they are and missing ones are added.</p>
 */
public final class ReferenceCatalog {

    public static final int VERSION = 3;

    /** Slug of the entry used by the default-fill pass in gyro, cockpit and myomer. */
    public static final String STANDARD_SLUG = "standard";

    private final Map<ComponentCategory, List<ComponentType>> types;

    private ReferenceCatalog(Map<ComponentCategory, List<ComponentType>> types) {
        this.types = types;
        validate();
    }

    public static ReferenceCatalog standard() {
        Map<ComponentCategory, List<ComponentType>> types = new EnumMap<>(ComponentCategory.class);
        Definer d = new Definer(types);

        d.engine("standard-fusion", "Standard Fusion Engine", INNER_SPHERE, INTRODUCTORY, 2021, 1.000, 6, 0,
                "Fusion Engine", "Fusion", "Fusion Engine(IS)", "Fusion (Clan) Engine", "Fusion (Clan) Engine(IS)",
                "Fusion Engine (Clan)");
        d.engine("xl-is", "XL Engine (IS)", INNER_SPHERE, STANDARD, 2579, 0.500, 6, 3,
                "XL Engine", "XL Fusion Engine", "XL Engine(IS)");
        d.engine("xl-clan", "XL Engine (Clan)", CLAN, STANDARD, 2827, 0.500, 6, 2,
                "XL (Clan) Engine", "Clan XL Engine", "XL (Clan) Engine(IS)", "Clan XL Engine(IS)");
        d.engine("light", "Light Fusion Engine", INNER_SPHERE, STANDARD, 3062, 0.750, 6, 2,
                "Light Engine", "Light Fusion Engine", "Light Engine(IS)", "Light Fusion Engine(IS)");
        d.engine("compact", "Compact Fusion Engine", INNER_SPHERE, STANDARD, 3068, 1.500, 3, 0,
                "Compact Engine", "Compact Fusion Engine", "Compact Engine(IS)", "Compact Fusion Engine(IS)");
        d.engine("xxl-is", "XXL Engine (IS)", INNER_SPHERE, EXPERIMENTAL, 3055, 0.333, 6, 6,
                "XXL Engine", "XXL Fusion Engine", "XXL Engine(IS)", "XXL Fusion Engine(IS)");
        d.engine("xxl-clan", "XXL Engine (Clan)", CLAN, EXPERIMENTAL, 3055, 0.333, 6, 4,
                "XXL (Clan) Engine", "Clan XXL Engine", "XXL (Clan) Engine(IS)", "Clan XXL Engine(IS)");
        d.engine("ice", "Internal Combustion Engine", INNER_SPHERE, INTRODUCTORY, 1950, 2.000, 6, 0,
                "ICE", "ICE Engine", "I.C.E.", "I.C.E. Engine", "ICE Engine(IS)", "I.C.E. Engine(IS)");
        d.engine("fuel-cell", "Fuel Cell Engine", INNER_SPHERE, STANDARD, 2300, 1.200, 6, 0,
                "Fuel Cell", "Fuel Cell Engine", "Fuel-Cell Engine", "Fuel Cell Engine(IS)", "Fuel-Cell Engine(IS)");
        d.engine("primitive-fusion", "Primitive Fusion Engine", INNER_SPHERE, ADVANCED, 2300, 1.000, 6, 0,
                "Primitive Fusion Engine", "Primitive Engine", "Primitive Fusion Engine(IS)", "Primitive Engine(IS)");
        d.engine("fission", "Fission Engine", INNER_SPHERE, EXPERIMENTAL, null, 1.750, 6, 0,
                "Fission Engine", "Fission Engine(IS)");

        d.armor("standard", "Standard Armor", INNER_SPHERE, INTRODUCTORY, 2470, 16.00, 0,
                "Standard", "Standard Armor", "Standard(Inner Sphere)", "Standard(Clan)", "Standard(IS/Clan)",
                "Standard Armor(Inner Sphere)");
        d.armor("ferro-fibrous-is", "Ferro-Fibrous Armor (IS)", INNER_SPHERE, STANDARD, 2571, 17.92, 14,
                "Ferro-Fibrous", "Ferro-Fibrous (Inner Sphere)", "Ferro-Fibrous(Inner Sphere)");
        d.armor("ferro-fibrous-clan", "Ferro-Fibrous Armor (Clan)", CLAN, STANDARD, 2820, 19.20, 7,
                "Ferro-Fibrous (Clan)", "Clan Ferro-Fibrous", "Ferro-Fibrous(Clan)");
        d.armor("light-ferro", "Light Ferro-Fibrous Armor", INNER_SPHERE, STANDARD, 3067, 16.96, 7,
                "Light Ferro-Fibrous", "Light Ferro-Fibrous(Inner Sphere)", "Light Ferro-Fibrous(Clan)");
        d.armor("heavy-ferro", "Heavy Ferro-Fibrous Armor", INNER_SPHERE, STANDARD, 3069, 19.52, 21,
                "Heavy Ferro-Fibrous", "Heavy Ferro-Fibrous(Inner Sphere)");
        d.armor("stealth", "Stealth Armor", INNER_SPHERE, STANDARD, 3063, 16.00, 12,
                "Stealth", "Stealth Armor", "Stealth(Inner Sphere)", "Stealth Armor(Inner Sphere)");
        d.armor("reactive", "Reactive Armor", INNER_SPHERE, ADVANCED, 3063, 16.00, 14,
                "Reactive", "Reactive Armor", "Reactive(Inner Sphere)", "Reactive(Clan)", "Reactive Armor(Inner Sphere)");
        d.armor("hardened", "Hardened Armor", INNER_SPHERE, ADVANCED, 3047, 8.00, 0,
                "Hardened", "Hardened Armor", "Hardened(Inner Sphere)", "Hardened(Clan)", "Hardened Armor(Inner Sphere)");
        d.armor("primitive", "Primitive Armor", INNER_SPHERE, ADVANCED, 2300, 10.24, 0,
                "Primitive", "Primitive Armor", "Primitive(Inner Sphere)", "Primitive Armor(Inner Sphere)");
        d.armor("industrial", "Industrial Armor", INNER_SPHERE, INTRODUCTORY, 2439, 16.00, 0,
                "Industrial(Inner Sphere)", "Industrial (Inner Sphere)", "Industrial Armor(Inner Sphere)");
        d.armor("heavy-industrial", "Heavy Industrial Armor", INNER_SPHERE, STANDARD, 2460, 8.00, 0,
                "Heavy Industrial Armor", "Heavy Industrial(Inner Sphere)", "Heavy Industrial(Clan)");
        d.armor("commercial", "Commercial Armor", INNER_SPHERE, INTRODUCTORY, 2400, 8.00, 0,
                "Commercial Armor", "Commercial(Inner Sphere)", "Commercial Armor(Inner Sphere)");
        d.armor("reflective-is", "Reflective Armor (IS)", INNER_SPHERE, EXPERIMENTAL, 3058, 16.00, 10,
                "Reflective(Inner Sphere)", "Laser-Reflective(Inner Sphere)", "Reflective Armor(Inner Sphere)");
        d.armor("reflective-clan", "Reflective Armor (Clan)", CLAN, EXPERIMENTAL, 3061, 16.00, 5,
                "Reflective(Clan)", "Laser-Reflective(Clan)");
        d.armor("ferro-lamellor", "Ferro-Lamellor Armor", CLAN, EXPERIMENTAL, 3070, 17.92, 12,
                "Ferro-Lamellor Armor", "Ferro-Lamellor(Clan)");

        d.structure("standard", "Standard Structure", INNER_SPHERE, INTRODUCTORY, 2439, 0.100, 0,
                "Standard", "Standard Structure", "IS Standard", "Clan Standard");
        d.structure("endo-steel-is", "Endo Steel (IS)", INNER_SPHERE, STANDARD, 2487, 0.050, 14,
                "Endo Steel", "Endo-Steel", "IS Endo Steel", "IS Endo-Steel", "Endo Steel (Inner Sphere)",
                "Endo Steel Prototype", "IS Endo-Steel Prototype");
        d.structure("endo-steel-clan", "Endo Steel (Clan)", CLAN, STANDARD, 2827, 0.050, 7,
                "Clan Endo Steel", "Clan Endo-Steel", "Endo Steel (Clan)");
        d.structure("composite", "Composite Structure", INNER_SPHERE, ADVANCED, 3061, 0.050, 0,
                "Composite", "Composite Structure", "IS Composite");
        d.structure("reinforced", "Reinforced Structure (IS)", INNER_SPHERE, ADVANCED, 3057, 0.200, 0,
                "Reinforced", "Reinforced Structure", "IS Reinforced");
        d.structure("reinforced-clan", "Reinforced Structure (Clan)", CLAN, ADVANCED, 3065, 0.200, 0,
                "Clan Reinforced");
        d.structure("endo-composite-is", "Endo-Composite (IS)", INNER_SPHERE, ADVANCED, 3067, 0.075, 7,
                "Endo-Composite", "IS Endo-Composite");
        d.structure("endo-composite-clan", "Endo-Composite (Clan)", CLAN, ADVANCED, 3073, 0.075, 4,
                "Clan Endo-Composite", "Clan Endo Composite");
        d.structure("industrial", "Industrial Structure", INNER_SPHERE, INTRODUCTORY, 2350, 0.100, 0,
                "Industrial", "Industrial Structure", "IS Industrial", "Clan Industrial");

        d.heatSink("single", "Single Heat Sink", INNER_SPHERE, INTRODUCTORY, 2022, 1, 1, 1.00,
                "Single", "Single Heat Sink");
        d.heatSink("double-is", "Double Heat Sink (IS)", INNER_SPHERE, STANDARD, 2567, 2, 3, 1.00,
                "Double", "Double Heat Sink", "IS Double", "IS Double Heat Sink", "Double (Inner Sphere)");
        d.heatSink("double-clan", "Double Heat Sink (Clan)", CLAN, STANDARD, 2567, 2, 2, 1.00,
                "Clan Double", "Clan Double Heat Sink", "Double (Clan)");
        d.heatSink("compact", "Compact Heat Sink", INNER_SPHERE, EXPERIMENTAL, 3058, 1, 1, 1.50,
                "Compact", "Compact Heat Sink");
        d.heatSink("laser", "Laser Heat Sink", CLAN, EXPERIMENTAL, 3075, 2, 2, 1.00,
                "Laser", "Laser Heat Sink");

        d.gyro("standard", "Standard Gyro", INNER_SPHERE, INTRODUCTORY, 2300, 1.0, 4, false,
                "Standard", "Standard Gyro");
        d.gyro("xl", "XL Gyro", INNER_SPHERE, STANDARD, 3067, 0.5, 6, false, "XL Gyro");
        d.gyro("compact", "Compact Gyro", INNER_SPHERE, STANDARD, 3068, 1.5, 2, false, "Compact Gyro");
        d.gyro("heavy-duty", "Heavy-Duty Gyro", INNER_SPHERE, STANDARD, 3067, 2.0, 4, false,
                "Heavy Duty Gyro", "Heavy-Duty Gyro");
        d.gyro("superheavy", "Superheavy Gyro", INNER_SPHERE, ADVANCED, 3076, 2.0, 4, true, "Superheavy Gyro");

        d.cockpit("standard", "Standard Cockpit", INNER_SPHERE, INTRODUCTORY, 2468, 3.0, 1,
                "Standard", "Standard Cockpit");
        d.cockpit("small", "Small Cockpit", INNER_SPHERE, STANDARD, 3067, 2.0, 1, "Small", "Small Cockpit");
        d.cockpit("command-console", "Command Console", INNER_SPHERE, STANDARD, 2631, 3.0, 1, "Command Console");
        d.cockpit("torso-mounted", "Torso-Mounted Cockpit", INNER_SPHERE, STANDARD, 3053, 4.0, 1,
                "Torso Cockpit", "Torso-Mounted Cockpit");
        d.cockpit("industrial", "Industrial Cockpit", INNER_SPHERE, INTRODUCTORY, 2469, 3.0, 1,
                "Industrial", "Industrial Cockpit");
        d.cockpit("primitive", "Primitive Cockpit", INNER_SPHERE, ADVANCED, 2300, 5.0, 1,
                "Primitive", "Primitive Cockpit");

        d.myomer("standard", "Standard Myomer", INNER_SPHERE, INTRODUCTORY, 2439, "none",
                "Standard", "Standard Myomer");
        d.myomer("masc", "MASC", INNER_SPHERE, STANDARD, 2740, "sprint; risk of leg actuator failure",
                "MASC", "IS MASC", "ISMASC", "Clan MASC", "CLMASC");
        d.myomer("tsm", "Triple-Strength Myomer", INNER_SPHERE, STANDARD, 3050, "double physical damage when hot",
                "TSM", "Triple Strength Myomer", "Triple-Strength Myomer", "Triple-Strength", "Industrial Triple-Strength");
        d.myomer("industrial", "Industrial Myomer", INNER_SPHERE, INTRODUCTORY, 2300, "industrial grade",
                "Industrial", "Industrial Myomer");

        return new ReferenceCatalog(types);
    }

    public List<ComponentType> types(ComponentCategory category) {
        return types.getOrDefault(category, List.of());
    }

    public List<ComponentType> allTypes() {
        List<ComponentType> all = new ArrayList<>();
        types.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    private void validate() {
        for (ComponentCategory category : ComponentCategory.values()) {
            List<ComponentType> list = types(category);
            if (list.isEmpty()) {
                throw new IllegalStateException("No canonical types for category " + category);
            }
            if (category.defaultsToStandard()
                    && list.stream().noneMatch(t -> t.slug().equals(STANDARD_SLUG))) {
                throw new IllegalStateException("Category " + category + " has no standard entry");
            }
            Map<String, String> seen = new HashMap<>();
            for (ComponentType type : list) {
                for (String alias : type.aliases()) {
                    String previous = seen.put(AliasTable.normalize(alias), type.slug());
                    if (previous != null && !previous.equals(type.slug())) {
                        throw new IllegalStateException("Alias '" + alias + "' in " + category
                                + " maps to both " + previous + " and " + type.slug());
                    }
                }
            }
        }
    }

    private static final class Definer {
        private final Map<ComponentCategory, List<ComponentType>> types;

        Definer(Map<ComponentCategory, List<ComponentType>> types) {
            this.types = types;
        }

        void engine(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                    double weightMultiplier, int ctCrits, int stCrits, String... aliases) {
            add(ENGINE, slug, name, tb, rl, year, props("weight_multiplier", weightMultiplier,
                    "ct_crits", ctCrits, "st_crits", stCrits), aliases);
        }

        void armor(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                   double pointsPerTon, int crits, String... aliases) {
            add(ARMOR, slug, name, tb, rl, year, props("points_per_ton", pointsPerTon, "crits", crits), aliases);
        }

        void structure(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                       double weightFraction, int crits, String... aliases) {
            add(STRUCTURE, slug, name, tb, rl, year, props("weight_fraction", weightFraction, "crits", crits), aliases);
        }

        void heatSink(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                      int dissipation, int crits, double weight, String... aliases) {
            add(HEAT_SINK, slug, name, tb, rl, year, props("dissipation", dissipation, "crits", crits,
                    "weight", weight), aliases);
        }

        void gyro(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                  double weightMultiplier, int crits, boolean superheavyOnly, String... aliases) {
            add(GYRO, slug, name, tb, rl, year, props("weight_multiplier", weightMultiplier, "crits", crits,
                    "is_superheavy_only", superheavyOnly), aliases);
        }

        void cockpit(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                     double weight, int crits, String... aliases) {
            add(COCKPIT, slug, name, tb, rl, year, props("weight", weight, "crits", crits), aliases);
        }

        void myomer(String slug, String name, TechBase tb, RulesLevel rl, Integer year,
                    String properties, String... aliases) {
            add(MYOMER, slug, name, tb, rl, year, props("properties", properties), aliases);
        }

        private void add(ComponentCategory category, String slug, String name, TechBase tb, RulesLevel rl,
                         Integer year, Map<String, Object> properties, String... aliases) {
            types.computeIfAbsent(category, c -> new ArrayList<>())
                    .add(new ComponentType(category, slug, name, tb, rl, year, properties, List.of(aliases)));
        }

        private static Map<String, Object> props(Object... keyValues) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keyValues.length; i += 2) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
            return map;
        }
    }
}
