package com.unit.catalog.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit as read from one unit file, before any persistence. Both file formats produce
 * this shape; only the line-oriented mech format fills in {@link MechAttributes}.
 */
public class ParsedUnit {
    private final String chassis;
    private final String model;
    private final Integer externalId;
    private final UnitType unitType;
    private final TechBase techBase;
    private final RulesLevel rulesLevel;
    private final Integer introYear;
    private final String source;
    private final double tonnage;
    private final List<ParsedLocation> locations;
    private final List<ParsedLoadoutEntry> loadout;
    private final List<String> quirks;
    private final String description;
    private final MechAttributes mechAttributes;

    private ParsedUnit(Builder builder) {
        this.chassis = Objects.requireNonNull(builder.chassis, "chassis must not be null");
        this.model = builder.model != null ? builder.model : "";
        this.externalId = builder.externalId;
        this.unitType = builder.unitType != null ? builder.unitType : UnitType.OTHER;
        this.techBase = builder.techBase != null ? builder.techBase : TechBase.INNER_SPHERE;
        this.rulesLevel = builder.rulesLevel != null ? builder.rulesLevel : RulesLevel.STANDARD;
        this.introYear = builder.introYear;
        this.source = builder.source;
        this.tonnage = builder.tonnage;
        this.locations = List.copyOf(builder.locations);
        this.loadout = List.copyOf(builder.loadout);
        this.quirks = List.copyOf(builder.quirks);
        this.description = builder.description;
        this.mechAttributes = builder.mechAttributes;
    }

    public String getChassis() {
        return chassis;
    }

    public String getModel() {
        return model;
    }

    public String getFullName() {
        return Slugs.fullName(chassis, model);
    }

    public String getSlug() {
        return Slugs.unitSlug(chassis, model);
    }

    public String getChassisSlug() {
        return Slugs.chassisSlug(chassis, unitType);
    }

    /**
     * Identifier of this unit in the external catalog, when the unit file carries one.
     */
    public Optional<Integer> getExternalId() {
        return Optional.ofNullable(externalId);
    }

    public UnitType getUnitType() {
        return unitType;
    }

    public TechBase getTechBase() {
        return techBase;
    }

    public RulesLevel getRulesLevel() {
        return rulesLevel;
    }

    public Integer getIntroYear() {
        return introYear;
    }

    public String getSource() {
        return source;
    }

    public double getTonnage() {
        return tonnage;
    }

    public List<ParsedLocation> getLocations() {
        return locations;
    }

    public List<ParsedLoadoutEntry> getLoadout() {
        return loadout;
    }

    public List<String> getQuirks() {
        return quirks;
    }

    public String getDescription() {
        return description;
    }

    public Optional<MechAttributes> getMechAttributes() {
        return Optional.ofNullable(mechAttributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ParsedUnit{slug='" + getSlug() + "', type=" + unitType + ", tonnage=" + tonnage +
                ", locations=" + locations.size() + ", loadout=" + loadout.size() + '}';
    }

    public static class Builder {
        private String chassis;
        private String model;
        private Integer externalId;
        private UnitType unitType;
        private TechBase techBase;
        private RulesLevel rulesLevel;
        private Integer introYear;
        private String source;
        private double tonnage;
        private final List<ParsedLocation> locations = new ArrayList<>();
        private final List<ParsedLoadoutEntry> loadout = new ArrayList<>();
        private final List<String> quirks = new ArrayList<>();
        private String description;
        private MechAttributes mechAttributes;

        public Builder chassis(String chassis) {
            this.chassis = chassis;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder externalId(Integer externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder unitType(UnitType unitType) {
            this.unitType = unitType;
            return this;
        }

        public Builder techBase(TechBase techBase) {
            this.techBase = techBase;
            return this;
        }

        public Builder rulesLevel(RulesLevel rulesLevel) {
            this.rulesLevel = rulesLevel;
            return this;
        }

        public Builder introYear(Integer introYear) {
            this.introYear = introYear;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder tonnage(double tonnage) {
            this.tonnage = tonnage;
            return this;
        }

        public Builder locations(List<ParsedLocation> locations) {
            this.locations.clear();
            this.locations.addAll(locations);
            return this;
        }

        public Builder addLocation(ParsedLocation location) {
            this.locations.add(location);
            return this;
        }

        /**
         * Replaces the loadout, merging entries with the same placement into one
         * entry with the summed quantity.
         */
        public Builder loadout(List<ParsedLoadoutEntry> entries) {
            this.loadout.clear();
            entries.forEach(this::addLoadout);
            return this;
        }

        public Builder addLoadout(ParsedLoadoutEntry entry) {
            for (int i = 0; i < loadout.size(); i++) {
                ParsedLoadoutEntry existing = loadout.get(i);
                if (existing.samePlacement(entry)) {
                    int total;
                    try {
                        total = Math.addExact(existing.quantity(), entry.quantity());
                    } catch (ArithmeticException e) {
                        throw new IllegalArgumentException("quantity overflow for " + entry.equipment(), e);
                    }
                    loadout.set(i, existing.withQuantity(total));
                    return this;
                }
            }
            loadout.add(entry);
            return this;
        }

        public Builder addQuirk(String quirkSlug) {
            if (quirkSlug != null && !quirkSlug.isEmpty() && !quirks.contains(quirkSlug)) {
                quirks.add(quirkSlug);
            }
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder mechAttributes(MechAttributes mechAttributes) {
            this.mechAttributes = mechAttributes;
            return this;
        }

        public ParsedUnit build() {
            if (chassis == null || chassis.isBlank()) {
                throw new IllegalArgumentException("chassis must not be blank");
            }
            return new ParsedUnit(this);
        }
    }
}
