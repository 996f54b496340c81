package com.unit.catalog.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mechanical attributes of a mech, as read from its unit file. Component labels are kept
 * verbatim; resolution to canonical types happens later against the alias tables.
 */
public class MechAttributes {
    private final String config;
    private final boolean omnimech;
    private final Integer engineRating;
    private final Integer walkMp;
    private final Integer jumpMp;
    private final Integer heatSinkCount;
    private final Map<ComponentCategory, String> labels;

    private MechAttributes(Builder builder) {
        this.config = builder.config != null ? builder.config : "";
        this.omnimech = builder.omnimech;
        this.engineRating = builder.engineRating;
        this.walkMp = builder.walkMp;
        this.jumpMp = builder.jumpMp;
        this.heatSinkCount = builder.heatSinkCount;
        this.labels = new EnumMap<>(ComponentCategory.class);
        this.labels.putAll(builder.labels);
    }

    public String getConfig() {
        return config;
    }

    public boolean isOmnimech() {
        return omnimech;
    }

    public Integer getEngineRating() {
        return engineRating;
    }

    public Integer getWalkMp() {
        return walkMp;
    }

    public Integer getJumpMp() {
        return jumpMp;
    }

    public Integer getHeatSinkCount() {
        return heatSinkCount;
    }

    /**
     * Returns the raw label for a category, or null if the unit file omitted it.
     */
    public String getLabel(ComponentCategory category) {
        return labels.get(category);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MechAttributes that = (MechAttributes) o;
        return omnimech == that.omnimech
                && config.equals(that.config)
                && Objects.equals(engineRating, that.engineRating)
                && Objects.equals(walkMp, that.walkMp)
                && Objects.equals(jumpMp, that.jumpMp)
                && Objects.equals(heatSinkCount, that.heatSinkCount)
                && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(config, omnimech, engineRating, walkMp, jumpMp, heatSinkCount, labels);
    }

    @Override
    public String toString() {
        return "MechAttributes{config='" + config + "', omnimech=" + omnimech +
                ", engineRating=" + engineRating + ", labels=" + labels + '}';
    }

    public static class Builder {
        private String config;
        private boolean omnimech;
        private Integer engineRating;
        private Integer walkMp;
        private Integer jumpMp;
        private Integer heatSinkCount;
        private final Map<ComponentCategory, String> labels = new EnumMap<>(ComponentCategory.class);

        public Builder config(String config) {
            this.config = config;
            return this;
        }

        public Builder omnimech(boolean omnimech) {
            this.omnimech = omnimech;
            return this;
        }

        public Builder engineRating(Integer engineRating) {
            this.engineRating = engineRating;
            return this;
        }

        public Builder walkMp(Integer walkMp) {
            this.walkMp = walkMp;
            return this;
        }

        public Builder jumpMp(Integer jumpMp) {
            this.jumpMp = jumpMp;
            return this;
        }

        public Builder heatSinkCount(Integer heatSinkCount) {
            this.heatSinkCount = heatSinkCount;
            return this;
        }

        public Builder label(ComponentCategory category, String label) {
            if (label == null || label.isBlank()) {
                labels.remove(category);
            } else {
                labels.put(category, label.trim());
            }
            return this;
        }

        public MechAttributes build() {
            return new MechAttributes(this);
        }
    }
}
