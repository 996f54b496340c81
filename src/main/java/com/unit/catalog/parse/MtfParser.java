package com.unit.catalog.parse;

import com.unit.catalog.core.model.ComponentCategory;
import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.MechAttributes;
import com.unit.catalog.core.model.ParsedLoadoutEntry;
import com.unit.catalog.core.model.ParsedLocation;
import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.Slugs;
import com.unit.catalog.core.model.TechBase;
import com.unit.catalog.core.model.UnitType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for line-oriented {@code key:value} mech files.
 *
 * <p>Besides the common unit fields this format yields per-location armor, the loadout
 * (from the {@code Weapons:} list and from the critical-slot sections) and the
 * mechanical attributes. Weapons named in the {@code Weapons:} list are taken from there
 * only; critical-slot sections add everything else, one quantity per occupied slot.</p>
 */
public class MtfParser implements UnitFileParser {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)\\s+(.+)$");
    private static final String REAR_SUFFIX = "(R)";
    private static final String EMPTY_SLOT = "-Empty-";

    private static final Set<String> STRUCTURAL_SLOTS = Set.of(
            "Shoulder", "Upper Arm Actuator", "Lower Arm Actuator", "Hand Actuator",
            "Hip", "Upper Leg Actuator", "Lower Leg Actuator", "Foot Actuator",
            "Life Support", "Sensors", "Cockpit", "Gyro", "Compact Gyro",
            "Heavy Duty Gyro", "XL Gyro", EMPTY_SLOT);

    private static final List<String> STRUCTURAL_FRAGMENTS = List.of(
            "Engine", "Endo Steel", "Endo-Steel", "Ferro-Fibrous", "Reactive Armor",
            "Stealth Armor", "CASE");

    private static final String[][] ARMOR_CODES = {
            {"LA", "left_arm"}, {"RA", "right_arm"}, {"LT", "left_torso"}, {"RT", "right_torso"},
            {"CT", "center_torso"}, {"HD", "head"}, {"LL", "left_leg"}, {"RL", "right_leg"}};

    @Override
    public ParseOutcome parse(String content) {
        if (content == null || content.isBlank()) {
            return ParseOutcome.rejected("empty file");
        }

        ParsedUnit.Builder unit = ParsedUnit.builder().unitType(UnitType.MECH);
        MechAttributes.Builder mech = MechAttributes.builder();
        String chassis = null;
        Double mass = null;
        boolean sawMechKey = false;

        Map<String, Integer[]> armor = new HashMap<>();
        List<ParsedLoadoutEntry> weaponList = new ArrayList<>();
        List<ParsedLoadoutEntry> slotEntries = new ArrayList<>();

        LocationName currentSection = null;
        boolean inWeapons = false;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            int colon = line.indexOf(':');
            boolean keyLine = colon >= 0 && line.substring(0, colon).indexOf(',') < 0;
            if (inWeapons && !keyLine && line.contains(",")) {
                parseWeaponLine(line, weaponList);
                continue;
            }
            inWeapons = false;

            if (colon < 0) {
                if (currentSection != null) {
                    addSlotEntry(line, currentSection, slotEntries);
                }
                continue;
            }

            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            if (value.isEmpty()) {
                currentSection = LocationName.fromMechText(key).orElse(null);
                continue;
            }
            currentSection = null;

            switch (key) {
                case "chassis" -> chassis = value;
                case "model" -> unit.model(value);
                case "mul id" -> unit.externalId(parseInt(value));
                case "config" -> {
                    mech.config(value);
                    mech.omnimech(value.toLowerCase(Locale.ROOT).contains("omnimech"));
                    sawMechKey = true;
                }
                case "techbase", "tech base" -> unit.techBase(TechBase.fromText(value));
                case "era" -> unit.introYear(parseInt(value));
                case "source" -> unit.source(value);
                case "rules level" -> {
                    Integer level = parseInt(value);
                    unit.rulesLevel(level != null ? RulesLevel.fromLevel(level) : RulesLevel.STANDARD);
                }
                case "mass" -> mass = parseDouble(value);
                case "quirk" -> unit.addQuirk(Slugs.toSlug(value));
                case "overview" -> unit.description(stripQuotes(value));
                case "engine" -> {
                    Matcher m = LEADING_NUMBER.matcher(value);
                    if (m.matches()) {
                        mech.engineRating(parseInt(m.group(1)));
                        mech.label(ComponentCategory.ENGINE, m.group(2));
                    } else {
                        mech.label(ComponentCategory.ENGINE, value);
                    }
                    sawMechKey = true;
                }
                case "heat sinks" -> {
                    Matcher m = LEADING_NUMBER.matcher(value);
                    if (m.matches()) {
                        mech.heatSinkCount(parseInt(m.group(1)));
                        mech.label(ComponentCategory.HEAT_SINK, m.group(2));
                    } else {
                        Integer count = parseInt(value);
                        if (count != null) {
                            mech.heatSinkCount(count);
                        } else {
                            mech.label(ComponentCategory.HEAT_SINK, value);
                        }
                    }
                }
                case "walk mp" -> mech.walkMp(parseInt(value));
                case "jump mp" -> mech.jumpMp(parseInt(value));
                case "structure" -> mech.label(ComponentCategory.STRUCTURE, value);
                case "armor" -> mech.label(ComponentCategory.ARMOR, value);
                case "gyro" -> mech.label(ComponentCategory.GYRO, value);
                case "cockpit" -> mech.label(ComponentCategory.COCKPIT, value);
                case "myomer" -> mech.label(ComponentCategory.MYOMER, value);
                case "weapons" -> inWeapons = true;
                default -> {
                    if (key.endsWith(" armor")) {
                        recordArmor(key.substring(0, key.length() - " armor".length()), value, armor);
                    }
                }
            }
        }

        if (chassis == null || chassis.isBlank()) {
            return ParseOutcome.rejected("missing chassis");
        }
        if (mass == null) {
            return ParseOutcome.rejected("missing or invalid mass");
        }

        unit.chassis(chassis).tonnage(mass);
        unit.locations(buildLocations(armor));

        Set<String> listedWeapons = new LinkedHashSet<>();
        try {
            for (ParsedLoadoutEntry entry : weaponList) {
                listedWeapons.add(entry.equipment());
                unit.addLoadout(entry);
            }
            for (ParsedLoadoutEntry entry : slotEntries) {
                if (!listedWeapons.contains(entry.equipment())) {
                    unit.addLoadout(entry);
                }
            }
        } catch (IllegalArgumentException e) {
            return ParseOutcome.rejected(e.getMessage());
        }
        if (sawMechKey) {
            unit.mechAttributes(mech.build());
        }
        return ParseOutcome.parsed(unit.build());
    }

    /**
     * Parses {@code "[qty] name, location[, Ammo:N]"}.
     */
    private void parseWeaponLine(String line, List<ParsedLoadoutEntry> out) {
        String[] parts = line.split(",", 3);
        if (parts.length < 2) {
            return;
        }
        String namePart = parts[0].trim();
        int quantity = 1;
        Matcher m = LEADING_NUMBER.matcher(namePart);
        if (m.matches()) {
            Integer parsed = parseInt(m.group(1));
            if (parsed == null) {
                return;
            }
            quantity = parsed;
            namePart = m.group(2).trim();
        }
        if (namePart.isEmpty() || namePart.equals(EMPTY_SLOT) || quantity <= 0) {
            return;
        }
        String rawLocation = parts[1].trim();
        boolean rear = rawLocation.endsWith(REAR_SUFFIX);
        if (rear) {
            rawLocation = rawLocation.substring(0, rawLocation.length() - REAR_SUFFIX.length()).trim();
        }
        LocationName location = LocationName.fromMechText(rawLocation).orElse(null);
        out.add(new ParsedLoadoutEntry(namePart, location, quantity, rear));
    }

    private void addSlotEntry(String line, LocationName section, List<ParsedLoadoutEntry> out) {
        boolean rear = line.endsWith(REAR_SUFFIX);
        String name = rear ? line.substring(0, line.length() - REAR_SUFFIX.length()).trim() : line;
        if (name.toLowerCase(Locale.ROOT).endsWith("(omnipod)")) {
            name = name.substring(0, name.length() - "(omnipod)".length()).trim();
        }
        if (name.isEmpty() || isStructural(name)) {
            return;
        }
        ParsedLoadoutEntry entry = new ParsedLoadoutEntry(name, section, 1, rear);
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i).samePlacement(entry)) {
                out.set(i, out.get(i).withQuantity(out.get(i).quantity() + 1));
                return;
            }
        }
        out.add(entry);
    }

    static boolean isStructural(String slot) {
        if (STRUCTURAL_SLOTS.contains(slot)) {
            return true;
        }
        for (String fragment : STRUCTURAL_FRAGMENTS) {
            if (slot.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private void recordArmor(String code, String value, Map<String, Integer[]> armor) {
        Integer points = parseInt(value);
        switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "RTL" -> armor.computeIfAbsent("LT", k -> new Integer[2])[1] = points;
            case "RTR" -> armor.computeIfAbsent("RT", k -> new Integer[2])[1] = points;
            case "RTC" -> armor.computeIfAbsent("CT", k -> new Integer[2])[1] = points;
            default -> armor.computeIfAbsent(code.trim().toUpperCase(Locale.ROOT), k -> new Integer[2])[0] = points;
        }
    }

    private List<ParsedLocation> buildLocations(Map<String, Integer[]> armor) {
        Map<LocationName, ParsedLocation> ordered = new EnumMap<>(LocationName.class);
        for (String[] code : ARMOR_CODES) {
            Integer[] values = armor.get(code[0]);
            if (values != null) {
                LocationName location = LocationName.fromDbValue(code[1]);
                ordered.put(location, new ParsedLocation(location, values[0], values[1], null));
            }
        }
        return new ArrayList<>(ordered.values());
    }

    static Integer parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String stripQuotes(String value) {
        String trimmed = value.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '"') start++;
        while (end > start && trimmed.charAt(end - 1) == '"') end--;
        return trimmed.substring(start, end);
    }
}
