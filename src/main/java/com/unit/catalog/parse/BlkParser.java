package com.unit.catalog.parse;

import com.unit.catalog.core.model.LocationName;
import com.unit.catalog.core.model.ParsedLoadoutEntry;
import com.unit.catalog.core.model.ParsedUnit;
import com.unit.catalog.core.model.RulesLevel;
import com.unit.catalog.core.model.TechBase;
import com.unit.catalog.core.model.UnitType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for tag-delimited unit files ({@code <Tag>} ... {@code </Tag>}), used for every
 * unit category except mechs.
 *
 * <p>Blocks whose tag ends in {@code Equipment} hold one item per line for the location
 * named by the tag prefix. All other tags are read as scalar fields. The unit category
 * comes from the {@code UnitType} tag when it is recognised, else from the default
 * supplied by the archive layout.</p>
 */
public class BlkParser implements UnitFileParser {

    private static final String EQUIPMENT_SUFFIX = "equipment";

    private final UnitType defaultUnitType;

    public BlkParser(UnitType defaultUnitType) {
        this.defaultUnitType = defaultUnitType != null ? defaultUnitType : UnitType.OTHER;
    }

    public UnitType getDefaultUnitType() {
        return defaultUnitType;
    }

    @Override
    public ParseOutcome parse(String content) {
        if (content == null || content.isBlank()) {
            return ParseOutcome.rejected("empty file");
        }

        Map<String, String> tags = new HashMap<>();
        List<String[]> equipmentLines = new ArrayList<>();

        String currentTag = null;
        StringBuilder currentValue = new StringBuilder();

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("</")) {
                if (currentTag != null) {
                    closeTag(currentTag, currentValue.toString().trim(), tags, equipmentLines);
                    currentTag = null;
                }
            } else if (line.startsWith("<") && line.endsWith(">") && line.length() > 2) {
                currentTag = line.substring(1, line.length() - 1);
                currentValue.setLength(0);
            } else if (currentTag != null && !line.isEmpty()) {
                if (currentValue.length() > 0) {
                    currentValue.append('\n');
                }
                currentValue.append(line);
            }
        }

        String name = tags.get("Name");
        if (name == null || name.isBlank()) {
            return ParseOutcome.rejected("missing Name tag");
        }
        String tonnageText = tags.get("tonnage");
        if (tonnageText == null) {
            return ParseOutcome.rejected("missing tonnage tag");
        }
        Double tonnage = MtfParser.parseDouble(tonnageText);
        if (tonnage == null) {
            return ParseOutcome.rejected("invalid tonnage '" + tonnageText + "'");
        }

        String typeText = tags.getOrDefault("type", "");
        String externalId = tags.containsKey("mul id:") ? tags.get("mul id:") : tags.get("mul id");

        ParsedUnit.Builder unit = ParsedUnit.builder()
                .chassis(name.trim())
                .model(tags.getOrDefault("Model", "").trim())
                .externalId(externalId != null ? MtfParser.parseInt(externalId) : null)
                .tonnage(tonnage)
                .introYear(tags.containsKey("year") ? MtfParser.parseInt(tags.get("year")) : null)
                .source(tags.containsKey("source") ? tags.get("source").trim() : null)
                .unitType(resolveUnitType(tags.get("UnitType")))
                .techBase(TechBase.fromText(typeText))
                .rulesLevel(RulesLevel.fromTypeText(typeText))
                .description(tags.containsKey("overview") ? MtfParser.stripQuotes(tags.get("overview")) : null);

        for (String[] line : equipmentLines) {
            LocationName location = LocationName.fromBlockPrefix(line[0]).orElse(null);
            unit.addLoadout(new ParsedLoadoutEntry(line[1], location, 1, false));
        }
        return ParseOutcome.parsed(unit.build());
    }

    private void closeTag(String tag, String value, Map<String, String> tags, List<String[]> equipmentLines) {
        String lower = tag.toLowerCase(Locale.ROOT);
        if (lower.endsWith(EQUIPMENT_SUFFIX)) {
            String prefix = lower.substring(0, lower.length() - EQUIPMENT_SUFFIX.length()).trim();
            for (String item : value.split("\\R")) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    equipmentLines.add(new String[]{prefix, trimmed});
                }
            }
        } else {
            tags.put(tag, value);
        }
    }

    UnitType resolveUnitType(String unitTypeTag) {
        if (unitTypeTag == null) {
            return defaultUnitType;
        }
        return switch (unitTypeTag.trim().toLowerCase(Locale.ROOT)) {
            case "tank", "vtol", "naval", "wheeled vehicle", "tracked vehicle", "supporttank", "supportvtol" ->
                    UnitType.VEHICLE;
            case "aero", "aerospacefighter", "conv_fighter", "conventional fighter", "convfighter" ->
                    UnitType.FIGHTER;
            default -> defaultUnitType;
        };
    }
}
