package com.unit.catalog.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads listing JSON into {@link CatalogRecord}s.
 *
 * <p>Accepts either {@code {"Units": [...]}} or a bare array. The listing uses zero for a
 * missing battle value or cost; both are read as absent.</p>
 */
public class QuickListParser {
    private static final Logger log = LoggerFactory.getLogger(QuickListParser.class);

    private final ObjectMapper objectMapper;

    public QuickListParser() {
        this(new ObjectMapper());
    }

    public QuickListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CatalogRecord> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed listing JSON", e);
        }
        JsonNode units = root.isArray() ? root : root.path("Units");
        if (!units.isArray()) {
            log.warn("quicklist.unexpectedShape fields={}", root.size());
            return List.of();
        }
        List<CatalogRecord> records = new ArrayList<>(units.size());
        for (JsonNode unit : units) {
            if (!unit.hasNonNull("Id") || !unit.hasNonNull("Name")) {
                log.debug("quicklist.entry.skipped reason=missing id or name");
                continue;
            }
            records.add(new CatalogRecord(
                    unit.get("Id").asInt(),
                    unit.get("Name").asText(),
                    text(unit, "Class"),
                    text(unit, "Variant"),
                    unit.path("Tonnage").asDouble(),
                    positiveInt(unit.get("BattleValue")),
                    positiveLong(unit.get("Cost")),
                    text(unit, "Rules"),
                    introYear(text(unit, "DateIntroduced")),
                    nestedName(unit, "Technology"),
                    nestedName(unit, "Role"),
                    nestedName(unit, "Type")));
        }
        return records;
    }

    /**
     * Parses every body and keeps the first record seen for each external id.
     * Malformed bodies are skipped.
     */
    public List<CatalogRecord> parseAll(Collection<String> bodies) {
        Map<String, String> keyed = new LinkedHashMap<>();
        int i = 0;
        for (String body : bodies) {
            keyed.put("listing-" + i++, body);
        }
        return parseAll(keyed).records();
    }

    /**
     * Parses every body keyed by resource, keeping the first record seen for each external id.
     * A malformed body is skipped and its key reported in {@link ParsedListings#malformed()}.
     */
    public ParsedListings parseAll(Map<String, String> bodiesByKey) {
        Map<Integer, CatalogRecord> byId = new LinkedHashMap<>();
        List<String> malformed = new ArrayList<>();
        for (Map.Entry<String, String> body : bodiesByKey.entrySet()) {
            List<CatalogRecord> records;
            try {
                records = parse(body.getValue());
            } catch (UncheckedIOException e) {
                log.warn("quicklist.malformed resource={} error={}", body.getKey(), e.getCause().getMessage());
                malformed.add(body.getKey());
                continue;
            }
            for (CatalogRecord record : records) {
                byId.putIfAbsent(record.externalId(), record);
            }
        }
        return new ParsedListings(new ArrayList<>(byId.values()), malformed);
    }

    /**
     * Records from every readable listing, plus the keys of the listings that were not readable.
     */
    public record ParsedListings(List<CatalogRecord> records, List<String> malformed) {
        public ParsedListings {
            records = List.copyOf(records);
            malformed = List.copyOf(malformed);
        }
    }

    /**
     * First run of four digits in the text, or null.
     */
    static Integer introYear(String dateIntroduced) {
        if (dateIntroduced == null) {
            return null;
        }
        String s = dateIntroduced.trim();
        for (int i = 0; i + 4 <= s.length(); i++) {
            if (Character.isDigit(s.charAt(i)) && Character.isDigit(s.charAt(i + 1))
                    && Character.isDigit(s.charAt(i + 2)) && Character.isDigit(s.charAt(i + 3))) {
                return Integer.parseInt(s.substring(i, i + 4));
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String nestedName(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? text(value, "Name") : null;
    }

    private static Integer positiveInt(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return null;
        }
        int v = value.asInt();
        return v > 0 ? v : null;
    }

    private static Long positiveLong(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return null;
        }
        long v = value.asLong();
        return v > 0 ? v : null;
    }
}
