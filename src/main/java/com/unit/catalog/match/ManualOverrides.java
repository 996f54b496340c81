package com.unit.catalog.match;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-curated mapping from external id to unit slug, read from JSON such as
 * {@code {"142": "atlas-as7-d-dc"}}.
 */
public class ManualOverrides {
    private static final Logger log = LoggerFactory.getLogger(ManualOverrides.class);

    private final Map<Integer, String> targets;

    public ManualOverrides(Map<Integer, String> targets) {
        this.targets = Map.copyOf(targets);
    }

    public static ManualOverrides empty() {
        return new ManualOverrides(Map.of());
    }

    public static ManualOverrides load(Path file) {
        return load(file, new ObjectMapper());
    }

    public static ManualOverrides load(Path file, ObjectMapper objectMapper) {
        Map<String, String> raw;
        try {
            raw = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read manual overrides " + file, e);
        }
        Map<Integer, String> targets = new HashMap<>();
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            int externalId;
            try {
                externalId = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Override key is not an external id: " + entry.getKey(), e);
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException("Override for " + externalId + " has no target slug");
            }
            targets.put(externalId, entry.getValue().trim());
        }
        log.info("match.overrides.loaded file={} count={}", file, targets.size());
        return new ManualOverrides(targets);
    }

    public Optional<String> target(int externalId) {
        return Optional.ofNullable(targets.get(externalId));
    }

    public int size() {
        return targets.size();
    }
}
