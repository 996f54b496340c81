package com.unit.catalog.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Durable local copy of every raw response from the external catalog.
 *
 * <pre>
 * {root}/quicklist/{type}/{min}-{max}.json
 * {root}/quicklist/{type}/{min}-{max}.json.malformed
 * {root}/details/{id}.html
 * {root}/failures.json
 * {root}/manifest.json
 * </pre>
 *
 * <p>Files are written to a temporary sibling and moved into place, so a file that exists
 * is always complete. Presence of a file is what marks a resource as done.</p>
 */
public class RawResponseStore {
    private static final Logger log = LoggerFactory.getLogger(RawResponseStore.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    public RawResponseStore(Path root) {
        this(root, new ObjectMapper());
    }

    public RawResponseStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getRoot() {
        return root;
    }

    // ========== Listings ==========

    public static String quickListKey(int unitType, TonnagePartition partition) {
        return "quicklist/" + unitType + "/" + partition.key();
    }

    Path quickListPath(int unitType, TonnagePartition partition) {
        return root.resolve("quicklist").resolve(String.valueOf(unitType)).resolve(partition.key() + ".json");
    }

    public boolean hasQuickList(int unitType, TonnagePartition partition) {
        return Files.isRegularFile(quickListPath(unitType, partition));
    }

    public void writeQuickList(int unitType, TonnagePartition partition, String json) {
        writeAtomically(quickListPath(unitType, partition), json);
    }

    public Optional<String> readQuickList(int unitType, TonnagePartition partition) {
        return read(quickListPath(unitType, partition));
    }

    /**
     * Every stored listing body, in path order.
     */
    public List<String> allQuickLists() {
        return new ArrayList<>(storedQuickLists().values());
    }

    /**
     * Every stored listing body keyed by its resource key, in path order.
     */
    public Map<String, String> storedQuickLists() {
        Path dir = root.resolve("quicklist");
        if (!Files.isDirectory(dir)) {
            return Map.of();
        }
        try (Stream<Path> files = Files.walk(dir)) {
            List<Path> paths = files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
            Map<String, String> bodies = new LinkedHashMap<>();
            for (Path path : paths) {
                String name = path.getFileName().toString();
                String key = "quicklist/" + path.getParent().getFileName() + "/"
                        + name.substring(0, name.length() - ".json".length());
                bodies.put(key, Files.readString(path, StandardCharsets.UTF_8));
            }
            return bodies;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read stored listings under " + dir, e);
        }
    }

    /**
     * Moves a stored listing that cannot be read aside, keeping the body for inspection
     * and leaving the partition unfetched for the next run.
     *
     * @return the path the body was moved to
     */
    public Path quarantineQuickList(int unitType, TonnagePartition partition) {
        Path file = quickListPath(unitType, partition);
        Path target = file.resolveSibling(partition.key() + ".json.malformed");
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("raw.quarantined file={} target={}", file, target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot move aside " + file, e);
        }
    }

    // ========== Detail pages ==========

    public static String detailKey(int externalId) {
        return "details/" + externalId;
    }

    Path detailPath(int externalId) {
        return root.resolve("details").resolve(externalId + ".html");
    }

    public boolean hasDetail(int externalId) {
        return Files.isRegularFile(detailPath(externalId));
    }

    public void writeDetail(int externalId, String html) {
        writeAtomically(detailPath(externalId), html);
    }

    public Optional<String> readDetail(int externalId) {
        return read(detailPath(externalId));
    }

    // ========== Failure ledger and manifest ==========

    public Map<String, FetchFailure> loadFailures() {
        Path file = root.resolve("failures.json");
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            List<FetchFailure> failures = objectMapper.readValue(file.toFile(), new TypeReference<List<FetchFailure>>() {});
            Map<String, FetchFailure> byResource = new LinkedHashMap<>();
            failures.forEach(f -> byResource.put(f.resource(), f));
            return byResource;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read failure ledger " + file, e);
        }
    }

    public void saveFailures(Map<String, FetchFailure> failures) {
        writeJson(root.resolve("failures.json"), new ArrayList<>(failures.values()));
    }

    public void writeManifest(FetchManifest manifest) {
        writeJson(root.resolve("manifest.json"), manifest);
    }

    public Optional<FetchManifest> readManifest() {
        Path file = root.resolve("manifest.json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), FetchManifest.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read manifest " + file, e);
        }
    }

    private void writeJson(Path file, Object value) {
        try {
            writeAtomically(file, objectMapper.writeValueAsString(value));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialise " + file.getFileName(), e);
        }
    }

    private Optional<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private void writeAtomically(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.trace("raw.written file={} bytes={}", file, content.length());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }
}
