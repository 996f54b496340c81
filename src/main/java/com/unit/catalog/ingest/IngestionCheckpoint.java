package com.unit.catalog.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only record of archive entries whose unit has been committed. A restarted run
 * skips every entry listed here.
 */
public class IngestionCheckpoint implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionCheckpoint.class);

    private final Set<String> committed = ConcurrentHashMap.newKeySet();
    private final BufferedWriter writer;

    private IngestionCheckpoint(BufferedWriter writer) {
        this.writer = writer;
    }

    /**
     * A checkpoint that remembers nothing and writes nothing.
     */
    public static IngestionCheckpoint disabled() {
        return new IngestionCheckpoint(null);
    }

    public static IngestionCheckpoint open(Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            IngestionCheckpoint checkpoint = new IngestionCheckpoint(Files.newBufferedWriter(file,
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND));
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    checkpoint.committed.add(line.trim());
                }
            }
            log.info("checkpoint.opened file={} committed={}", file, checkpoint.committed.size());
            return checkpoint;
        } catch (IOException e) {
            throw new IngestionSetupException("Cannot open checkpoint file " + file, e);
        }
    }

    public boolean isCommitted(String entryName) {
        return committed.contains(entryName);
    }

    public int size() {
        return committed.size();
    }

    public synchronized void markCommitted(String entryName) {
        if (!committed.add(entryName) || writer == null) {
            return;
        }
        try {
            writer.write(entryName);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new IngestionSetupException("Cannot append to checkpoint file", e);
        }
    }

    @Override
    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            throw new IngestionSetupException("Cannot close checkpoint file", e);
        }
    }
}
