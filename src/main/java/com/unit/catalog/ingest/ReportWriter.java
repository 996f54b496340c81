package com.unit.catalog.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes run reports as indented JSON so operators can inspect what was skipped,
 * rejected or left unresolved.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this(new ObjectMapper());
    }

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Object report, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writeValue(file.toFile(), report);
            log.info("report.written file={}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + file, e);
        }
    }
}
