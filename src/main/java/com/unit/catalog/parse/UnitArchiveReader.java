package com.unit.catalog.parse;

import com.unit.catalog.ingest.IngestionSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads unit files out of a zip archive.
 *
 * <p>Opening the archive is a setup step: an unreadable archive raises
 * {@link IngestionSetupException} and the whole run stops. Once open, entries are
 * handed to the visitor one at a time; entries that are not unit files are counted
 * through {@link EntryVisitor#skipped(String)}.</p>
 */
public class UnitArchiveReader implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitArchiveReader.class);

    private final Path archivePath;
    private final ZipFile zipFile;

    public UnitArchiveReader(Path archivePath) {
        this.archivePath = archivePath;
        try {
            this.zipFile = new ZipFile(archivePath.toFile());
        } catch (IOException e) {
            throw new IngestionSetupException("Cannot open unit archive " + archivePath, e);
        }
        log.info("archive.opened path={} entries={}", archivePath, zipFile.size());
    }

    public int size() {
        return zipFile.size();
    }

    /**
     * Visits every entry in archive order.
     *
     * @return the number of unit files handed to {@link EntryVisitor#unitFile(ArchiveEntry)}
     */
    public int forEachEntry(EntryVisitor visitor) {
        int unitFiles = 0;
        Enumeration<? extends ZipEntry> entries = zipFile.entries();
        while (entries.hasMoreElements()) {
            ZipEntry zipEntry = entries.nextElement();
            String name = zipEntry.getName();
            Optional<ArchiveEntry.Classification> classification =
                    zipEntry.isDirectory() ? Optional.empty() : ArchiveEntry.classify(name);
            if (classification.isEmpty()) {
                visitor.skipped(name);
                continue;
            }
            byte[] content = readEntry(zipEntry);
            unitFiles++;
            if (!visitor.unitFile(new ArchiveEntry(name, classification.get().format(),
                    classification.get().defaultUnitType(), content))) {
                log.info("archive.visit.stopped path={} after={}", archivePath, unitFiles);
                break;
            }
        }
        return unitFiles;
    }

    private byte[] readEntry(ZipEntry entry) {
        try (InputStream in = zipFile.getInputStream(entry)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IngestionSetupException("Cannot read archive entry " + entry.getName(), e);
        }
    }

    @Override
    public void close() {
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("archive.close.failed path={} error={}", archivePath, e.getMessage());
        }
    }

    /**
     * Receives archive entries.
     */
    public interface EntryVisitor {

        /**
         * Called for each unit file.
         *
         * @return false to stop visiting further entries
         */
        boolean unitFile(ArchiveEntry entry);

        /**
         * Called for each entry that is not a unit file.
         */
        default void skipped(String name) {
        }
    }
}
