package com.unit.catalog.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes unmatched external records as CSV:
 *
 * <pre>
 * external_id,external_name,computed_slug,tonnage,reason
 * 901,"Dasher (Fire Moth) X",dasher-fire-moth-x,20.0,no tier matched
 * </pre>
 */
public class UnmatchedListWriter {
    private static final Logger log = LoggerFactory.getLogger(UnmatchedListWriter.class);

    public static final String HEADER = "external_id,external_name,computed_slug,tonnage,reason";

    public void write(Path file, List<UnmatchedRecord> unmatched) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 PrintWriter pw = new PrintWriter(writer)) {
                pw.println(HEADER);
                for (UnmatchedRecord record : unmatched) {
                    pw.printf("%d,%s,%s,%s,%s%n",
                            record.externalId(),
                            csvEscape(record.externalName()),
                            csvEscape(record.computedSlug()),
                            record.tonnage(),
                            csvEscape(record.reason()));
                }
                if (pw.checkError()) {
                    throw new IOException("write error");
                }
            }
            log.info("match.unmatched.written file={} count={}", file, unmatched.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write unmatched list " + file, e);
        }
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
