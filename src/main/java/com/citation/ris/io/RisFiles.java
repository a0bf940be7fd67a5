package com.citation.ris.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citation.ris.format.Dialect;
import com.citation.ris.model.RisRecord;
import com.citation.ris.parser.ParserOptions;
import com.citation.ris.parser.RisParser;
import com.citation.ris.writer.RisWriter;
import com.citation.ris.writer.WriterOptions;

/**
 * Reading and writing citation files on disk.
 */
public class RisFiles {
    private static final Logger log = LoggerFactory.getLogger(RisFiles.class);

    private RisFiles() {
        // Utility class
    }

    public static List<RisRecord> read(Path file, Charset encoding, Dialect dialect, ParserOptions options)
            throws IOException {
        return read(file, encoding, new RisParser(dialect, options));
    }

    public static List<RisRecord> read(Path file, Charset encoding, RisParser parser) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, encoding)) {
            List<RisRecord> records = parser.parse(reader);
            log.debug("Read {} records from {}", records.size(), file);
            return records;
        }
    }

    public static void write(Path file, Charset encoding, List<RisRecord> records, Dialect dialect,
                             WriterOptions options) throws IOException {
        write(file, encoding, records, new RisWriter(dialect, options));
    }

    /**
     * Writes the records, creating parent directories if needed.
     */
    public static void write(Path file, Charset encoding, List<RisRecord> records, RisWriter writer)
            throws IOException {
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        try (BufferedWriter out = Files.newBufferedWriter(file, encoding)) {
            writer.dump(records, out);
        }
        log.debug("Wrote {} records to {}", records.size(), file);
    }
}
