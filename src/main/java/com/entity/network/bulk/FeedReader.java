package com.entity.network.bulk;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads one input feed format. A record that cannot be parsed becomes an issue and reading
 * carries on; an I/O failure is recorded as an issue and ends the read.
 */
public interface FeedReader<T> {

    FeedReadResult<T> read(Reader reader, ProgressCallback callback);

    /**
     * Reads a UTF-8 file.
     *
     * @throws UncheckedIOException if the file cannot be opened
     */
    default FeedReadResult<T> read(Path file, ProgressCallback callback) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, callback);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
    }

    /**
     * Format name, e.g. "csv" or "jsonl".
     */
    String getFormat();
}
