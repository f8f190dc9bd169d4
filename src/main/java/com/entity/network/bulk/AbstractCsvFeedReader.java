package com.entity.network.bulk;

import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header-driven CSV feed reading. The first record is the header; columns are located by name
 * (case-insensitive) so their order does not matter. Subclasses turn one row into one item.
 */
abstract class AbstractCsvFeedReader<T> implements FeedReader<T> {
    private static final Logger log = LoggerFactory.getLogger(AbstractCsvFeedReader.class);

    static final int PROGRESS_INTERVAL = 5000;

    private final String feedName;
    private final List<String> requiredColumns;

    AbstractCsvFeedReader(String feedName, List<String> requiredColumns) {
        this.feedName = feedName;
        this.requiredColumns = List.copyOf(requiredColumns);
    }

    /**
     * Builds the item of one data row.
     *
     * @throws MalformedInputException if the row cannot be turned into an item
     */
    protected abstract T parseRow(Row row);

    @Override
    public FeedReadResult<T> read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<T> items = new ArrayList<>();
        List<IngestIssue> issues = new ArrayList<>();
        long recordsRead = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            CsvRecordParser parser = new CsvRecordParser(br);
            List<String> header = parser.next();
            while (header != null && header.isEmpty()) {
                header = parser.next();
            }
            if (header == null) {
                return new FeedReadResult<>(List.of(), 0, List.of());
            }
            Map<String, Integer> columns = indexHeader(header);
            for (String required : requiredColumns) {
                if (!columns.containsKey(required)) {
                    issues.add(IngestIssue.malformed(feedName + ":1", String.join(",", header),
                            "missing column '" + required + "'"));
                    log.error("feed.invalid_header feed={} missing={}", feedName, required);
                    return new FeedReadResult<>(List.of(), 0, issues);
                }
            }

            List<String> values;
            while ((values = parser.next()) != null) {
                if (values.isEmpty()) {
                    continue;
                }
                recordsRead++;
                String location = feedName + ":" + parser.getLineNumber();
                if (values.size() != header.size()) {
                    issues.add(IngestIssue.malformed(location, String.join(",", values),
                            "expected " + header.size() + " fields but found " + values.size()));
                    log.warn("feed.rejected location={} error=field-count", location);
                } else {
                    try {
                        items.add(parseRow(new Row(location, columns, values)));
                    } catch (MalformedInputException e) {
                        issues.add(IngestIssue.malformed(location, String.join(",", values), e.getMessage()));
                        log.warn("feed.rejected location={} error={}", location, e.getMessage());
                    }
                }
                if (recordsRead % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(recordsRead, -1, "Read " + recordsRead + " records");
                }
            }
        } catch (IOException e) {
            log.error("feed.read_failed feed={} error={}", feedName, e.getMessage());
            issues.add(IngestIssue.malformed(feedName, "", "IO error: " + e.getMessage()));
        }

        FeedReadResult<T> result = new FeedReadResult<>(items, recordsRead, issues);
        cb.onProgress(recordsRead, recordsRead, "Read completed");
        log.info("feed.read feed={} result={}", feedName, result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private static Map<String, Integer> indexHeader(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim().toLowerCase(Locale.ROOT);
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    /**
     * One data row, addressed by column name.
     */
    protected static final class Row {
        private final String location;
        private final Map<String, Integer> columns;
        private final List<String> values;

        Row(String location, Map<String, Integer> columns, List<String> values) {
            this.location = location;
            this.columns = columns;
            this.values = values;
        }

        public String location() {
            return location;
        }

        /**
         * The raw value of a column, or {@code null} when the column is absent.
         */
        public String get(String column) {
            Integer index = columns.get(column);
            return index != null ? values.get(index) : null;
        }
    }
}
