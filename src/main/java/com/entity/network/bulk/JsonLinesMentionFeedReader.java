package com.entity.network.bulk;

import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.RawMention;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the extraction feed as JSON Lines, one object per line:
 * <pre>
 * {"surface_name": "The FBI", "entity_kind": "organization", "document_id": "EMAIL-0042"}
 * </pre>
 */
public class JsonLinesMentionFeedReader implements FeedReader<RawMention> {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesMentionFeedReader.class);
    private static final int PROGRESS_INTERVAL = 5000;

    private final ObjectMapper objectMapper;

    public JsonLinesMentionFeedReader() {
        this(new ObjectMapper());
    }

    public JsonLinesMentionFeedReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FeedReadResult<RawMention> read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<RawMention> items = new ArrayList<>();
        List<IngestIssue> issues = new ArrayList<>();
        long recordsRead = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                recordsRead++;
                String location = "mentions:" + lineNumber;
                try {
                    JsonNode node = objectMapper.readTree(line);
                    if (!node.isObject()) {
                        issues.add(IngestIssue.malformed(location, line, "expected a JSON object"));
                        log.warn("feed.rejected location={} error=not-an-object", location);
                    } else {
                        items.add(new RawMention(
                                text(node, CsvMentionFeedReader.SURFACE_NAME),
                                text(node, CsvMentionFeedReader.ENTITY_KIND),
                                text(node, CsvMentionFeedReader.DOCUMENT_ID)));
                    }
                } catch (JsonProcessingException e) {
                    issues.add(IngestIssue.malformed(location, line, "invalid JSON: " + e.getOriginalMessage()));
                    log.warn("feed.rejected location={} error={}", location, e.getOriginalMessage());
                }
                if (recordsRead % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(recordsRead, -1, "Read " + recordsRead + " records");
                }
            }
        } catch (IOException e) {
            log.error("feed.read_failed feed=mentions error={}", e.getMessage());
            issues.add(IngestIssue.malformed("mentions", "", "IO error: " + e.getMessage()));
        }

        FeedReadResult<RawMention> result = new FeedReadResult<>(items, recordsRead, issues);
        cb.onProgress(recordsRead, recordsRead, "Read completed");
        log.info("feed.read feed=mentions result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "jsonl";
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
