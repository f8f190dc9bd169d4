package com.entity.network.bulk;

import com.entity.network.core.model.IngestIssue;
import com.entity.network.graph.SecondaryEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an external relationship source in the network JSON shape:
 * <pre>
 * {
 *   "nodes": [{"id": "n1", "name": "Jeffrey Epstein"}, {"id": "n2", "name": "Ghislaine Maxwell"}],
 *   "edges": [{"source": "n1", "target": "n2", "weight": 5}]
 * }
 * </pre>
 * Edge endpoints reference node ids; an id with no node stands for itself as a name. The weight
 * falls back to {@code flight_count} and then to 1.
 */
public class JsonRelationshipFeedReader implements FeedReader<SecondaryEdge> {
    private static final Logger log = LoggerFactory.getLogger(JsonRelationshipFeedReader.class);

    private final ObjectMapper objectMapper;

    public JsonRelationshipFeedReader() {
        this(new ObjectMapper());
    }

    public JsonRelationshipFeedReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FeedReadResult<SecondaryEdge> read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<SecondaryEdge> items = new ArrayList<>();
        List<IngestIssue> issues = new ArrayList<>();
        long recordsRead = 0;

        try (Reader r = reader) {
            JsonNode root = objectMapper.readTree(r);
            if (root == null || !root.isObject()) {
                issues.add(IngestIssue.malformed("relationships", "", "expected a JSON object with nodes and edges"));
                return new FeedReadResult<>(List.of(), 0, issues);
            }
            Map<String, String> names = new HashMap<>();
            for (JsonNode node : root.path("nodes")) {
                JsonNode id = node.get("id");
                JsonNode name = node.get("name");
                if (id != null && name != null && !name.isNull()) {
                    names.put(id.asText(), name.asText());
                }
            }
            JsonNode edges = root.path("edges");
            for (JsonNode edge : edges) {
                recordsRead++;
                String location = "relationships:edges[" + (recordsRead - 1) + "]";
                JsonNode source = edge.get("source");
                JsonNode target = edge.get("target");
                if (source == null || target == null || source.isNull() || target.isNull()) {
                    issues.add(IngestIssue.malformed(location, edge.toString(), "edge needs a source and a target"));
                    log.warn("feed.rejected location={} error=missing-endpoint", location);
                    continue;
                }
                items.add(new SecondaryEdge(
                        names.getOrDefault(source.asText(), source.asText()),
                        names.getOrDefault(target.asText(), target.asText()),
                        weight(edge)));
            }
            cb.onProgress(recordsRead, edges.size(), "Read " + recordsRead + " edges");
        } catch (JsonProcessingException e) {
            log.error("feed.read_failed feed=relationships error={}", e.getOriginalMessage());
            issues.add(IngestIssue.malformed("relationships", "", "invalid JSON: " + e.getOriginalMessage()));
        } catch (IOException e) {
            log.error("feed.read_failed feed=relationships error={}", e.getMessage());
            issues.add(IngestIssue.malformed("relationships", "", "IO error: " + e.getMessage()));
        }

        FeedReadResult<SecondaryEdge> result = new FeedReadResult<>(items, recordsRead, issues);
        log.info("feed.read feed=relationships result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static long weight(JsonNode edge) {
        JsonNode weight = edge.get("weight");
        if (weight == null || !weight.canConvertToLong()) {
            weight = edge.get("flight_count");
        }
        if (weight != null && weight.canConvertToLong() && weight.asLong() > 0) {
            return weight.asLong();
        }
        return 1;
    }
}
