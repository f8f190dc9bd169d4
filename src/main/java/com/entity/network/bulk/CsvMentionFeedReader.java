package com.entity.network.bulk;

import com.entity.network.core.model.RawMention;

import java.util.List;

/**
 * Reads the extraction feed as CSV.
 * <pre>
 * surface_name,entity_kind,document_id
 * "Maxwell, Ghislaine",person,DOJ-OGR-00001
 * The FBI,organization,EMAIL-0042
 * </pre>
 * Kinds are kept as text here; they are validated when mentions are folded into records.
 */
public class CsvMentionFeedReader extends AbstractCsvFeedReader<RawMention> {

    public static final String SURFACE_NAME = "surface_name";
    public static final String ENTITY_KIND = "entity_kind";
    public static final String DOCUMENT_ID = "document_id";

    public CsvMentionFeedReader() {
        super("mentions", List.of(SURFACE_NAME, ENTITY_KIND, DOCUMENT_ID));
    }

    @Override
    protected RawMention parseRow(Row row) {
        return new RawMention(row.get(SURFACE_NAME), row.get(ENTITY_KIND), row.get(DOCUMENT_ID));
    }
}
