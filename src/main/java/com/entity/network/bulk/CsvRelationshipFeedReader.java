package com.entity.network.bulk;

import com.entity.network.core.model.MalformedInputException;
import com.entity.network.graph.SecondaryEdge;

import java.util.List;

/**
 * Reads an external relationship source as CSV: {@code source,target,weight}. The weight column
 * is optional and defaults to 1; a weight that is not a positive integer rejects the row.
 */
public class CsvRelationshipFeedReader extends AbstractCsvFeedReader<SecondaryEdge> {

    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String WEIGHT = "weight";

    public CsvRelationshipFeedReader() {
        super("relationships", List.of(SOURCE, TARGET));
    }

    @Override
    protected SecondaryEdge parseRow(Row row) {
        return new SecondaryEdge(row.get(SOURCE), row.get(TARGET), parseWeight(row.get(WEIGHT)));
    }

    private static long parseWeight(String value) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        long weight;
        try {
            weight = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException("weight is not a number: '" + value.trim() + "'");
        }
        if (weight <= 0) {
            throw new MalformedInputException("weight must be positive: " + weight);
        }
        return weight;
    }
}
