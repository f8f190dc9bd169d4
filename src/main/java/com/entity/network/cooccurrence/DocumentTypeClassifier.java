package com.entity.network.cooccurrence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classifies documents by id prefix, e.g. {@code DOJ-OGR-00012} as a government document.
 * Prefixes are tried in the order given; ids matching none are {@value #UNKNOWN}.
 */
public class DocumentTypeClassifier {

    public static final String UNKNOWN = "unknown";

    private final Map<String, String> prefixes;

    public DocumentTypeClassifier(Map<String, String> prefixes) {
        this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
    }

    public static DocumentTypeClassifier defaults() {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put("DOJ-OGR", "government_document");
        prefixes.put("EMAIL", "email");
        prefixes.put("COURT", "court_filing");
        return new DocumentTypeClassifier(prefixes);
    }

    /**
     * Parses {@code PREFIX=type,PREFIX=type}.
     */
    public static DocumentTypeClassifier parse(String mapping) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        if (mapping != null) {
            for (String entry : mapping.split(",")) {
                if (entry.isBlank()) {
                    continue;
                }
                int eq = entry.indexOf('=');
                if (eq <= 0 || eq == entry.length() - 1) {
                    throw new IllegalArgumentException("expected PREFIX=type but got '" + entry.trim() + "'");
                }
                prefixes.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
            }
        }
        return new DocumentTypeClassifier(prefixes);
    }

    public String classify(String documentId) {
        if (documentId == null) {
            return UNKNOWN;
        }
        for (Map.Entry<String, String> entry : prefixes.entrySet()) {
            if (documentId.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNKNOWN;
    }

    public Map<String, String> getPrefixes() {
        return prefixes;
    }
}
