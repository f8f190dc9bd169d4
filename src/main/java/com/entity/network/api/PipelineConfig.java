package com.entity.network.api;

import com.entity.network.cache.CacheConfig;
import com.entity.network.conflation.ConflationCheck;
import com.entity.network.conflation.ConflationDetector;
import com.entity.network.cooccurrence.CooccurrenceAggregator;
import com.entity.network.cooccurrence.DocumentTypeClassifier;
import com.entity.network.core.model.EntityKind;
import com.entity.network.core.model.MalformedInputException;
import com.entity.network.graph.RelationshipGraph;
import com.entity.network.identity.IdentityMap;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Settings of a pipeline run. Immutable; built with {@link #builder()} or read from properties
 * prefixed {@value #PREFIX}.
 */
public class PipelineConfig {

    public static final String PREFIX = "entity-network.";

    public static final String FAIL_ON_RESIDUAL_DUPLICATES = PREFIX + "fail-on-residual-duplicates";
    public static final String CONFLATION_CHECKS = PREFIX + "conflation.checks";
    public static final String MIN_PARTIAL_MATCH_LENGTH = PREFIX + "conflation.min-partial-match-length";
    public static final String HIGH_CARDINALITY_THRESHOLD = PREFIX + "cooccurrence.high-cardinality-threshold";
    public static final String MIN_COOCCURRENCE_WEIGHT = PREFIX + "cooccurrence.min-weight";
    public static final String PARTITIONS = PREFIX + "cooccurrence.partitions";
    public static final String PROGRESS_INTERVAL = PREFIX + "cooccurrence.progress-interval";
    public static final String DOCUMENT_TYPES = PREFIX + "cooccurrence.document-types";
    public static final String PRIMARY_SOURCE = PREFIX + "graph.primary-source";
    public static final String SECONDARY_SOURCE = PREFIX + "graph.secondary-source";
    public static final String KIND_PREFERENCE = PREFIX + "identity.kind-preference";
    public static final String CACHE_ENABLED = PREFIX + "cache.enabled";
    public static final String CACHE_MAX_SIZE = PREFIX + "cache.max-size";

    private final boolean failOnResidualDuplicates;
    private final Set<ConflationCheck> conflationChecks;
    private final int minPartialMatchLength;
    private final int highCardinalityThreshold;
    private final long minCooccurrenceWeight;
    private final int partitions;
    private final int progressInterval;
    private final DocumentTypeClassifier documentTypeClassifier;
    private final String primarySource;
    private final String secondarySource;
    private final List<EntityKind> kindPreference;
    private final CacheConfig cacheConfig;

    private PipelineConfig(Builder builder) {
        this.failOnResidualDuplicates = builder.failOnResidualDuplicates;
        this.conflationChecks = Set.copyOf(builder.conflationChecks);
        this.minPartialMatchLength = builder.minPartialMatchLength;
        this.highCardinalityThreshold = builder.highCardinalityThreshold;
        this.minCooccurrenceWeight = builder.minCooccurrenceWeight;
        this.partitions = builder.partitions;
        this.progressInterval = builder.progressInterval;
        this.documentTypeClassifier = builder.documentTypeClassifier;
        this.primarySource = builder.primarySource;
        this.secondarySource = builder.secondarySource;
        this.kindPreference = List.copyOf(builder.kindPreference);
        this.cacheConfig = builder.cacheConfig;
    }

    public boolean isFailOnResidualDuplicates() {
        return failOnResidualDuplicates;
    }

    public Set<ConflationCheck> getConflationChecks() {
        return conflationChecks;
    }

    public int getMinPartialMatchLength() {
        return minPartialMatchLength;
    }

    public int getHighCardinalityThreshold() {
        return highCardinalityThreshold;
    }

    public long getMinCooccurrenceWeight() {
        return minCooccurrenceWeight;
    }

    public int getPartitions() {
        return partitions;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public DocumentTypeClassifier getDocumentTypeClassifier() {
        return documentTypeClassifier;
    }

    public String getPrimarySource() {
        return primarySource;
    }

    public String getSecondarySource() {
        return secondarySource;
    }

    public List<EntityKind> getKindPreference() {
        return kindPreference;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads settings from properties; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static PipelineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = get(properties, FAIL_ON_RESIDUAL_DUPLICATES)) != null) {
            builder.failOnResidualDuplicates(parseBoolean(FAIL_ON_RESIDUAL_DUPLICATES, value));
        }
        if ((value = get(properties, CONFLATION_CHECKS)) != null) {
            builder.conflationChecks(ConflationCheck.parseList(value));
        }
        if ((value = get(properties, MIN_PARTIAL_MATCH_LENGTH)) != null) {
            builder.minPartialMatchLength(parseInt(MIN_PARTIAL_MATCH_LENGTH, value));
        }
        if ((value = get(properties, HIGH_CARDINALITY_THRESHOLD)) != null) {
            builder.highCardinalityThreshold(parseInt(HIGH_CARDINALITY_THRESHOLD, value));
        }
        if ((value = get(properties, MIN_COOCCURRENCE_WEIGHT)) != null) {
            builder.minCooccurrenceWeight(parseInt(MIN_COOCCURRENCE_WEIGHT, value));
        }
        if ((value = get(properties, PARTITIONS)) != null) {
            builder.partitions(parseInt(PARTITIONS, value));
        }
        if ((value = get(properties, PROGRESS_INTERVAL)) != null) {
            builder.progressInterval(parseInt(PROGRESS_INTERVAL, value));
        }
        if ((value = get(properties, DOCUMENT_TYPES)) != null) {
            builder.documentTypeClassifier(DocumentTypeClassifier.parse(value));
        }
        if ((value = get(properties, PRIMARY_SOURCE)) != null) {
            builder.primarySource(value);
        }
        if ((value = get(properties, SECONDARY_SOURCE)) != null) {
            builder.secondarySource(value);
        }
        if ((value = get(properties, KIND_PREFERENCE)) != null) {
            List<EntityKind> kinds = new ArrayList<>();
            for (String label : value.split(",")) {
                if (label.isBlank()) {
                    continue;
                }
                try {
                    kinds.add(EntityKind.fromLabel(label));
                } catch (MalformedInputException e) {
                    throw new IllegalArgumentException(KIND_PREFERENCE + ": " + e.getMessage(), e);
                }
            }
            builder.kindPreference(kinds);
        }
        String cacheEnabled = get(properties, CACHE_ENABLED);
        String cacheMaxSize = get(properties, CACHE_MAX_SIZE);
        if (cacheEnabled != null || cacheMaxSize != null) {
            CacheConfig defaults = CacheConfig.defaults();
            builder.cacheConfig(new CacheConfig(
                    cacheMaxSize != null ? parseInt(CACHE_MAX_SIZE, cacheMaxSize) : defaults.maxSize(),
                    cacheEnabled != null ? parseBoolean(CACHE_ENABLED, cacheEnabled) : defaults.enabled()));
        }
        return builder.build();
    }

    /**
     * Loads a UTF-8 properties file.
     */
    public static PipelineConfig load(Path file) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read configuration " + file, e);
        }
        return fromProperties(properties);
    }

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but was '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false but was '" + value + "'");
    }

    @Override
    public String toString() {
        return "PipelineConfig{failOnResidualDuplicates=" + failOnResidualDuplicates +
                ", checks=" + conflationChecks +
                ", minPartialMatchLength=" + minPartialMatchLength +
                ", highCardinalityThreshold=" + highCardinalityThreshold +
                ", minCooccurrenceWeight=" + minCooccurrenceWeight +
                ", partitions=" + partitions +
                ", sources=" + primarySource + "/" + secondarySource +
                ", cache=" + cacheConfig + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean failOnResidualDuplicates = true;
        private Set<ConflationCheck> conflationChecks = EnumSet.allOf(ConflationCheck.class);
        private int minPartialMatchLength = ConflationDetector.DEFAULT_MIN_PARTIAL_MATCH_LENGTH;
        private int highCardinalityThreshold = CooccurrenceAggregator.DEFAULT_HIGH_CARDINALITY_THRESHOLD;
        private long minCooccurrenceWeight = 1;
        private int partitions = 1;
        private int progressInterval = CooccurrenceAggregator.DEFAULT_PROGRESS_INTERVAL;
        private DocumentTypeClassifier documentTypeClassifier = DocumentTypeClassifier.defaults();
        private String primarySource = RelationshipGraph.SOURCE_DOCUMENT;
        private String secondarySource = RelationshipGraph.SOURCE_MANIFEST;
        private List<EntityKind> kindPreference = IdentityMap.DEFAULT_KIND_PREFERENCE;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder failOnResidualDuplicates(boolean failOnResidualDuplicates) {
            this.failOnResidualDuplicates = failOnResidualDuplicates;
            return this;
        }

        public Builder conflationChecks(Set<ConflationCheck> conflationChecks) {
            if (conflationChecks == null) {
                throw new IllegalArgumentException("conflationChecks cannot be null");
            }
            this.conflationChecks = conflationChecks;
            return this;
        }

        public Builder minPartialMatchLength(int minPartialMatchLength) {
            if (minPartialMatchLength < 1) {
                throw new IllegalArgumentException("minPartialMatchLength must be >= 1");
            }
            this.minPartialMatchLength = minPartialMatchLength;
            return this;
        }

        public Builder highCardinalityThreshold(int highCardinalityThreshold) {
            if (highCardinalityThreshold < 2) {
                throw new IllegalArgumentException("highCardinalityThreshold must be >= 2");
            }
            this.highCardinalityThreshold = highCardinalityThreshold;
            return this;
        }

        public Builder minCooccurrenceWeight(long minCooccurrenceWeight) {
            if (minCooccurrenceWeight < 1) {
                throw new IllegalArgumentException("minCooccurrenceWeight must be >= 1");
            }
            this.minCooccurrenceWeight = minCooccurrenceWeight;
            return this;
        }

        public Builder partitions(int partitions) {
            if (partitions < 1) {
                throw new IllegalArgumentException("partitions must be >= 1");
            }
            this.partitions = partitions;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be >= 1");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public Builder documentTypeClassifier(DocumentTypeClassifier documentTypeClassifier) {
            if (documentTypeClassifier == null) {
                throw new IllegalArgumentException("documentTypeClassifier cannot be null");
            }
            this.documentTypeClassifier = documentTypeClassifier;
            return this;
        }

        public Builder primarySource(String primarySource) {
            this.primarySource = requireTag(primarySource, "primarySource");
            return this;
        }

        public Builder secondarySource(String secondarySource) {
            this.secondarySource = requireTag(secondarySource, "secondarySource");
            return this;
        }

        public Builder kindPreference(List<EntityKind> kindPreference) {
            if (kindPreference == null || kindPreference.isEmpty()) {
                throw new IllegalArgumentException("kindPreference cannot be empty");
            }
            this.kindPreference = kindPreference;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig cannot be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public PipelineConfig build() {
            if (primarySource.equals(secondarySource)) {
                throw new IllegalArgumentException("primarySource and secondarySource must differ");
            }
            return new PipelineConfig(this);
        }

        private static String requireTag(String tag, String name) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException(name + " cannot be blank");
            }
            return tag.trim();
        }
    }
}
