package com.entity.network.api;

import com.entity.network.bulk.CsvMentionFeedReader;
import com.entity.network.bulk.CsvRelationshipFeedReader;
import com.entity.network.bulk.FeedReadResult;
import com.entity.network.bulk.FeedReader;
import com.entity.network.bulk.JsonLinesMentionFeedReader;
import com.entity.network.bulk.JsonRelationshipFeedReader;
import com.entity.network.conflation.DeduplicationInvariantViolationException;
import com.entity.network.core.model.IngestIssue;
import com.entity.network.core.model.RawMention;
import com.entity.network.graph.SecondaryEdge;
import com.entity.network.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line entry point of the batch:
 * <pre>
 * EntityNetworkBatch --mentions mentions.csv [--relationships network.json] --out out/ [--config run.properties]
 * </pre>
 * Feed formats follow the file extension: {@code .csv} or {@code .jsonl} for mentions, {@code .csv}
 * or {@code .json} for relationships.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 invariant violation or I/O failure.</p>
 */
public class EntityNetworkBatch {
    private static final Logger log = LoggerFactory.getLogger(EntityNetworkBatch.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILURE = 2;

    static final String MENTIONS = "mentions";
    static final String RELATIONSHIPS = "relationships";
    static final String OUT = "out";
    static final String CONFIG = "config";

    private final PrintWriter err;

    public EntityNetworkBatch() {
        this(new PrintWriter(System.err, true));
    }

    EntityNetworkBatch(PrintWriter err) {
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new EntityNetworkBatch().run(args));
    }

    public int run(String[] args) {
        Options options = options();
        CommandLine cmdline;
        try {
            cmdline = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println("Error parsing command line: " + e.getMessage());
            printUsage(options);
            return EXIT_USAGE;
        }

        Path mentionsFile = Path.of(cmdline.getOptionValue(MENTIONS));
        Path outputDirectory = Path.of(cmdline.getOptionValue(OUT));
        Path relationshipsFile = cmdline.hasOption(RELATIONSHIPS) ? Path.of(cmdline.getOptionValue(RELATIONSHIPS)) : null;
        if (!Files.isRegularFile(mentionsFile)) {
            err.println("Mentions feed not found: " + mentionsFile);
            return EXIT_USAGE;
        }
        if (relationshipsFile != null && !Files.isRegularFile(relationshipsFile)) {
            err.println("Relationships feed not found: " + relationshipsFile);
            return EXIT_USAGE;
        }

        PipelineConfig config;
        try {
            config = cmdline.hasOption(CONFIG)
                    ? PipelineConfig.load(Path.of(cmdline.getOptionValue(CONFIG)))
                    : PipelineConfig.defaults();
        } catch (UncheckedIOException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        FeedReader<RawMention> mentionReader;
        FeedReader<SecondaryEdge> relationshipReader = null;
        try {
            mentionReader = mentionReader(mentionsFile);
            if (relationshipsFile != null) {
                relationshipReader = relationshipReader(relationshipsFile);
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EntityNetworkPipeline pipeline = EntityNetworkPipeline.builder()
                .config(config)
                .metrics(new MicrometerMetricsService(registry))
                .build();
        try {
            FeedReadResult<RawMention> mentions = mentionReader.read(mentionsFile,
                    (processed, total, message) -> log.debug("feed.progress feed=mentions processed={}", processed));
            List<IngestIssue> readIssues = new ArrayList<>(mentions.issues());
            List<SecondaryEdge> edges = List.of();
            if (relationshipReader != null) {
                FeedReadResult<SecondaryEdge> relationships = relationshipReader.read(relationshipsFile, null);
                readIssues.addAll(relationships.issues());
                edges = relationships.items();
            }

            PipelineResult result = pipeline.run(new PipelineInput(mentions.items(), edges, readIssues));
            pipeline.writeArtifacts(result, outputDirectory);
            PipelineSummary summary = result.summary();
            log.info("batch.completed entities={} typeConflicts={} partialMatches={} edges={} issues={} out={}",
                    summary.entitiesAfterDedup(), summary.typeConflicts(), summary.partialMatches(),
                    summary.mergedEdges(), summary.issueTotal(), outputDirectory);
            return EXIT_OK;
        } catch (DeduplicationInvariantViolationException e) {
            err.println("Deduplication invariant violated: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException e) {
            log.error("batch.failed error={}", e.getMessage());
            err.println("I/O failure: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            registry.close();
        }
    }

    static FeedReader<RawMention> mentionReader(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvMentionFeedReader();
        }
        if (name.endsWith(".jsonl") || name.endsWith(".ndjson")) {
            return new JsonLinesMentionFeedReader();
        }
        throw new IllegalArgumentException("Unsupported mentions feed format: " + file.getFileName());
    }

    static FeedReader<SecondaryEdge> relationshipReader(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return new CsvRelationshipFeedReader();
        }
        if (name.endsWith(".json")) {
            return new JsonRelationshipFeedReader();
        }
        throw new IllegalArgumentException("Unsupported relationships feed format: " + file.getFileName());
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt(MENTIONS).hasArg().argName("file").required()
                .desc("raw mention feed (.csv or .jsonl)").build());
        options.addOption(Option.builder().longOpt(RELATIONSHIPS).hasArg().argName("file")
                .desc("external relationship source (.csv or .json)").build());
        options.addOption(Option.builder().longOpt(OUT).hasArg().argName("dir").required()
                .desc("output directory for artifacts").build());
        options.addOption(Option.builder().longOpt(CONFIG).hasArg().argName("properties")
                .desc("pipeline configuration file").build());
        return options;
    }

    private void printUsage(Options options) {
        new HelpFormatter().printHelp(err, HelpFormatter.DEFAULT_WIDTH, EntityNetworkBatch.class.getSimpleName(),
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        err.flush();
    }
}
