package com.acme.metadata.extractor.cli;

import com.acme.metadata.extractor.extract.TraversalEngine;
import com.acme.metadata.extractor.filter.CompletenessGate;
import com.acme.metadata.extractor.filter.DocumentFilter;
import com.acme.metadata.extractor.filter.FilterConfig;
import com.acme.metadata.extractor.output.OutputException;
import com.acme.metadata.extractor.output.OutputStrategy;
import com.acme.metadata.extractor.pipeline.ExtractionPipeline;
import com.acme.metadata.extractor.pipeline.FileOutcome;
import com.acme.metadata.extractor.pipeline.InputFiles;
import com.acme.metadata.extractor.pipeline.JsonlFileProcessor;
import com.acme.metadata.extractor.pipeline.PipelineSettings;
import com.acme.metadata.extractor.pipeline.RunSummary;
import com.acme.metadata.extractor.plan.CompileResult;
import com.acme.metadata.extractor.plan.FieldSpec;
import com.acme.metadata.extractor.plan.FieldSpecParser;
import com.acme.metadata.extractor.plan.TraversalPlan;
import com.acme.metadata.extractor.plan.TriePathCompiler;
import com.acme.metadata.extractor.schema.SchemaRegistry;
import com.acme.metadata.extractor.telemetry.AtomicPipelineMetrics;
import com.acme.metadata.extractor.telemetry.PeriodicProgressReporter;
import com.acme.metadata.extractor.util.EnvVars;
import com.acme.metadata.extractor.util.ExtractorDefaults;
import com.acme.metadata.extractor.util.ExtractorEnvKeys;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Extracts arbitrary fields from DataCite metadata in compressed JSONL files into CSV.
 */
@Command(name = "field-extractor", mixinStandardHelpOptions = true, version = "1.1",
         description = "Extracts field data from DataCite metadata in JSONL(.gz) files using a compiled path trie")
public final class FieldExtractorMain implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(FieldExtractorMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Option(names = {"-i", "--input"}, required = true, description = "Directory containing JSONL.gz files")
    Path input;

    @Option(names = {"-o", "--output"}, defaultValue = ExtractorDefaults.DEFAULT_OUTPUT,
            description = "Output CSV file, or directory with --organize (default: ${DEFAULT-VALUE})")
    Path output;

    @Option(names = {"-l", "--log-level"}, defaultValue = "INFO", description = "DEBUG, INFO, WARN or ERROR")
    String logLevel;

    @Option(names = {"-t", "--threads"}, description = "Worker threads, 0 for one per CPU")
    Integer threads;

    @Option(names = {"-b", "--batch-size"}, description = "Records per batch sent to the writer thread")
    Integer batchSize;

    @Option(names = "--channel-capacity", description = "Batches buffered before workers block, 0 for threads x 4")
    Integer channelCapacity;

    @Option(names = {"-g", "--organize"}, description = "Write one file per provider/client, keeping an LRU cache of open files")
    boolean organize;

    @Option(names = "--max-open-files", description = "Maximum open output files with --organize")
    Integer maxOpenFiles;

    @Option(names = "--provider", description = "Only include records of this provider id")
    String provider;

    @Option(names = "--client", description = "Only include records of this client id")
    String client;

    @Option(names = "--resource-types", description = "Comma-separated resourceTypeGeneral values to include, e.g. 'Dataset,Text'")
    String resourceTypes;

    @Option(names = "--require-all-fields", description = "Only include records that yield every requested top-level field")
    boolean requireAllFields;

    @Option(names = "--field-value-filter",
            description = "Require path=value, e.g. 'relatedIdentifiers.relationType=IsSupplementTo'. Repeatable.")
    List<String> fieldValueFilters = new ArrayList<>();

    @Option(names = "--field-does-not-exist",
            description = "Require the field to be absent or empty (null, [], {}). Repeatable.")
    List<String> fieldDoesNotExist = new ArrayList<>();

    @Option(names = {"-f", "--fields"}, defaultValue = ExtractorDefaults.DEFAULT_FIELDS,
            description = "Comma-separated fields to extract (default: ${DEFAULT-VALUE})")
    String fields;

    public static void main(String[] args) {
        System.exit(new CommandLine(new FieldExtractorMain()).execute(args));
    }

    @Override
    public Integer call() {
        LogLevels.configure(logLevel);
        return execute(System.getenv());
    }

    int execute(Map<String, String> env) {
        List<FieldSpec> specs = FieldSpecParser.parse(fields);
        CompileResult compiled = new TriePathCompiler().compile(specs, SchemaRegistry.datacite());
        if (compiled instanceof CompileResult.Failure failure) {
            LOG.severe("Invalid --fields '" + fields + "': " + failure.code() + " " + failure.message());
            return EXIT_FAILURE;
        }
        TraversalPlan plan = ((CompileResult.Success) compiled).plan();
        LOG.info(() -> "Built traversal plan for fields " + fields + " " + plan);

        FilterConfig filterConfig;
        try {
            filterConfig = FilterConfig.parse(resourceTypes, fieldValueFilters, fieldDoesNotExist,
                requireAllFields, provider, client);
        } catch (IllegalArgumentException e) {
            LOG.severe(e.getMessage());
            return EXIT_FAILURE;
        }
        logFilters(filterConfig, plan);

        PipelineSettings settings = resolveSettings(env);
        int maxOpen = EnvVars.resolveInt(env, maxOpenFiles, ExtractorEnvKeys.EXTRACTOR_MAX_OPEN_FILES,
            ExtractorDefaults.DEFAULT_MAX_OPEN_FILES, 1, ExtractorDefaults.MAX_OPEN_FILES_LIMIT);
        int progressSec = EnvVars.getIntClamped(env, ExtractorEnvKeys.EXTRACTOR_PROGRESS_INTERVAL_SEC,
            ExtractorDefaults.DEFAULT_PROGRESS_INTERVAL_SEC, 1, 3600);

        List<Path> files;
        try {
            LOG.info(() -> "Finding files in " + input);
            files = InputFiles.find(input);
        } catch (IOException | IllegalArgumentException e) {
            LOG.severe("Cannot scan input " + input + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        LOG.info("Found " + files.size() + " files to process.");
        if (files.isEmpty()) {
            return EXIT_OK;
        }

        AtomicPipelineMetrics metrics = new AtomicPipelineMetrics();
        JsonlFileProcessor processor = new JsonlFileProcessor(
            new TraversalEngine(plan),
            new DocumentFilter(filterConfig),
            filterConfig.requireAllFields() ? new CompletenessGate(plan.requestedLabels()) : null,
            settings.batchSize(),
            metrics
        );
        ExtractionPipeline pipeline = new ExtractionPipeline(processor, settings, metrics);

        RunSummary summary;
        try (PeriodicProgressReporter reporter = new PeriodicProgressReporter(metrics, files.size(), progressSec)) {
            OutputStrategy out = OutputStrategy.create(output, organize, maxOpen);
            reporter.start();
            summary = pipeline.run(files, out);
        } catch (OutputException e) {
            LOG.log(Level.SEVERE, "Cannot open output", e);
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.severe("Interrupted before the run completed");
            return EXIT_FAILURE;
        }

        report(summary, metrics.snapshot());
        return summary.isSuccess() ? EXIT_OK : EXIT_FAILURE;
    }

    PipelineSettings resolveSettings(Map<String, String> env) {
        int t = EnvVars.resolveInt(env, threads, ExtractorEnvKeys.EXTRACTOR_THREADS,
            ExtractorDefaults.AUTO_THREADS, 0, ExtractorDefaults.MAX_THREADS);
        int b = EnvVars.resolveInt(env, batchSize, ExtractorEnvKeys.EXTRACTOR_BATCH_SIZE,
            ExtractorDefaults.DEFAULT_BATCH_SIZE, 1, ExtractorDefaults.MAX_BATCH_SIZE);
        int c = EnvVars.resolveInt(env, channelCapacity, ExtractorEnvKeys.EXTRACTOR_CHANNEL_CAPACITY,
            0, 0, ExtractorDefaults.MAX_CHANNEL_CAPACITY);
        int flushEvery = EnvVars.getIntClamped(env, ExtractorEnvKeys.EXTRACTOR_FLUSH_EVERY_BATCHES,
            ExtractorDefaults.DEFAULT_FLUSH_EVERY_BATCHES, 1, 1_000_000);
        return PipelineSettings.resolve(t, b, c, flushEvery);
    }

    private static void logFilters(FilterConfig config, TraversalPlan plan) {
        if (!config.allowedCategories().isEmpty()) {
            LOG.info("Filtering for resource types: " + config.allowedCategories());
        }
        if (!config.requiredValues().isEmpty()) {
            LOG.info("Applying field-value filters: " + config.requiredValues());
        }
        if (!config.exclusions().isEmpty()) {
            LOG.info("Applying field exclusion filters for: " + config.exclusions());
        }
        if (config.requireAllFields()) {
            LOG.info("Requiring all top-level fields to be present: " + plan.requestedLabels());
        }
        if (!config.routing().isUnrestricted()) {
            LOG.info("Restricting to " + config.routing());
        }
    }

    private static void report(RunSummary s, AtomicPipelineMetrics.Snapshot counters) {
        LOG.info("--- Final Report ---");
        LOG.info("Processed " + s.filesFound() + " files: " + s.filesSucceeded() + " succeeded, "
            + s.filesFailed() + " failed, " + s.filesAborted() + " aborted.");
        LOG.info("Lines read: " + s.linesRead() + " (malformed: " + s.malformedLines() + ")");
        LOG.info("Documents skipped without attributes or identity: " + counters.documentsSkipped()
            + ", rejected by filters: " + counters.documentsRejected() + " " + counters.rejectedByReason());
        LOG.info("Documents extracted: " + s.documentsExtracted() + ", records written: " + s.recordsWritten()
            + " in " + s.batchesWritten() + " batches.");
        for (FileOutcome failure : s.failures()) {
            LOG.warning("Skipped " + failure.file() + ": " + errorOf(failure));
        }
        if (s.fatalError() != null) {
            LOG.log(Level.SEVERE, "Run aborted by writer failure", s.fatalError());
        } else if (s.allFilesFailed()) {
            LOG.severe("Every input file failed.");
        }
        LOG.info("Total execution time: " + RunSummary.formatElapsed(s.elapsed()));
    }

    private static String errorOf(FileOutcome outcome) {
        if (outcome instanceof FileOutcome.Failed f) {
            return f.error();
        }
        if (outcome instanceof FileOutcome.Aborted a) {
            return a.error();
        }
        return "ok";
    }
}
