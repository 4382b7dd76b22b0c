package org.faultscan;

import org.faultscan.classify.RuleClassifier;
import org.faultscan.config.AppConfig;
import org.faultscan.config.ConfigManager;
import org.faultscan.io.LoadResult;
import org.faultscan.io.LogCsvLoader;
import org.faultscan.io.ReportWriter;
import org.faultscan.metrics.BatchRunInfo;
import org.faultscan.metrics.Status;
import org.faultscan.model.LogEntry;
import org.faultscan.processing.BatchRunner;
import org.faultscan.processing.LogAnalysisPipeline;
import org.faultscan.processing.ProgressListener;
import org.faultscan.processing.ReportGenerator;
import org.faultscan.rules.RuleTable;
import org.faultscan.stats.PerformanceStats;
import org.faultscan.stats.StatsAggregator;
import org.faultscan.util.MemoryUsage;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * Classifies a labelled log export with keyword rules on a pool of worker threads, then reports
 * throughput, stage timing, accuracy and keyword statistics.
 * Configuration comes from {@link ConfigManager}; positional arguments
 * {@code [inputFile] [outputDir] [numThreads]} override it.
 */
public class FaultScan {

    private static final Logger LOGGER = Logger.getLogger(FaultScan.class.getName());
    private static final String RULE = "=".repeat(80);

    private final AppConfig appConfig;
    private final LogCsvLoader loader;
    private final ReportWriter reportWriter;
    private final ProgressListener progressListener;

    public FaultScan(final AppConfig appConfig) {
        this(appConfig, new LogCsvLoader(), new ReportWriter(), ProgressListener.console());
    }

    FaultScan(final AppConfig appConfig, final LogCsvLoader loader, final ReportWriter reportWriter,
              final ProgressListener progressListener) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
        this.loader = Objects.requireNonNull(loader);
        this.reportWriter = Objects.requireNonNull(reportWriter);
        this.progressListener = Objects.requireNonNull(progressListener);
    }

    // --- Main Method ---
    public static void main(final String[] args) {
        int exitCode;
        try {
            final AppConfig appConfig = ConfigManager.getConfig().withArgs(args);
            exitCode = new FaultScan(appConfig).execute().isPresent() ? 0 : 1;
        } catch (final IllegalArgumentException e) {
            System.err.println("Invalid configuration in " + e.getMessage());
            if (args.length > 0) System.err.println("Usage: FaultScan [inputFile] [outputDir] [numThreads]");
            exitCode = 2;
        } catch (final IOException e) {
            LOGGER.log(Level.SEVERE, "I/O failure, aborting run", e);
            exitCode = 1;
        }
        if (exitCode != 0) System.exit(exitCode);
    }

    /**
     * Runs the full load, process, aggregate and save sequence.
     *
     * @return the run statistics, or empty when nothing could be loaded and no output was written
     * @throws IOException if the input cannot be read or a report cannot be written
     */
    public Optional<PerformanceStats> execute() throws IOException {
        System.out.println(RULE);
        System.out.println("FAULTSCAN: PARALLEL RULE-BASED LOG ANALYSIS");
        System.out.println(RULE);
        System.out.println("Input: " + appConfig.inputFile());
        System.out.println("Output: " + appConfig.outputDir());
        System.out.println("Threads: " + appConfig.numThreads());
        System.out.println(RULE);

        System.out.println("\n[1/4] Loading dataset...");
        final LoadResult loadResult = loader.load(appConfig.inputFile());
        if (loadResult.skipped() > 0) {
            System.err.printf("Warning: skipped %d malformed lines%n", loadResult.skipped());
        }
        if (loadResult.isEmpty()) {
            LOGGER.severe("No logs loaded from " + appConfig.inputFile() + ". Exiting.");
            return Optional.empty();
        }
        final List<LogEntry> batch = loadResult.entries();

        System.out.println("\n[2/4] Initializing engines...");
        final RuleClassifier classifier = new RuleClassifier(RuleTable.defaults());
        final BatchRunner runner = new BatchRunner(new LogAnalysisPipeline(classifier, new ReportGenerator()),
                appConfig.numThreads(), appConfig.chunkSize(), appConfig.progressInterval(), progressListener);
        System.out.printf("Engines initialized: %d rule categories, %d worker threads%n",
                classifier.getRuleTable().size(), runner.getNumThreads());

        System.out.println("\n[3/4] Processing logs...");
        final BatchRunInfo runInfo = runner.run(batch);
        System.out.printf("Processing completed! Status: %s (%d processed, %d failed)%n",
                runInfo.status(), runInfo.processed(), runInfo.failed());
        if (runInfo.status() == Status.FAIL) {
            LOGGER.warning("Some workers did not finish; statistics cover whatever was processed");
        }

        System.out.println("\n[4/4] Calculating statistics...");
        final Optional<PerformanceStats> aggregated = StatsAggregator.aggregate(batch, runInfo.wallTimeSeconds(),
                runInfo.numThreads());
        if (aggregated.isEmpty()) return Optional.empty();
        final PerformanceStats stats = aggregated.get().withPeakMemoryMb(MemoryUsage.peakMemoryMb());

        reportWriter.printSummary(stats);
        reportWriter.printLabelDistribution(StatsAggregator.labelDistribution(batch));

        System.out.println("\n--- Saving Results ---");
        reportWriter.writeStatsJson(stats, appConfig.statsPath());
        reportWriter.writeDetailedResults(batch, appConfig.resultsPath());

        System.out.println("\n" + RULE);
        System.out.println("EXPERIMENT COMPLETED");
        System.out.println(RULE);
        return Optional.of(stats);
    }
}
