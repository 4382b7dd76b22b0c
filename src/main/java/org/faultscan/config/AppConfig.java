package org.faultscan.config;

import java.nio.file.Path;

/**
 * Run configuration. Any component left out of the YAML file falls back to its default.
 */
public record AppConfig(Path inputFile, Path outputDir, Integer numThreads, Integer chunkSize,
                        Integer progressInterval, String statsFile, String resultsFile) {

    public static final Path DEFAULT_INPUT_FILE = Path.of("data", "subset_500.csv");
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("output");
    public static final int DEFAULT_NUM_THREADS = 32;
    public static final int DEFAULT_CHUNK_SIZE = 10;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;
    public static final String DEFAULT_STATS_FILE = "faultscan_performance.json";
    public static final String DEFAULT_RESULTS_FILE = "faultscan_results.csv";

    public AppConfig {
        if (inputFile == null) inputFile = DEFAULT_INPUT_FILE;
        if (outputDir == null) outputDir = DEFAULT_OUTPUT_DIR;
        if (numThreads == null) numThreads = DEFAULT_NUM_THREADS;
        if (chunkSize == null) chunkSize = DEFAULT_CHUNK_SIZE;
        if (progressInterval == null) progressInterval = DEFAULT_PROGRESS_INTERVAL;
        if (statsFile == null || statsFile.isBlank()) statsFile = DEFAULT_STATS_FILE;
        if (resultsFile == null || resultsFile.isBlank()) resultsFile = DEFAULT_RESULTS_FILE;
    }

    public static AppConfig defaults() {
        return new AppConfig(null, null, null, null, null, null, null);
    }

    /**
     * Applies positional command-line overrides: {@code [inputFile] [outputDir] [numThreads]}.
     *
     * @throws IllegalArgumentException if the thread count is not a positive number
     */
    public AppConfig withArgs(String[] args) {
        if (args == null || args.length == 0) return this;
        Path input = args.length > 0 ? Path.of(args[0]) : inputFile;
        Path output = args.length > 1 ? Path.of(args[1]) : outputDir;
        Integer threads = numThreads;
        if (args.length > 2) {
            try {
                threads = Integer.parseInt(args[2].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("command line: thread count must be an integer, got " + args[2], e);
            }
        }
        return new AppConfig(input, output, threads, chunkSize, progressInterval, statsFile, resultsFile)
                .validate("command line");
    }

    /**
     * Rejects non-positive worker, chunk and progress settings.
     *
     * @param source where the values came from, used in the error message
     * @return this config
     * @throws IllegalArgumentException naming the source and the offending setting
     */
    public AppConfig validate(String source) {
        requirePositive(source, "numThreads", numThreads);
        requirePositive(source, "chunkSize", chunkSize);
        requirePositive(source, "progressInterval", progressInterval);
        return this;
    }

    private static void requirePositive(String source, String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(source + ": " + name + " must be >= 1, got " + value);
        }
    }

    public Path statsPath() {
        return outputDir.resolve(statsFile);
    }

    public Path resultsPath() {
        return outputDir.resolve(resultsFile);
    }
}
