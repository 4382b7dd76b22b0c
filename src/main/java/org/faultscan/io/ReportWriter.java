package org.faultscan.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faultscan.model.LogEntry;
import org.faultscan.stats.LabelDistribution;
import org.faultscan.stats.PerformanceStats;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.faultscan.util.Utils.escapeCsvField;

/**
 * Persists run results (JSON statistics, per-record CSV) and prints the console summary.
 */
public class ReportWriter {

    public static final String SCENARIO = "faultscan";
    static final String RESULTS_HEADER = "LineId,GroundTruth,PredictedLabel,Confidence,Severity,"
                                         + "Stage1TimeMs,Stage2TimeMs,TotalTimeMs,KeywordsCount";
    private static final String RULE = "=".repeat(80);

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public ReportWriter() {
        this(System.out);
    }

    public ReportWriter(PrintStream out) {
        this.out = out;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeStatsJson(final PerformanceStats stats, final Path file) throws IOException {
        createParent(file);
        objectMapper.writeValue(file.toFile(), toJsonTree(stats));
        out.println("Performance stats saved to: " + file);
    }

    ObjectNode toJsonTree(final PerformanceStats stats) {
        final ObjectNode root = objectMapper.createObjectNode();

        final ObjectNode metadata = root.putObject("metadata");
        metadata.put("scenario", SCENARIO);
        metadata.put("total_logs_processed", stats.totalLogs());
        metadata.put("num_threads", stats.numThreads());
        metadata.put("total_time_seconds", round(stats.totalTimeSec(), 6));

        final ObjectNode throughput = root.putObject("throughput");
        throughput.put("logs_per_second", round(stats.throughputLogsPerSec(), 3));
        throughput.put("avg_time_per_log_ms", round(stats.avgTimePerLogMs(), 3));

        final ObjectNode stages = root.putObject("stage_breakdown");
        stages.put("stage1_time_sec", round(stats.stage1TimeSec(), 6));
        stages.put("stage2_time_sec", round(stats.stage2TimeSec(), 6));
        stages.put("stage1_percentage", round(stats.stage1Percentage(), 2));
        stages.put("stage2_percentage", round(stats.stage2Percentage(), 2));

        final ObjectNode accuracy = root.putObject("accuracy");
        accuracy.put("correct", stats.correctPredictions());
        accuracy.put("total", stats.total());
        accuracy.put("accuracy_percentage", round(stats.accuracyPercentage(), 2));

        final ObjectNode keywords = root.putObject("keywords_statistics");
        keywords.put("avg_keywords_count", round(stats.avgKeywordsCount(), 2));
        keywords.put("avg_keywords_chars", round(stats.avgKeywordsChars(), 2));

        root.putObject("memory_usage").put("peak_memory_mb", stats.peakMemoryMb());
        return root;
    }

    public void writeDetailedResults(final List<LogEntry> batch, final Path file) throws IOException {
        createParent(file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(RESULTS_HEADER);
            writer.newLine();
            for (final LogEntry entry : batch) {
                writer.write(resultLine(entry));
                writer.newLine();
            }
        }
        out.println("Detailed results saved to: " + file);
    }

    static String resultLine(final LogEntry entry) {
        return String.join(",",
                String.valueOf(entry.lineId()),
                escapeCsvField(entry.label()),
                escapeCsvField(entry.predictedLabel()),
                entry.confidence() == null ? "" : entry.confidence().label(),
                entry.severityTier() == null ? "" : entry.severityTier().name(),
                fixed(entry.stage1TimeMs(), 3),
                fixed(entry.stage2TimeMs(), 3),
                fixed(entry.stage1TimeMs() + entry.stage2TimeMs(), 3),
                String.valueOf(entry.keywords().size()));
    }

    public void printSummary(final PerformanceStats stats) {
        out.println();
        out.println(RULE);
        out.println("PERFORMANCE ANALYSIS SUMMARY");
        out.println(RULE);

        out.println("\n--- Overall Throughput ---");
        out.printf(Locale.ROOT, "Total logs: %d%n", stats.totalLogs());
        out.printf(Locale.ROOT, "Threads: %d%n", stats.numThreads());
        out.printf(Locale.ROOT, "Total time: %.3f seconds%n", stats.totalTimeSec());
        out.printf(Locale.ROOT, "Throughput: %.2f logs/sec%n", stats.throughputLogsPerSec());
        out.printf(Locale.ROOT, "Avg time per log: %.3f ms%n", stats.avgTimePerLogMs());

        out.println("\n--- Stage Breakdown ---");
        out.printf(Locale.ROOT, "Stage 1: %.3fs (%.1f%%)%n", stats.stage1TimeSec(), stats.stage1Percentage());
        out.printf(Locale.ROOT, "Stage 2: %.3fs (%.1f%%)%n", stats.stage2TimeSec(), stats.stage2Percentage());

        out.println("\n--- Prediction Accuracy ---");
        out.printf(Locale.ROOT, "Correct: %d/%d%n", stats.correctPredictions(), stats.total());
        out.printf(Locale.ROOT, "Accuracy: %.1f%%%n", stats.accuracyPercentage());

        out.println("\n--- Keywords Statistics ---");
        out.printf(Locale.ROOT, "Avg keywords per log: %.1f%n", stats.avgKeywordsCount());
        out.printf(Locale.ROOT, "Avg chars per log: %.1f%n", stats.avgKeywordsChars());

        out.println("\n--- Memory Usage ---");
        out.printf(Locale.ROOT, "Peak memory: %d MB%n", stats.peakMemoryMb());
        out.println(RULE);
    }

    public void printLabelDistribution(final LabelDistribution distribution) {
        out.println("\n--- Label Distribution ---");
        out.println("\nGround Truth:");
        printCounts(distribution.groundTruth());
        out.println("\nPredicted:");
        printCounts(distribution.predicted());
    }

    private void printCounts(final Map<String, Integer> counts) {
        counts.forEach((label, count) -> out.printf("  %s: %d%n", displayLabel(label), count));
    }

    static String displayLabel(final String label) {
        if (label.isEmpty()) return "Unclassified";
        if (LogEntry.NORMAL_LABEL.equals(label)) return "Normal (-)";
        return label;
    }

    private static void createParent(final Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static BigDecimal round(final double value, final int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return BigDecimal.ZERO;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }

    private static String fixed(final double value, final int scale) {
        return String.format(Locale.ROOT, "%." + scale + "f", value);
    }
}
