package org.faultscan.stats;

import org.faultscan.model.LogEntry;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Reduces a finished batch into a {@link PerformanceStats} snapshot.
 * The result depends only on the entries' own fields, never on the order they were processed in.
 */
public final class StatsAggregator {

    private static final Logger LOGGER = Logger.getLogger(StatsAggregator.class.getName());

    private StatsAggregator() {
    }

    /**
     * @return the snapshot, or empty when the batch has no entries (nothing to divide by)
     */
    public static Optional<PerformanceStats> aggregate(final List<LogEntry> batch, final double wallClockSeconds,
                                                       final int workerCount) {
        if (batch == null || batch.isEmpty()) {
            LOGGER.warning("Cannot aggregate statistics for an empty batch");
            return Optional.empty();
        }

        final int total = batch.size();
        double sumStage1Ms = 0;
        double sumStage2Ms = 0;
        long totalKeywords = 0;
        long totalKeywordChars = 0;
        int correct = 0;

        for (final LogEntry entry : batch) {
            sumStage1Ms += entry.stage1TimeMs();
            sumStage2Ms += entry.stage2TimeMs();
            totalKeywords += entry.keywords().size();
            totalKeywordChars += entry.keywordChars();
            if (entry.isCorrect()) correct++;
        }

        final double stage1Sec = sumStage1Ms / 1000.0;
        final double stage2Sec = sumStage2Ms / 1000.0;
        final double throughput = wallClockSeconds > 0 ? total / wallClockSeconds : 0.0;

        double stage1Percentage = 0.0;
        double stage2Percentage = 0.0;
        final double totalStageSec = stage1Sec + stage2Sec;
        if (totalStageSec > 0) {
            stage1Percentage = (stage1Sec / totalStageSec) * 100.0;
            stage2Percentage = (stage2Sec / totalStageSec) * 100.0;
        }

        return Optional.of(new PerformanceStats(
                total,
                workerCount,
                wallClockSeconds,
                throughput,
                (sumStage1Ms + sumStage2Ms) / total,
                stage1Sec,
                stage2Sec,
                stage1Percentage,
                stage2Percentage,
                correct,
                (100.0 * correct) / total,
                (double) totalKeywords / total,
                (double) totalKeywordChars / total,
                0L));
    }

    public static LabelDistribution labelDistribution(final List<LogEntry> batch) {
        final SortedMap<String, Integer> groundTruth = new TreeMap<>();
        final SortedMap<String, Integer> predicted = new TreeMap<>();
        for (final LogEntry entry : batch) {
            groundTruth.merge(entry.label(), 1, Integer::sum);
            predicted.merge(entry.predictedLabel(), 1, Integer::sum);
        }
        return new LabelDistribution(Collections.unmodifiableSortedMap(groundTruth),
                Collections.unmodifiableSortedMap(predicted));
    }
}
