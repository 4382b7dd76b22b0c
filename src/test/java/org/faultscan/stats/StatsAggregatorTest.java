package org.faultscan.stats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.faultscan.model.ClassificationResult;
import org.faultscan.model.Confidence;
import org.faultscan.model.IssueCategory;
import org.faultscan.model.LogEntry;
import org.faultscan.model.SeverityTier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatsAggregatorTest {

    private static LogEntry entry(int id, String truth, String predicted, List<String> keywords,
                                  double stage1Ms, double stage2Ms) {
        LogEntry entry = LogEntry.of(id, truth, "ERROR", "");
        entry.applyClassification(new ClassificationResult(predicted, Confidence.MEDIUM, SeverityTier.ERROR,
                IssueCategory.GENERAL, keywords));
        entry.setStage1TimeMs(stage1Ms);
        entry.setStage2TimeMs(stage2Ms);
        entry.setTotalTimeMs(stage1Ms + stage2Ms);
        return entry;
    }

    private static List<LogEntry> sampleBatch() {
        return List.of(
                entry(1, "Network", "Network", List.of("socket", "timeout"), 3.0, 1.0),
                entry(2, "-", "-", List.of(), 2.0, 0.0),
                entry(3, "Security", "Application", List.of("failed"), 1.0, 1.0));
    }

    @Test
    void testAggregate_countsAndRates() {
        PerformanceStats stats = StatsAggregator.aggregate(sampleBatch(), 0.5, 4).orElseThrow();

        assertEquals(3, stats.totalLogs());
        assertEquals(3, stats.total());
        assertEquals(4, stats.numThreads());
        assertEquals(0.5, stats.totalTimeSec());
        assertEquals(6.0, stats.throughputLogsPerSec(), 1e-12);
        assertEquals(0.006, stats.stage1TimeSec(), 1e-12);
        assertEquals(0.002, stats.stage2TimeSec(), 1e-12);
        assertEquals(8.0 / 3, stats.avgTimePerLogMs(), 1e-12);
        assertEquals(1.0, stats.avgKeywordsCount(), 1e-12);
        assertEquals((6 + 7 + 6) / 3.0, stats.avgKeywordsChars(), 1e-12);
        assertEquals(0L, stats.peakMemoryMb());
    }

    @Test
    void testAggregate_accuracyIsExactRatio() {
        PerformanceStats stats = StatsAggregator.aggregate(sampleBatch(), 1.0, 1).orElseThrow();

        assertEquals(2, stats.correctPredictions());
        assertEquals(100.0 * 2 / 3, stats.accuracyPercentage());
    }

    @Test
    void testAggregate_stagePercentagesSumToHundred() {
        PerformanceStats stats = StatsAggregator.aggregate(sampleBatch(), 1.0, 1).orElseThrow();

        assertEquals(75.0, stats.stage1Percentage(), 1e-9);
        assertEquals(25.0, stats.stage2Percentage(), 1e-9);
        assertEquals(100.0, stats.stage1Percentage() + stats.stage2Percentage(), 1e-9);
    }

    @Test
    void testAggregate_zeroStageTimeLeavesPercentagesAtZero() {
        List<LogEntry> batch = List.of(entry(1, "-", "-", List.of(), 0.0, 0.0),
                entry(2, "-", "Network", List.of("port"), 0.0, 0.0));

        PerformanceStats stats = StatsAggregator.aggregate(batch, 1.0, 1).orElseThrow();

        assertEquals(0.0, stats.stage1Percentage());
        assertEquals(0.0, stats.stage2Percentage());
        assertEquals(0.0, stats.avgTimePerLogMs());
        assertEquals(50.0, stats.accuracyPercentage());
    }

    @Test
    void testAggregate_emptyBatchCannotProceed() {
        assertEquals(Optional.empty(), StatsAggregator.aggregate(List.of(), 1.0, 4));
        assertEquals(Optional.empty(), StatsAggregator.aggregate(null, 1.0, 4));
    }

    @Test
    void testAggregate_zeroWallClockDoesNotDivide() {
        PerformanceStats stats = StatsAggregator.aggregate(sampleBatch(), 0.0, 1).orElseThrow();
        assertEquals(0.0, stats.throughputLogsPerSec());
    }

    @Test
    void testAggregate_independentOfRecordOrder() {
        List<LogEntry> reversed = new ArrayList<>(sampleBatch());
        Collections.reverse(reversed);

        PerformanceStats a = StatsAggregator.aggregate(sampleBatch(), 1.0, 1).orElseThrow();
        PerformanceStats b = StatsAggregator.aggregate(reversed, 1.0, 1).orElseThrow();

        assertEquals(a.correctPredictions(), b.correctPredictions());
        assertEquals(a.accuracyPercentage(), b.accuracyPercentage());
        assertEquals(a.avgKeywordsCount(), b.avgKeywordsCount());
        assertEquals(a.avgKeywordsChars(), b.avgKeywordsChars());
    }

    @Test
    void testLabelDistribution() {
        LabelDistribution distribution = StatsAggregator.labelDistribution(sampleBatch());

        assertEquals(Map.of("-", 1, "Network", 1, "Security", 1), distribution.groundTruth());
        assertEquals(Map.of("-", 1, "Network", 1, "Application", 1), distribution.predicted());
        assertEquals("-", distribution.predicted().firstKey());
    }

    @Test
    void testPerformanceStats_serializesWithReportFieldNames() {
        PerformanceStats stats = StatsAggregator.aggregate(sampleBatch(), 1.0, 2).orElseThrow()
                .withPeakMemoryMb(64);

        JsonNode json = new ObjectMapper().valueToTree(stats);

        for (String field : List.of("total_logs_processed", "num_threads", "total_time_seconds", "logs_per_second",
                "avg_time_per_log_ms", "stage1_time_sec", "stage2_time_sec", "stage1_percentage",
                "stage2_percentage", "correct", "total", "accuracy_percentage", "avg_keywords_count",
                "avg_keywords_chars", "peak_memory_mb")) {
            assertTrue(json.has(field), "Missing field " + field + " in " + json);
        }
        assertEquals(64, json.get("peak_memory_mb").asLong());
        assertEquals(3, json.get("total").asInt());
    }
}
