package org.faultscan.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of a finished batch run. Property names are the field names downstream reports rely on.
 */
public record PerformanceStats(
        @JsonProperty("total_logs_processed") int totalLogs,
        @JsonProperty("num_threads") int numThreads,
        @JsonProperty("total_time_seconds") double totalTimeSec,
        @JsonProperty("logs_per_second") double throughputLogsPerSec,
        @JsonProperty("avg_time_per_log_ms") double avgTimePerLogMs,
        @JsonProperty("stage1_time_sec") double stage1TimeSec,
        @JsonProperty("stage2_time_sec") double stage2TimeSec,
        @JsonProperty("stage1_percentage") double stage1Percentage,
        @JsonProperty("stage2_percentage") double stage2Percentage,
        @JsonProperty("correct") int correctPredictions,
        @JsonProperty("accuracy_percentage") double accuracyPercentage,
        @JsonProperty("avg_keywords_count") double avgKeywordsCount,
        @JsonProperty("avg_keywords_chars") double avgKeywordsChars,
        @JsonProperty("peak_memory_mb") long peakMemoryMb
) {

    @JsonProperty("total")
    public int total() {
        return totalLogs;
    }

    public PerformanceStats withPeakMemoryMb(long peakMemoryMb) {
        return new PerformanceStats(totalLogs, numThreads, totalTimeSec, throughputLogsPerSec, avgTimePerLogMs,
                stage1TimeSec, stage2TimeSec, stage1Percentage, stage2Percentage, correctPredictions,
                accuracyPercentage, avgKeywordsCount, avgKeywordsChars, peakMemoryMb);
    }
}
