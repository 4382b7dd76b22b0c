package org.faultscan.processing;

import org.faultscan.model.LogEntry;

/**
 * Stage 2: renders the per-record report line and times it.
 */
public class ReportGenerator {

    public String generate(LogEntry entry) {
        final long start = System.nanoTime();
        final String report = render(entry);
        entry.setStage2TimeMs((System.nanoTime() - start) / 1_000_000.0);
        return report;
    }

    static String render(LogEntry entry) {
        return "[%s] line %d: %s (%s confidence), category %s, component %s, keywords %s".formatted(
                entry.severityTier(),
                entry.lineId(),
                LogEntry.NORMAL_LABEL.equals(entry.predictedLabel()) ? "Normal" : entry.predictedLabel(),
                entry.confidence() == null ? "no" : entry.confidence().label(),
                entry.issueCategory() == null ? "" : entry.issueCategory().label(),
                entry.affectedComponent(),
                String.join(" ", entry.keywords()));
    }
}
