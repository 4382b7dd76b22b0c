package org.faultscan.model;

import java.util.List;

/**
 * One log line plus its analysis outputs and timings.
 * Input fields are fixed at load time; output fields are written by a single worker.
 */
public class LogEntry {

    /** Predicted-label value meaning "no fault detected". */
    public static final String NORMAL_LABEL = "-";

    private final int lineId;
    private final String label;
    private final String timestamp;
    private final String date;
    private final String node;
    private final String time;
    private final String component;
    private final String level;
    private final String content;
    private final String eventTemplate;

    // Analysis results
    private String predictedLabel = "";
    private Confidence confidence;
    private SeverityTier severityTier;
    private List<String> keywords = List.of();
    private String affectedComponent = "";
    private IssueCategory issueCategory;

    private double stage1TimeMs;
    private double stage2TimeMs;
    private double totalTimeMs;

    public LogEntry(int lineId, String label, String timestamp, String date, String node, String time,
                    String component, String level, String content, String eventTemplate) {
        this.lineId = lineId;
        this.label = nullToEmpty(label);
        this.timestamp = nullToEmpty(timestamp);
        this.date = nullToEmpty(date);
        this.node = nullToEmpty(node);
        this.time = nullToEmpty(time);
        this.component = nullToEmpty(component);
        this.level = nullToEmpty(level);
        this.content = nullToEmpty(content);
        this.eventTemplate = nullToEmpty(eventTemplate);
    }

    public static LogEntry of(int lineId, String label, String level, String content) {
        return new LogEntry(lineId, label, "", "", "", "", "", level, content, "");
    }

    public void applyClassification(ClassificationResult result) {
        this.predictedLabel = result.predictedLabel();
        this.confidence = result.confidence();
        this.severityTier = result.severityTier();
        this.issueCategory = result.issueCategory();
        this.keywords = List.copyOf(result.keywords());
        this.affectedComponent = component;
    }

    /**
     * Drops every output back to its default, as after a failed analysis.
     */
    public void resetOutputs() {
        this.predictedLabel = "";
        this.confidence = null;
        this.severityTier = null;
        this.issueCategory = null;
        this.keywords = List.of();
        this.affectedComponent = "";
        this.stage1TimeMs = 0;
        this.stage2TimeMs = 0;
        this.totalTimeMs = 0;
    }

    public boolean isClassified() {
        return !predictedLabel.isEmpty() && confidence != null;
    }

    /**
     * True when an analyzed entry's prediction equals its ground truth. Unclassified entries are never correct.
     */
    public boolean isCorrect() {
        return isClassified() && predictedLabel.equals(label);
    }

    public int keywordChars() {
        int chars = 0;
        for (String keyword : keywords) chars += keyword.length();
        return chars;
    }

    public int lineId() {
        return lineId;
    }

    public String label() {
        return label;
    }

    public String timestamp() {
        return timestamp;
    }

    public String date() {
        return date;
    }

    public String node() {
        return node;
    }

    public String time() {
        return time;
    }

    public String component() {
        return component;
    }

    public String level() {
        return level;
    }

    public String content() {
        return content;
    }

    public String eventTemplate() {
        return eventTemplate;
    }

    public String predictedLabel() {
        return predictedLabel;
    }

    public Confidence confidence() {
        return confidence;
    }

    public SeverityTier severityTier() {
        return severityTier;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String affectedComponent() {
        return affectedComponent;
    }

    public IssueCategory issueCategory() {
        return issueCategory;
    }

    public double stage1TimeMs() {
        return stage1TimeMs;
    }

    public void setStage1TimeMs(double stage1TimeMs) {
        this.stage1TimeMs = stage1TimeMs;
    }

    public double stage2TimeMs() {
        return stage2TimeMs;
    }

    public void setStage2TimeMs(double stage2TimeMs) {
        this.stage2TimeMs = stage2TimeMs;
    }

    public double totalTimeMs() {
        return totalTimeMs;
    }

    public void setTotalTimeMs(double totalTimeMs) {
        this.totalTimeMs = totalTimeMs;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "LogEntry[" + lineId + ", label=" + label + ", predicted=" + predictedLabel + "]";
    }
}
