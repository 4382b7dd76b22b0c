package org.faultscan.model;

import java.util.List;

public record ClassificationResult(String predictedLabel, Confidence confidence, SeverityTier severityTier,
                                   IssueCategory issueCategory, List<String> keywords) {

    public boolean isNormal() {
        return LogEntry.NORMAL_LABEL.equals(predictedLabel);
    }
}
