package org.faultscan.processing;

import org.faultscan.classify.RuleClassifier;
import org.faultscan.model.LogEntry;

import java.util.Objects;

/**
 * Rule analysis followed by report generation for one entry; total time is the sum of both stages.
 */
public class LogAnalysisPipeline implements RecordProcessor {

    private final RuleClassifier classifier;
    private final ReportGenerator reportGenerator;

    public LogAnalysisPipeline(RuleClassifier classifier, ReportGenerator reportGenerator) {
        this.classifier = Objects.requireNonNull(classifier);
        this.reportGenerator = Objects.requireNonNull(reportGenerator);
    }

    @Override
    public void process(LogEntry entry) {
        classifier.analyze(entry);
        reportGenerator.generate(entry);
        entry.setTotalTimeMs(entry.stage1TimeMs() + entry.stage2TimeMs());
    }
}
