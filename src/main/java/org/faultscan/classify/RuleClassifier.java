package org.faultscan.classify;

import org.faultscan.model.ClassificationResult;
import org.faultscan.model.Confidence;
import org.faultscan.model.IssueCategory;
import org.faultscan.model.LogEntry;
import org.faultscan.model.SeverityTier;
import org.faultscan.rules.RuleTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stage 1: keyword-rule classification of a single log line.
 * Holds no mutable state, so one instance can serve every worker.
 */
public class RuleClassifier {

    public static final int MAX_KEYWORDS = 10;
    public static final int MIN_KEYWORD_LENGTH = 3;

    private static final String INFO_LEVEL = "INFO";

    private final RuleTable ruleTable;

    public RuleClassifier(RuleTable ruleTable) {
        this.ruleTable = Objects.requireNonNull(ruleTable, "Rule table cannot be null");
    }

    public RuleTable getRuleTable() {
        return ruleTable;
    }

    /**
     * Classifies the entry's content in place and records how long it took.
     */
    public void analyze(LogEntry entry) {
        final long start = System.nanoTime();
        entry.applyClassification(classify(entry.content(), entry.level()));
        entry.setStage1TimeMs((System.nanoTime() - start) / 1_000_000.0);
    }

    public ClassificationResult classify(String text, String rawSeverity) {
        final List<String> keywords = extractKeywords(text);
        final String predictedLabel = predictLabel(keywords, rawSeverity);
        return new ClassificationResult(
                predictedLabel,
                confidenceFor(keywords, predictedLabel),
                SeverityTier.fromLevel(rawSeverity),
                IssueCategory.fromKeywords(keywords),
                keywords);
    }

    /**
     * Lower-cased alphanumeric tokens longer than two characters, sorted, deduplicated and
     * truncated to the first {@value #MAX_KEYWORDS} in lexical order.
     */
    public static List<String> extractKeywords(String text) {
        if (text == null || text.isBlank()) return List.of();

        final TreeSet<String> unique = new TreeSet<>();
        for (String token : text.split("\\s+")) {
            final String word = asciiAlphanumericLowerCase(token);
            if (word.length() >= MIN_KEYWORD_LENGTH) unique.add(word);
        }

        final List<String> keywords = new ArrayList<>(Math.min(unique.size(), MAX_KEYWORDS));
        for (String word : unique) {
            if (keywords.size() == MAX_KEYWORDS) break;
            keywords.add(word);
        }
        return List.copyOf(keywords);
    }

    /**
     * Per-category score: one point for each keyword/trigger pair where either contains the other.
     * Iteration follows the rule table's category order.
     */
    public Map<String, Integer> score(List<String> keywords) {
        final Map<String, Integer> scores = new LinkedHashMap<>();
        for (String category : ruleTable.categories()) {
            int score = 0;
            final Set<String> triggers = ruleTable.lookup(category);
            for (String keyword : keywords) {
                for (String trigger : triggers) {
                    if (matchesEitherWay(keyword, trigger)) score++;
                }
            }
            scores.put(category, score);
        }
        return scores;
    }

    String predictLabel(List<String> keywords, String rawSeverity) {
        String bestLabel = LogEntry.NORMAL_LABEL;
        int maxScore = 0;
        for (Map.Entry<String, Integer> entry : score(keywords).entrySet()) {
            // strict comparison keeps the first category among equal maxima
            if (entry.getValue() > maxScore) {
                maxScore = entry.getValue();
                bestLabel = entry.getKey();
            }
        }

        if (maxScore == 0) return LogEntry.NORMAL_LABEL;
        if (maxScore <= 1 && INFO_LEVEL.equals(rawSeverity)) return LogEntry.NORMAL_LABEL;
        return bestLabel;
    }

    Confidence confidenceFor(List<String> keywords, String predictedLabel) {
        if (LogEntry.NORMAL_LABEL.equals(predictedLabel)) {
            return containsAnyTrigger(keywords) ? Confidence.LOW : Confidence.HIGH;
        }

        int matchCount = 0;
        final Set<String> triggers = ruleTable.lookup(predictedLabel);
        for (String keyword : keywords) {
            for (String trigger : triggers) {
                if (matchesEitherWay(keyword, trigger)) {
                    matchCount++;
                    break;
                }
            }
        }
        return Confidence.forMatchCount(matchCount);
    }

    private boolean containsAnyTrigger(List<String> keywords) {
        for (String category : ruleTable.categories()) {
            for (String keyword : keywords) {
                for (String trigger : ruleTable.lookup(category)) {
                    if (keyword.contains(trigger)) return true;
                }
            }
        }
        return false;
    }

    private static boolean matchesEitherWay(String keyword, String trigger) {
        return keyword.contains(trigger) || trigger.contains(keyword);
    }

    // Only A-Z is folded; any other letter is dropped rather than mapped onto ASCII.
    private static String asciiAlphanumericLowerCase(String token) {
        final StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if (c >= 'A' && c <= 'Z') sb.append((char) (c + ('a' - 'A')));
            else if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) sb.append(c);
        }
        return sb.toString();
    }
}
