package org.faultscan.model;

/**
 * Confidence tier of a prediction, derived from rule-match counts.
 */
public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Tier for the number of keywords that matched the predicted category.
     */
    public static Confidence forMatchCount(int matchCount) {
        if (matchCount >= 3) return HIGH;
        if (matchCount >= 1) return MEDIUM;
        return LOW;
    }
}
