package org.faultscan.model;

import java.util.List;

/**
 * Coarse issue category, independent of the predicted fault label.
 */
public enum IssueCategory {
    CONFIGURATION("Configuration", "config"),
    PERFORMANCE("Performance", "perform"),
    CONNECTIVITY("Connectivity", "connect"),
    GENERAL("General", null);

    private final String label;
    private final String marker;

    IssueCategory(String label, String marker) {
        this.label = label;
        this.marker = marker;
    }

    public String label() {
        return label;
    }

    /**
     * First keyword carrying a marker decides; markers are tried in declaration order per keyword.
     */
    public static IssueCategory fromKeywords(List<String> keywords) {
        for (String keyword : keywords) {
            for (IssueCategory category : values()) {
                if (category.marker != null && keyword.contains(category.marker)) {
                    return category;
                }
            }
        }
        return GENERAL;
    }
}
