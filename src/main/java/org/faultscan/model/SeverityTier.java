package org.faultscan.model;

/**
 * Normalized bucket of a raw severity level string.
 */
public enum SeverityTier {
    CRITICAL, ERROR, WARNING, INFO;

    /**
     * Maps a raw level case-sensitively; anything unrecognized (including null) is INFO.
     */
    public static SeverityTier fromLevel(String level) {
        if (level == null) return INFO;
        return switch (level) {
            case "CRITICAL", "FATAL" -> CRITICAL;
            case "ERROR" -> ERROR;
            case "WARN", "WARNING" -> WARNING;
            default -> INFO;
        };
    }
}
