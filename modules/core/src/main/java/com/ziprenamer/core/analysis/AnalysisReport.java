package com.ziprenamer.core.analysis;

import java.util.Objects;

/**
 * Result of a pre-flight analysis.
 *
 * @param timestamp ISO-8601 instant the analysis ran
 */
public record AnalysisReport(
        ArchiveStats stats,
        AnalysisWarnings warnings,
        Severity severity,
        String timestamp
) {

    public AnalysisReport {
        Objects.requireNonNull(stats, "stats cannot be null");
        Objects.requireNonNull(warnings, "warnings cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }
}
