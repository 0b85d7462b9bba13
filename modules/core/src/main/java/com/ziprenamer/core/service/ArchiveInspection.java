package com.ziprenamer.core.service;

import com.ziprenamer.core.analysis.AnalysisReport;
import com.ziprenamer.types.ArchiveEntry;

import java.util.List;
import java.util.Objects;

/**
 * Listing and analysis of an uploaded container.
 *
 * @param formatKey    detected container format
 * @param entries      listing, truncated to the preview limit
 * @param totalEntries entry count before truncation
 * @param report       analysis of the full listing
 */
public record ArchiveInspection(
        String formatKey,
        List<ArchiveEntry> entries,
        int totalEntries,
        AnalysisReport report
) {

    public ArchiveInspection {
        Objects.requireNonNull(formatKey, "formatKey cannot be null");
        Objects.requireNonNull(report, "report cannot be null");
        entries = List.copyOf(entries);
    }

    public boolean truncated() {
        return entries.size() < totalEntries;
    }
}
