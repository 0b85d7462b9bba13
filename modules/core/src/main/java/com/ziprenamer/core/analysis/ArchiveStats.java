package com.ziprenamer.core.analysis;

import java.util.Objects;

/**
 * Aggregate counts over a listing.
 *
 * @param maxDepth    greatest number of {@code /} in any entry path
 * @param largestFile first file of maximal size, or an empty placeholder
 */
public record ArchiveStats(
        int totalFiles,
        int totalDirectories,
        long totalSize,
        int maxDepth,
        LargestFile largestFile
) {

    public ArchiveStats {
        Objects.requireNonNull(largestFile, "largestFile cannot be null");
    }

    public record LargestFile(String path, long size) {
        public static final LargestFile NONE = new LargestFile("", 0);
    }
}
