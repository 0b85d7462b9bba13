package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.ArchiveStats;
import com.ziprenamer.types.ArchiveEntry;

import java.util.List;

public class StatsCollector {

    public ArchiveStats collect(List<ArchiveEntry> entries) {
        int files = 0;
        int directories = 0;
        long totalSize = 0;
        int maxDepth = 0;
        ArchiveEntry largest = null;

        for (ArchiveEntry entry : entries) {
            if (entry.directory()) {
                directories++;
            } else {
                files++;
                totalSize += entry.size();
                if (largest == null || entry.size() > largest.size()) {
                    largest = entry;
                }
            }
            maxDepth = Math.max(maxDepth, depth(entry.path()));
        }

        return new ArchiveStats(files, directories, totalSize, maxDepth,
                largest == null
                        ? ArchiveStats.LargestFile.NONE
                        : new ArchiveStats.LargestFile(largest.path(), largest.size()));
    }

    static int depth(String path) {
        int slashes = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') slashes++;
        }
        return slashes;
    }
}
