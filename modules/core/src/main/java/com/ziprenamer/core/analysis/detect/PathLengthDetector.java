package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.PathTooLong;
import com.ziprenamer.core.analysis.Platform;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.Utf8;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports one warning per platform whose limit a file path exceeds.
 */
public class PathLengthDetector extends Detector<PathTooLong> {

    private final List<PathTooLong> warnings = new ArrayList<>();

    @Override
    protected void inspect(ArchiveEntry entry) {
        int length = Utf8.byteLength(entry.path());
        for (Platform platform : Platform.values()) {
            if (length > platform.pathLimit()) {
                warnings.add(new PathTooLong(entry.path(), length, platform, platform.pathLimit()));
            }
        }
    }

    @Override
    protected List<PathTooLong> results() {
        return warnings;
    }
}
