package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.DuplicateName;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.PathParts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups files by directory and case-folded base name. A group is reported once it
 * holds more than one spelling; repeats of one exact path alone are not duplicates.
 */
public class DuplicateNameDetector extends Detector<DuplicateName> {

    static final int MAX_PATHS = 10;

    private record Key(String directory, String foldedName) {}

    private final Map<Key, List<String>> groups = new LinkedHashMap<>();

    @Override
    protected void inspect(ArchiveEntry entry) {
        PathParts parts = PathParts.ofFile(entry.path());
        groups.computeIfAbsent(new Key(parts.parentPath(), parts.baseName().toLowerCase(Locale.ROOT)),
                k -> new ArrayList<>()).add(entry.path());
    }

    @Override
    protected List<DuplicateName> results() {
        List<DuplicateName> duplicates = new ArrayList<>();
        groups.forEach((key, paths) -> {
            if (paths.stream().distinct().count() > 1) {
                duplicates.add(new DuplicateName(
                        key.directory().isEmpty() ? "/" : key.directory(),
                        PathParts.ofFile(paths.get(0)).baseName(),
                        paths.size(),
                        paths.subList(0, Math.min(MAX_PATHS, paths.size()))));
            }
        });
        return duplicates;
    }
}
