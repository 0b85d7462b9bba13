package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.ConflictType;
import com.ziprenamer.core.analysis.AnalysisWarnings.RenameConflict;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.PathParts;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds sibling files that would collide on a case-insensitive file system.
 * Reports at most {@value #MAX_REPORTED} conflicts.
 */
public class ConflictSimulator extends Detector<RenameConflict> {

    static final int MAX_REPORTED = 10;

    // directory -> folded name -> original base names
    private final Map<String, Map<String, List<String>>> directories = new LinkedHashMap<>();

    @Override
    protected void inspect(ArchiveEntry entry) {
        PathParts parts = PathParts.ofFile(entry.path());
        directories.computeIfAbsent(parts.parentPath(), d -> new LinkedHashMap<>())
                .computeIfAbsent(parts.baseName().toLowerCase(Locale.ROOT), n -> new ArrayList<>())
                .add(parts.baseName());
    }

    @Override
    protected List<RenameConflict> results() {
        List<RenameConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<String>>> dir : directories.entrySet()) {
            for (Map.Entry<String, List<String>> name : dir.getValue().entrySet()) {
                List<String> originals = name.getValue();
                if (originals.size() > 1 && new HashSet<>(originals).size() > 1) {
                    conflicts.add(new RenameConflict(
                            dir.getKey().isEmpty() ? "/" : dir.getKey(),
                            originals,
                            name.getKey(),
                            originals.size(),
                            ConflictType.CASE_SENSITIVITY));
                    if (conflicts.size() == MAX_REPORTED) {
                        return conflicts;
                    }
                }
            }
        }
        return conflicts;
    }
}
