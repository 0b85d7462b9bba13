package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.SystemFile;
import com.ziprenamer.core.analysis.AnalysisWarnings.SystemFileType;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.PathParts;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags operating-system artifacts, directories included. Reports at most
 * {@value #MAX_REPORTED} entries.
 */
public class SystemFileDetector extends Detector<SystemFile> {

    static final int MAX_REPORTED = 20;

    private final List<SystemFile> found = new ArrayList<>();

    @Override
    protected boolean accepts(ArchiveEntry entry) {
        return found.size() < MAX_REPORTED;
    }

    @Override
    protected void inspect(ArchiveEntry entry) {
        PathParts parts = PathParts.of(entry.path(), entry.directory());
        // a directory lies inside itself for the folder checks
        List<String> folders = new ArrayList<>(parts.parentSegments());
        if (entry.directory()) {
            folders.add(parts.baseName());
        }
        String base = entry.directory() ? "" : parts.baseName();
        String foldedBase = base.toLowerCase(Locale.ROOT);

        SystemFileType type = null;
        if (folders.contains("__MACOSX")) {
            type = SystemFileType.MACOSX;
        } else if (base.endsWith(".DS_Store")) {
            type = SystemFileType.DS_STORE;
        } else if (foldedBase.endsWith("thumbs.db")) {
            type = SystemFileType.THUMBS_DB;
        } else if (foldedBase.endsWith("desktop.ini")) {
            type = SystemFileType.DESKTOP_INI;
        } else if (folders.contains(".git")) {
            type = SystemFileType.GIT;
        }
        if (type != null) {
            found.add(new SystemFile(entry.path(), type));
        }
    }

    @Override
    protected List<SystemFile> results() {
        return found;
    }
}
