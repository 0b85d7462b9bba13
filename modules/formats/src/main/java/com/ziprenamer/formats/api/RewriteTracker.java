package com.ziprenamer.formats.api;

import org.jboss.logging.Logger;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves target names while a container is rewritten and refuses to write the
 * same target twice. The first entry to claim a name keeps it.
 */
public class RewriteTracker {

    private static final Logger log = Logger.getLogger(RewriteTracker.class);

    private final Map<String, String> finalPaths;
    private final Set<String> written = new HashSet<>();
    private int skipped;

    public RewriteTracker(Map<String, String> finalPaths) {
        this.finalPaths = finalPaths;
    }

    /**
     * Returns the target name for an entry, or null when the entry has no target
     * or that name was already written.
     */
    public String claim(String originalPath) {
        String target = finalPaths.getOrDefault(originalPath, originalPath);
        if (target.isEmpty()) {
            skipped++;
            log.warnf("Skipping %s: no safe target path", originalPath);
            return null;
        }
        if (!written.add(target)) {
            skipped++;
            log.warnf("Skipping %s: target %s already written", originalPath, target);
            return null;
        }
        return target;
    }

    public int skipped() {
        return skipped;
    }
}
