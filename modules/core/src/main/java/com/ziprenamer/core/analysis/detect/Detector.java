package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.types.ArchiveEntry;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * One independent check over a listing. A failure on one entry is handed to
 * {@link DetectorFailures} and never stops the remaining entries or detectors.
 *
 * @param <W> warning type produced
 */
public abstract class Detector<W> {

    private static final Logger log = Logger.getLogger(Detector.class);

    public List<W> detect(List<ArchiveEntry> entries, DetectorFailures failures) {
        for (ArchiveEntry entry : entries) {
            if (!accepts(entry)) continue;
            try {
                inspect(entry);
            } catch (RuntimeException e) {
                log.warnf(e, "%s failed on %s", getClass().getSimpleName(), entry.path());
                failures.record(entry.path(), e);
            }
        }
        return results();
    }

    /** Files only unless overridden. */
    protected boolean accepts(ArchiveEntry entry) {
        return !entry.directory();
    }

    protected abstract void inspect(ArchiveEntry entry);

    protected abstract List<W> results();
}
