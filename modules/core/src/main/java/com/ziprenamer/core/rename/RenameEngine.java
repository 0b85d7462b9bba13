package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.RuleGroup;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.types.RenamedPath;
import com.ziprenamer.util.PathParts;
import com.ziprenamer.util.PathSegments;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the final path of every entry under a list of rule groups.
 *
 * <p>Directories are renamed first, each contributing a new last segment for its
 * own path. Files are then renamed and placed under their rewritten parent path.
 * Output follows listing order and is a pure function of the entries, the groups
 * and the run date. An entry made only of {@code .}, {@code ..} or empty segments
 * has no safe path and comes back {@linkplain RenamedPath#isDropped() dropped}.
 */
@ApplicationScoped
public class RenameEngine {

    private static final Logger log = Logger.getLogger(RenameEngine.class);

    private final ScopeMatcher scopeMatcher = new ScopeMatcher();
    private final RuleEvaluator ruleEvaluator = new RuleEvaluator();
    private final Clock clock;

    public RenameEngine() {
        this(Clock.systemDefaultZone());
    }

    public RenameEngine(Clock clock) {
        this.clock = clock;
    }

    public List<RenamedPath> rename(List<ArchiveEntry> entries, List<RuleGroup> groups) {
        Run run = new Run(groups, LocalDate.now(clock));

        for (ArchiveEntry entry : entries) {
            if (entry.directory()) {
                run.renameDirectory(entry);
            }
        }

        List<RenamedPath> result = new ArrayList<>(entries.size());
        int changed = 0;
        for (ArchiveEntry entry : entries) {
            String finalPath = entry.directory()
                    ? PathSegments.sanitize(run.resolve(entry.trimmedPath()), true)
                    : run.renameFile(entry);
            if (finalPath.isEmpty()) {
                log.debugf("Dropping %s: no safe path segment remains", entry.path());
            }
            RenamedPath renamed = new RenamedPath(entry.path(), finalPath);
            if (renamed.isChanged()) changed++;
            result.add(renamed);
        }

        log.debugf("Renamed %d of %d entries with %d rule groups", changed, entries.size(), groups.size());
        return result;
    }

    /**
     * State of a single rename call: counters and the directory segment renames.
     */
    private final class Run {

        private final List<RuleGroup> groups;
        private final LocalDate date;
        private final GroupCounters counters;
        // original directory path without trailing slash -> its new last segment
        private final Map<String, String> segmentRenames = new HashMap<>();

        Run(List<RuleGroup> groups, LocalDate date) {
            this.groups = groups.stream().filter(g -> !g.rules().isEmpty()).toList();
            this.date = date;
            this.counters = new GroupCounters(groups);
        }

        void renameDirectory(ArchiveEntry entry) {
            String key = entry.trimmedPath();
            if (key.isEmpty() || segmentRenames.containsKey(key)) {
                return;
            }
            PathParts parts = PathParts.ofDirectory(entry.path());
            String parent = resolve(parts.parentPath());
            String base = parts.baseName();
            for (RuleGroup group : groups) {
                if (!scopeMatcher.matches(group, entry)) continue;
                RuleEvaluator.Name result = ruleEvaluator.applyAll(group.rules(),
                        new RuleEvaluator.Name(base, ""), context(group, parent));
                base = lastSegment(result.baseName(), base);
            }
            segmentRenames.put(key, base);
        }

        String renameFile(ArchiveEntry entry) {
            PathParts parts = PathParts.ofFile(entry.path());
            String parent = resolve(parts.parentPath());
            String base = parts.baseName();
            for (RuleGroup group : groups) {
                if (!scopeMatcher.matches(group, entry)) continue;
                String[] split = PathParts.splitBaseName(base);
                RuleEvaluator.Name result = ruleEvaluator.applyAll(group.rules(),
                        new RuleEvaluator.Name(split[0], split[1]), context(group, parent));
                base = lastSegment(result.baseName(), base);
            }
            return PathSegments.join(parent, base, false);
        }

        /**
         * Rewrites every prefix of an original path that names a renamed directory.
         */
        String resolve(String originalPath) {
            if (originalPath.isEmpty()) return "";
            String[] segments = originalPath.split("/", -1);
            StringBuilder prefix = new StringBuilder();
            List<String> out = new ArrayList<>(segments.length);
            for (int i = 0; i < segments.length; i++) {
                if (i > 0) prefix.append('/');
                prefix.append(segments[i]);
                out.add(segmentRenames.getOrDefault(prefix.toString(), segments[i]));
            }
            return String.join("/", out);
        }

        private RuleEvaluator.Context context(RuleGroup group, String resolvedParent) {
            List<String> segments = PathSegments.safeSegments(resolvedParent);
            return new RuleEvaluator.Context(
                    counters.next(group),
                    segments.isEmpty() ? "" : segments.get(segments.size() - 1),
                    segments.size(),
                    date);
        }
    }

    /**
     * Keeps the text after the last separator of a produced name, falling back
     * to the previous name when nothing usable remains.
     */
    static String lastSegment(String produced, String previous) {
        int cut = Math.max(produced.lastIndexOf('/'), produced.lastIndexOf('\\'));
        String segment = cut >= 0 ? produced.substring(cut + 1) : produced;
        if (PathSegments.isUnsafe(segment)) {
            log.debugf("Discarding unusable name '%s', keeping '%s'", produced, previous);
            return previous;
        }
        return segment;
    }
}
