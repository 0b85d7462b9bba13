package com.ziprenamer.core.analysis;

import com.ziprenamer.core.analysis.AnalysisWarnings.UnicodeIssue;
import com.ziprenamer.core.analysis.detect.ConflictSimulator;
import com.ziprenamer.core.analysis.detect.DetectorFailures;
import com.ziprenamer.core.analysis.detect.DuplicateNameDetector;
import com.ziprenamer.core.analysis.detect.InvalidCharsDetector;
import com.ziprenamer.core.analysis.detect.PathLengthDetector;
import com.ziprenamer.core.analysis.detect.StatsCollector;
import com.ziprenamer.core.analysis.detect.SystemFileDetector;
import com.ziprenamer.core.analysis.detect.UnicodeDetector;
import com.ziprenamer.types.ArchiveEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-flight risk report over an entry listing. Reads only paths and sizes and
 * never mutates the listing.
 */
@ApplicationScoped
public class ArchiveAnalyzer {

    private static final Logger log = Logger.getLogger(ArchiveAnalyzer.class);

    private final SeverityClassifier severityClassifier = new SeverityClassifier();
    private final StatsCollector statsCollector = new StatsCollector();
    private final Clock clock;

    public ArchiveAnalyzer() {
        this(Clock.systemUTC());
    }

    public ArchiveAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public AnalysisReport analyze(List<ArchiveEntry> entries) {
        DetectorFailures failures = new DetectorFailures();

        ArchiveStats stats = statsCollector.collect(entries);
        var pathTooLong = new PathLengthDetector().detect(entries, failures);
        var invalidChars = new InvalidCharsDetector().detect(entries, failures);
        List<UnicodeIssue> unicodeIssues = new ArrayList<>(new UnicodeDetector().detect(entries, failures));
        var duplicates = new DuplicateNameDetector().detect(entries, failures);
        var systemFiles = new SystemFileDetector().detect(entries, failures);
        var conflicts = new ConflictSimulator().detect(entries, failures);
        unicodeIssues.addAll(failures.asIssues());

        AnalysisWarnings warnings = new AnalysisWarnings(
                conflicts, pathTooLong, duplicates, invalidChars, unicodeIssues, systemFiles);
        Severity severity = severityClassifier.classify(warnings);

        log.debugf("Analyzed %d entries (%d files, %d dirs): severity=%s",
                entries.size(), stats.totalFiles(), stats.totalDirectories(), severity.label());
        return new AnalysisReport(stats, warnings, severity, Instant.now(clock).toString());
    }
}
