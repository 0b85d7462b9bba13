package com.ziprenamer.core.analysis.detect;

import com.ziprenamer.core.analysis.AnalysisWarnings.UnicodeIssue;
import com.ziprenamer.core.analysis.AnalysisWarnings.UnicodeIssueType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paths a detector could not process, reported as invalid sequences.
 */
public class DetectorFailures {

    private final Map<String, String> failures = new LinkedHashMap<>();

    public void record(String path, RuntimeException cause) {
        failures.putIfAbsent(path, String.valueOf(cause.getMessage()));
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public List<UnicodeIssue> asIssues() {
        List<UnicodeIssue> issues = new ArrayList<>(failures.size());
        failures.forEach((path, message) -> issues.add(new UnicodeIssue(
                path, UnicodeIssueType.INVALID_SEQUENCE, "Path could not be analyzed: " + message)));
        return issues;
    }
}
