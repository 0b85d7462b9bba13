package com.ziprenamer.core.analysis;

/**
 * Reduces warnings to one risk level; the first matching tier wins.
 */
public class SeverityClassifier {

    static final int HIGH_THRESHOLD = 5;

    public Severity classify(AnalysisWarnings w) {
        if (!w.renameConflicts().isEmpty()) {
            return Severity.CRITICAL;
        }
        if (w.pathTooLong().size() > HIGH_THRESHOLD || w.invalidChars().size() > HIGH_THRESHOLD) {
            return Severity.HIGH;
        }
        if (!w.duplicateNames().isEmpty() || !w.unicodeIssues().isEmpty()) {
            return Severity.MEDIUM;
        }
        if (!w.systemFiles().isEmpty()) {
            return Severity.LOW;
        }
        return Severity.NONE;
    }
}
