package com.ziprenamer.core.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * The six warning categories of an analysis, each in listing order.
 */
public record AnalysisWarnings(
        List<RenameConflict> renameConflicts,
        List<PathTooLong> pathTooLong,
        List<DuplicateName> duplicateNames,
        List<InvalidChars> invalidChars,
        List<UnicodeIssue> unicodeIssues,
        List<SystemFile> systemFiles
) {

    public AnalysisWarnings {
        renameConflicts = List.copyOf(renameConflicts);
        pathTooLong = List.copyOf(pathTooLong);
        duplicateNames = List.copyOf(duplicateNames);
        invalidChars = List.copyOf(invalidChars);
        unicodeIssues = List.copyOf(unicodeIssues);
        systemFiles = List.copyOf(systemFiles);
    }

    /** Sibling files whose names differ only by case. */
    public record RenameConflict(
            String directory,
            List<String> conflictingFiles,
            String resultName,
            int count,
            ConflictType type
    ) {
        public RenameConflict {
            conflictingFiles = List.copyOf(conflictingFiles);
        }
    }

    public enum ConflictType {
        CASE_SENSITIVITY("case_sensitivity");

        private final String label;

        ConflictType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    /** Full path longer than a platform allows, measured in UTF-8 bytes. */
    public record PathTooLong(String path, int length, Platform os, int limit) {}

    public record DuplicateName(String directory, String filename, int count, List<String> paths) {
        public DuplicateName {
            paths = List.copyOf(paths);
        }
    }

    /**
     * Characters a platform rejects, or the single marker {@value #RESERVED_NAME}
     * for a reserved Windows device name.
     */
    public record InvalidChars(String path, List<String> invalidChars, Platform os) {
        public static final String RESERVED_NAME = "RESERVED_NAME";

        public InvalidChars {
            invalidChars = List.copyOf(invalidChars);
        }
    }

    public record UnicodeIssue(String path, UnicodeIssueType issue, String details) {}

    public enum UnicodeIssueType {
        NFC_NFD_MISMATCH("nfc_nfd_mismatch"),
        INVALID_SEQUENCE("invalid_sequence");

        private final String label;

        UnicodeIssueType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    public record SystemFile(String path, SystemFileType type) {}

    /** Operating-system artifacts, in match priority order. */
    public enum SystemFileType {
        MACOSX("__MACOSX"),
        DS_STORE(".DS_Store"),
        THUMBS_DB("Thumbs.db"),
        DESKTOP_INI("desktop.ini"),
        GIT(".git");

        private final String label;

        SystemFileType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
