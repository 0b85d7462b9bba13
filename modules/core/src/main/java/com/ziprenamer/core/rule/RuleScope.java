package com.ziprenamer.core.rule;

import java.util.Optional;

public enum RuleScope {
    /** Every file, never directories. */
    GLOBAL("global", false),
    /** Every directory, never files. */
    FOLDERS("folders", false),
    /** Files with a given extension (or without it, when excluded). */
    EXTENSION("extension", true),
    /** Files and directories under a path prefix. */
    FOLDER("folder", true),
    /** Files and directories alike; what a group that names no scope gets. */
    ANY("", false);

    private final String label;
    private final boolean requiresValue;

    RuleScope(String label, boolean requiresValue) {
        this.label = label;
        this.requiresValue = requiresValue;
    }

    public String label() {
        return label;
    }

    public boolean requiresValue() {
        return requiresValue;
    }

    public static Optional<RuleScope> fromLabel(String label) {
        for (RuleScope s : values()) {
            if (s != ANY && s.label.equals(label)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
