package com.ziprenamer.core.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Target operating systems, declared in path-length report order.
 */
public enum Platform {
    WINDOWS("windows", 260),
    LINUX("linux", 4096),
    MACOS("macos", 1024);

    private final String label;
    private final int pathLimit;

    Platform(String label, int pathLimit) {
        this.label = label;
        this.pathLimit = pathLimit;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Maximum full-path length in UTF-8 bytes. */
    public int pathLimit() {
        return pathLimit;
    }
}
