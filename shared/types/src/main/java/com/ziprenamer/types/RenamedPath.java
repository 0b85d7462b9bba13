package com.ziprenamer.types;

import java.util.Objects;

/**
 * Result of renaming one entry. Callers carry entry content through keyed by
 * {@link #originalPath()}. An empty {@link #finalPath()} means the entry has no
 * safe output path and must not be written.
 */
public record RenamedPath(String originalPath, String finalPath) {

    public RenamedPath {
        Objects.requireNonNull(originalPath, "originalPath cannot be null");
        Objects.requireNonNull(finalPath, "finalPath cannot be null");
    }

    public boolean isDropped() {
        return finalPath.isEmpty();
    }

    public boolean isChanged() {
        return !originalPath.equals(finalPath);
    }
}
