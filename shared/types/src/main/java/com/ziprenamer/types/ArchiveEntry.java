package com.ziprenamer.types;

import java.util.Objects;

/**
 * One item of a container listing, as read once per upload.
 *
 * <p>The path is {@code /}-separated; directory paths carry a trailing slash.
 * Construction normalizes backslashes and appends the trailing slash for
 * directories that lack one, so every instance satisfies that shape.
 *
 * @param path      container-relative path
 * @param size      uncompressed size in bytes (0 for directories)
 * @param directory whether the entry is a directory
 */
public record ArchiveEntry(String path, long size, boolean directory) {

    public ArchiveEntry {
        Objects.requireNonNull(path, "path cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
        path = path.replace('\\', '/');
        if (directory && !path.endsWith("/")) {
            path = path + "/";
        }
    }

    public static ArchiveEntry file(String path, long size) {
        return new ArchiveEntry(path, size, false);
    }

    public static ArchiveEntry directory(String path) {
        return new ArchiveEntry(path, 0, true);
    }

    /**
     * Path without the trailing directory slash.
     */
    public String trimmedPath() {
        String p = path;
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }
}
