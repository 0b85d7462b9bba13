package com.ziprenamer.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds output paths from segments, dropping {@code .}, {@code ..} and empty
 * segments so a malformed entry can never escape the container root.
 */
public final class PathSegments {

    private PathSegments() {
    }

    public static boolean isUnsafe(String segment) {
        return segment == null || segment.isEmpty() || segment.equals(".") || segment.equals("..");
    }

    /**
     * Splits a {@code /}-separated path into its safe segments.
     */
    public static List<String> safeSegments(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String segment : PathParts.normalize(path).split("/")) {
            if (!isUnsafe(segment)) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Joins a parent path and a base name, sanitizing both.
     *
     * @param directory appends a trailing slash when true
     */
    public static String join(String parentPath, String baseName, boolean directory) {
        List<String> segments = safeSegments(parentPath);
        segments.addAll(safeSegments(baseName));
        String joined = String.join("/", segments);
        return directory && !joined.isEmpty() ? joined + "/" : joined;
    }

    public static String sanitize(String path, boolean directory) {
        return join("", path, directory);
    }
}
