package com.ziprenamer.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A container path split into parent, base name, stem and extension.
 *
 * <p>Backslashes are normalized to {@code /} and the split happens at the last
 * separator. For files the base name splits at its last dot, except that a
 * leading dot never separates an extension ({@code .gitignore} has stem
 * {@code .gitignore}). For directories the trailing slash is stripped and the
 * stem is the whole base name.
 *
 * @param parentPath parent path without trailing slash, empty at top level
 * @param baseName   last segment, without trailing slash
 * @param stem       base name without extension
 * @param extension  extension including its dot, or empty
 * @param directory  whether the path names a directory
 */
public record PathParts(
        String parentPath,
        String baseName,
        String stem,
        String extension,
        boolean directory
) {

    public PathParts {
        Objects.requireNonNull(parentPath, "parentPath cannot be null");
        Objects.requireNonNull(baseName, "baseName cannot be null");
        Objects.requireNonNull(stem, "stem cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
    }

    public static PathParts ofFile(String path) {
        return of(path, false);
    }

    public static PathParts ofDirectory(String path) {
        return of(path, true);
    }

    public static PathParts of(String path, boolean directory) {
        Objects.requireNonNull(path, "path cannot be null");
        String normalized = normalize(path);
        if (directory) {
            normalized = stripTrailingSlashes(normalized);
        }

        int lastSlash = normalized.lastIndexOf('/');
        String parent = lastSlash >= 0 ? normalized.substring(0, lastSlash) : "";
        String base = normalized.substring(lastSlash + 1);

        if (directory) {
            return new PathParts(parent, base, base, "", true);
        }
        String[] split = splitBaseName(base);
        return new PathParts(parent, base, split[0], split[1], false);
    }

    /**
     * Splits a file base name into {@code [stem, extension]}.
     */
    public static String[] splitBaseName(String baseName) {
        int lastDot = baseName.lastIndexOf('.');
        if (lastDot > 0) {
            return new String[]{baseName.substring(0, lastDot), baseName.substring(lastDot)};
        }
        return new String[]{baseName, ""};
    }

    public static String normalize(String path) {
        return path.replace('\\', '/');
    }

    public static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    /**
     * Non-empty parent segments, outermost first.
     */
    public List<String> parentSegments() {
        if (parentPath.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> segments = new ArrayList<>();
        for (String segment : parentPath.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }
}
