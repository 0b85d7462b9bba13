package com.ziprenamer.formats.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Criteria for detecting which container format an upload uses.
 *
 * @param extensions  File extensions without dot (e.g., "zip", "tar")
 * @param magicBytes  Magic bytes to match, or null if not applicable
 * @param magicOffset Offset in header where magic bytes start (0 for ZIP, 257 for TAR)
 * @param priority    Higher priority wins when several formats match
 */
public record DetectionCriteria(
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
        if (magicOffset < 0) {
            throw new IllegalArgumentException("magicOffset must be >= 0, got: " + magicOffset);
        }
    }

    /**
     * Checks if this criteria matches the given upload.
     */
    public boolean matches(String filename, byte[] header) {
        // Check magic bytes first (most reliable)
        if (magicBytes != null && header != null) {
            int endOffset = magicOffset + magicBytes.length;
            if (header.length >= endOffset) {
                boolean magicMatch = true;
                for (int i = 0; i < magicBytes.length; i++) {
                    if (header[magicOffset + i] != magicBytes[i]) {
                        magicMatch = false;
                        break;
                    }
                }
                if (magicMatch) {
                    return true;
                }
            }
        }

        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
                return extensions.contains(ext);
            }
        }
        return false;
    }
}
