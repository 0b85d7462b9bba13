/**
 * Shared path utilities for all ZipRenamer modules.
 *
 * <p>Contains the path decomposer ({@link com.ziprenamer.util.PathParts}), the output
 * path sanitizer ({@link com.ziprenamer.util.PathSegments}) and UTF-8 helpers.
 * No framework dependencies.
 */
package com.ziprenamer.util;
