/**
 * Pure Java value types shared across all ZipRenamer modules.
 *
 * <p>{@link com.ziprenamer.types.ArchiveEntry} is the listing snapshot both engines
 * consume; {@link com.ziprenamer.types.RenamedPath} is what the rename engine produces.
 * This module has no dependencies.
 */
package com.ziprenamer.types;
