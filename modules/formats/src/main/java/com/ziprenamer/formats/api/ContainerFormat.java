package com.ziprenamer.formats.api;

import com.ziprenamer.types.ArchiveEntry;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A container format that can list its entries and write a renamed copy of itself.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface ContainerFormat {

    /**
     * Short lowercase key, e.g. "zip".
     */
    String formatKey();

    /**
     * Returns criteria for detecting when this format should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Lists entries in container order. Never sorted.
     *
     * @throws ContainerFormatException if the container cannot be read
     */
    List<ArchiveEntry> listEntries(Path container);

    /**
     * Writes a copy of the container where every entry is stored under its final path.
     *
     * @param container  the source container
     * @param finalPaths final path per {@link ArchiveEntry#path()}; entries without a
     *                   mapping keep their original path
     * @param output     destination of the rewritten container, closed on return
     * @throws IOException if reading the source or writing the copy fails
     */
    void rewrite(Path container, Map<String, String> finalPaths, OutputStream output) throws IOException;
}
