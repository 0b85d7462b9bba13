package com.ziprenamer.formats.registry;

import com.ziprenamer.formats.api.ContainerFormat;
import com.ziprenamer.formats.api.ContainerFormatException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.StreamSupport;

/**
 * Central registry that matches uploaded containers to formats.
 * All {@link ContainerFormat} beans are discovered via CDI.
 */
@ApplicationScoped
public class FormatRegistry {

    /** Header size to read for detection (covers TAR magic at offset 257). */
    private static final int HEADER_SIZE = 512;

    @Inject
    Instance<ContainerFormat> formats;

    /**
     * Finds the best format for the given container file.
     * Reads a header, matches against all registered formats,
     * and returns the highest-priority match.
     *
     * @param filename original upload name, used when the header is inconclusive
     */
    public Optional<ContainerFormat> findFormat(Path container, String filename) {
        byte[] header = readHeader(container);
        String name = filename != null ? filename : container.getFileName().toString();

        return StreamSupport.stream(formats.spliterator(), false)
                .filter(f -> f.getDetectionCriteria().matches(name, header))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }

    /**
     * Like {@link #findFormat} but fails for unsupported containers.
     */
    public ContainerFormat requireFormat(Path container, String filename) {
        return findFormat(container, filename)
                .orElseThrow(() -> new ContainerFormatException(
                        "Unsupported container format: " + (filename != null ? filename : container.getFileName())));
    }

    private static byte[] readHeader(Path container) {
        try (InputStream in = Files.newInputStream(container)) {
            return in.readNBytes(HEADER_SIZE);
        } catch (IOException e) {
            throw new ContainerFormatException("Failed to read container header: " + container.getFileName(), e);
        }
    }
}
