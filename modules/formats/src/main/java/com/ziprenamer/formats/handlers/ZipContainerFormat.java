package com.ziprenamer.formats.handlers;

import com.ziprenamer.formats.api.ContainerFormat;
import com.ziprenamer.formats.api.ContainerFormatException;
import com.ziprenamer.formats.api.DetectionCriteria;
import com.ziprenamer.formats.api.RewriteTracker;
import com.ziprenamer.types.ArchiveEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ZIP containers. Entries are listed in central directory order.
 * Priority 200 so the magic bytes decide over a misleading extension.
 */
@ApplicationScoped
public class ZipContainerFormat implements ContainerFormat {

    private static final Logger log = Logger.getLogger(ZipContainerFormat.class);

    private static final byte[] ZIP_MAGIC = new byte[]{0x50, 0x4B, 0x03, 0x04}; // "PK\u0003\u0004"

    @Override
    public String formatKey() {
        return "zip";
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                Set.of("zip"),
                ZIP_MAGIC,
                0,
                200
        );
    }

    @Override
    public List<ArchiveEntry> listEntries(Path container) {
        List<ArchiveEntry> entries = new ArrayList<>();
        try (ZipFile zipFile = ZipFile.builder().setFile(container.toFile()).get()) {
            Enumeration<ZipArchiveEntry> zipEntries = zipFile.getEntries();
            while (zipEntries.hasMoreElements()) {
                ZipArchiveEntry entry = zipEntries.nextElement();
                long size = entry.isDirectory() ? 0 : Math.max(0, entry.getSize());
                entries.add(new ArchiveEntry(entry.getName(), size, entry.isDirectory()));
            }
        } catch (IOException e) {
            throw new ContainerFormatException("Failed to list ZIP entries: " + container.getFileName(), e);
        }
        log.debugf("Listed %d ZIP entries from %s", entries.size(), container.getFileName());
        return entries;
    }

    @Override
    public void rewrite(Path container, Map<String, String> finalPaths, OutputStream output) throws IOException {
        RewriteTracker tracker = new RewriteTracker(finalPaths);

        try (ZipFile zipFile = ZipFile.builder().setFile(container.toFile()).get();
             ZipArchiveOutputStream zos = new ZipArchiveOutputStream(output)) {
            zos.setEncoding("UTF-8");

            Enumeration<ZipArchiveEntry> zipEntries = zipFile.getEntries();
            while (zipEntries.hasMoreElements()) {
                ZipArchiveEntry source = zipEntries.nextElement();
                String originalPath = new ArchiveEntry(source.getName(), 0, source.isDirectory()).path();
                String target = tracker.claim(originalPath);
                if (target == null) {
                    continue;
                }

                ZipArchiveEntry entry = new ZipArchiveEntry(target);
                entry.setTime(source.getTime());
                if (source.getMethod() == ZipArchiveEntry.STORED && !source.isDirectory()) {
                    entry.setMethod(ZipArchiveEntry.STORED);
                    entry.setSize(source.getSize());
                    entry.setCrc(source.getCrc());
                } else {
                    entry.setMethod(ZipArchiveEntry.DEFLATED);
                }

                zos.putArchiveEntry(entry);
                if (!source.isDirectory()) {
                    try (InputStream in = zipFile.getInputStream(source)) {
                        in.transferTo(zos);
                    }
                }
                zos.closeArchiveEntry();
            }
            zos.finish();
        }

        if (tracker.skipped() > 0) {
            log.infof("Rewrote %s with %d entries skipped", container.getFileName(), tracker.skipped());
        }
    }
}
