package com.ziprenamer.formats.handlers;

import com.ziprenamer.formats.api.ContainerFormat;
import com.ziprenamer.formats.api.ContainerFormatException;
import com.ziprenamer.formats.api.DetectionCriteria;
import com.ziprenamer.formats.api.RewriteTracker;
import com.ziprenamer.types.ArchiveEntry;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TAR containers. Uses magicOffset=257 for TAR magic detection ("ustar").
 * Symlinks and hard links are listed as empty files and rewritten as links.
 */
@ApplicationScoped
public class TarContainerFormat implements ContainerFormat {

    private static final Logger log = Logger.getLogger(TarContainerFormat.class);

    private static final byte[] TAR_MAGIC = new byte[]{'u', 's', 't', 'a', 'r'};

    @Override
    public String formatKey() {
        return "tar";
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
                Set.of("tar"),
                TAR_MAGIC,
                257,  // TAR magic is at offset 257
                200
        );
    }

    @Override
    public List<ArchiveEntry> listEntries(Path container) {
        List<ArchiveEntry> entries = new ArrayList<>();
        try (InputStream inputStream = new BufferedInputStream(Files.newInputStream(container));
             TarArchiveInputStream tar = new TarArchiveInputStream(inputStream)) {

            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                long size = entry.isFile() ? entry.getSize() : 0;
                entries.add(new ArchiveEntry(entry.getName(), size, entry.isDirectory()));
            }
        } catch (IOException e) {
            throw new ContainerFormatException("Failed to list TAR entries: " + container.getFileName(), e);
        }
        log.debugf("Listed %d TAR entries from %s", entries.size(), container.getFileName());
        return entries;
    }

    @Override
    public void rewrite(Path container, Map<String, String> finalPaths, OutputStream output) throws IOException {
        RewriteTracker tracker = new RewriteTracker(finalPaths);

        try (InputStream inputStream = new BufferedInputStream(Files.newInputStream(container));
             TarArchiveInputStream tar = new TarArchiveInputStream(inputStream);
             TarArchiveOutputStream tos = new TarArchiveOutputStream(output, "UTF-8")) {
            tos.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tos.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            TarArchiveEntry source;
            while ((source = tar.getNextEntry()) != null) {
                String originalPath = new ArchiveEntry(source.getName(), 0, source.isDirectory()).path();
                String target = tracker.claim(originalPath);
                if (target == null) {
                    continue;
                }

                TarArchiveEntry entry = copyHeader(source, target);
                tos.putArchiveEntry(entry);
                if (source.isFile()) {
                    tar.transferTo(tos);
                }
                tos.closeArchiveEntry();
            }
            tos.finish();
        }

        if (tracker.skipped() > 0) {
            log.infof("Rewrote %s with %d entries skipped", container.getFileName(), tracker.skipped());
        }
    }

    private static TarArchiveEntry copyHeader(TarArchiveEntry source, String target) {
        TarArchiveEntry entry;
        if (source.isSymbolicLink()) {
            entry = new TarArchiveEntry(target, TarConstants.LF_SYMLINK);
            entry.setLinkName(source.getLinkName());
        } else if (source.isLink()) {
            entry = new TarArchiveEntry(target, TarConstants.LF_LINK);
            entry.setLinkName(source.getLinkName());
        } else {
            entry = new TarArchiveEntry(target);
            if (source.isFile()) {
                entry.setSize(source.getSize());
            }
        }
        entry.setMode(source.getMode());
        entry.setModTime(source.getModTime());
        entry.setUserId(source.getLongUserId());
        entry.setGroupId(source.getLongGroupId());
        entry.setUserName(source.getUserName());
        entry.setGroupName(source.getGroupName());
        return entry;
    }
}
