package com.ziprenamer.core.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ziprenamer.core.analysis.AnalysisReport;
import com.ziprenamer.core.analysis.ArchiveAnalyzer;
import com.ziprenamer.core.rename.RenameEngine;
import com.ziprenamer.core.rule.RuleGroup;
import com.ziprenamer.core.rule.RuleGroupReader;
import com.ziprenamer.formats.api.ContainerFormat;
import com.ziprenamer.formats.registry.FormatRegistry;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.types.RenamedPath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers holding an uploaded container: inspect it, preview a
 * rename, or write the renamed copy.
 */
@ApplicationScoped
public class RenamerService {

    private static final Logger log = Logger.getLogger(RenamerService.class);

    @Inject
    FormatRegistry formatRegistry;

    @Inject
    RenameEngine renameEngine;

    @Inject
    ArchiveAnalyzer archiveAnalyzer;

    @Inject
    ArchiveLocks archiveLocks;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "ziprenamer.max-entries", defaultValue = "10000")
    int maxEntries;

    @ConfigProperty(name = "ziprenamer.preview-limit", defaultValue = "500")
    int previewLimit;

    private final RuleGroupReader ruleGroupReader = new RuleGroupReader();

    /**
     * Lists and analyzes a container. The analysis covers every entry; the
     * returned listing stops at the preview limit.
     */
    public ArchiveInspection inspect(Path container, String filename) {
        ContainerFormat format = formatRegistry.requireFormat(container, filename);
        List<ArchiveEntry> entries = list(format, container, filename);
        AnalysisReport report = archiveAnalyzer.analyze(entries);
        log.infof("Inspected %s: %d entries, format=%s, severity=%s",
                filename, entries.size(), format.formatKey(), report.severity().label());
        return new ArchiveInspection(
                format.formatKey(),
                entries.subList(0, Math.min(previewLimit, entries.size())),
                entries.size(),
                report);
    }

    /**
     * Final paths for a client-supplied listing, capped at the preview limit.
     * The whole listing is renamed so counters match what {@link #process} writes.
     */
    public List<RenamedPath> preview(List<ArchiveEntry> entries, List<RuleGroup> groups) {
        List<RenamedPath> renamed = renameEngine.rename(entries, groups);
        return renamed.subList(0, Math.min(previewLimit, renamed.size()));
    }

    /**
     * Writes the renamed copy of a container to {@code output}. Calls for the
     * same archive id run one at a time.
     *
     * @return the rename mapping that was applied
     */
    public List<RenamedPath> process(String archiveId, Path container, String filename,
                                     List<RuleGroup> groups, OutputStream output) throws IOException {
        return archiveLocks.withLock(archiveId, () -> {
            ContainerFormat format = formatRegistry.requireFormat(container, filename);
            List<ArchiveEntry> entries = list(format, container, filename);
            List<RenamedPath> renamed = renameEngine.rename(entries, groups);

            Map<String, String> finalPaths = new LinkedHashMap<>();
            for (RenamedPath r : renamed) {
                finalPaths.putIfAbsent(r.originalPath(), r.finalPath());
            }
            format.rewrite(container, finalPaths, output);

            long changed = renamed.stream().filter(RenamedPath::isChanged).count();
            log.infof("Processed %s (%s): %d of %d entries renamed by %d groups",
                    archiveId, filename, changed, renamed.size(), groups.size());
            return renamed;
        });
    }

    /**
     * Reads rule groups from a JSON request body.
     *
     * @throws IllegalArgumentException if the body is not JSON
     */
    public List<RuleGroup> readRuleGroups(String json) {
        return ruleGroupReader.readGroups(parse(json));
    }

    /**
     * Reads a client-supplied entry listing from a JSON array.
     *
     * @throws IllegalArgumentException if the body is not JSON
     */
    public List<ArchiveEntry> readEntries(String json) {
        return ruleGroupReader.readEntries(parse(json));
    }

    private JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed request body: " + e.getOriginalMessage(), e);
        }
    }

    private List<ArchiveEntry> list(ContainerFormat format, Path container, String filename) {
        List<ArchiveEntry> entries = format.listEntries(container);
        if (entries.size() > maxEntries) {
            throw new ArchiveTooLargeException(filename, entries.size(), maxEntries);
        }
        return entries;
    }
}
