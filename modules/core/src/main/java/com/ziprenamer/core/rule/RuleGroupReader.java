package com.ziprenamer.core.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.ziprenamer.types.ArchiveEntry;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Reads rule groups and entry listings from client JSON. Malformed rules become
 * {@link Rule.Unsupported}; malformed groups and entries are dropped with a warning.
 */
public class RuleGroupReader {

    private static final Logger log = Logger.getLogger(RuleGroupReader.class);

    static final String LEGACY_GROUP_ID = "default";

    /**
     * Reads {@code ruleGroups}, falling back to a flat {@code rules} array as one
     * global group. A bare array is read as a list of groups.
     */
    public List<RuleGroup> readGroups(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return List.of();
        }
        if (payload.isArray()) {
            return readGroupArray(payload);
        }
        List<RuleGroup> groups = readGroupArray(payload.path("ruleGroups"));
        if (groups.isEmpty()) {
            List<Rule> legacy = readRules(payload.path("rules"));
            if (!legacy.isEmpty()) {
                groups = List.of(RuleGroup.global(LEGACY_GROUP_ID, legacy));
            }
        }
        return groups;
    }

    public Optional<RuleGroup> readGroup(JsonNode node, int position) {
        String id = text(node, "id");
        if (id == null || id.isEmpty()) {
            id = "#" + position;
        }

        String scopeLabel = text(node, "scope");
        Optional<RuleScope> scope = scopeLabel == null || scopeLabel.isEmpty()
                ? Optional.of(RuleScope.ANY)
                : RuleScope.fromLabel(scopeLabel);
        if (scope.isEmpty()) {
            log.warnf("Dropping rule group %s: unknown scope '%s'", id, scopeLabel);
            return Optional.empty();
        }

        try {
            return Optional.of(new RuleGroup(
                    id,
                    scope.get(),
                    text(node, "scopeValue"),
                    bool(node, "exclude"),
                    readRules(node.path("rules"))));
        } catch (IllegalArgumentException e) {
            log.warnf("Dropping rule group %s: %s", id, e.getMessage());
            return Optional.empty();
        }
    }

    public List<Rule> readRules(JsonNode array) {
        if (!array.isArray()) return List.of();
        List<Rule> rules = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            rules.add(readRule(node));
        }
        return rules;
    }

    /** Never returns null; anything unusable is read as {@link Rule.Unsupported}. */
    public Rule readRule(JsonNode node) {
        String type = text(node, "type");
        if (type == null) {
            return new Rule.Unsupported("", "missing type");
        }
        try {
            return switch (type) {
                case "replace" -> new Rule.Replace(orEmpty(text(node, "find")), text(node, "replace"));
                case "prefix" -> new Rule.Prefix(orEmpty(text(node, "text")));
                case "suffix" -> new Rule.Suffix(orEmpty(text(node, "text")));
                case "lowercase" -> new Rule.Lowercase();
                case "uppercase" -> new Rule.Uppercase();
                case "remove_special" -> new Rule.RemoveSpecial();
                case "trim" -> new Rule.Trim();
                case "normalize_space" -> new Rule.NormalizeSpace();
                case "kebab_case" -> new Rule.KebabCase();
                case "numbering" -> readNumbering(node);
                case "pattern" -> new Rule.Template(orEmpty(text(node, "pattern")));
                case "regex" -> Rule.Regex.compile(
                        orEmpty(text(node, "pattern")), text(node, "flags"), text(node, "replace"));
                default -> new Rule.Unsupported(type, "unknown rule type");
            };
        } catch (PatternSyntaxException e) {
            log.warnf("Skipping regex rule with invalid pattern: %s", e.getDescription());
            return new Rule.Unsupported(type, "invalid pattern: " + e.getDescription());
        } catch (IllegalArgumentException e) {
            log.debugf("Skipping %s rule: %s", type, e.getMessage());
            return new Rule.Unsupported(type, e.getMessage());
        }
    }

    /**
     * Reads an entry listing. Each element needs {@code path} (or {@code originalName});
     * elements without one are dropped.
     */
    public List<ArchiveEntry> readEntries(JsonNode array) {
        if (array == null || !array.isArray()) return List.of();
        List<ArchiveEntry> entries = new ArrayList<>(array.size());
        int dropped = 0;
        for (JsonNode node : array) {
            String path = text(node, "path");
            if (path == null || path.isEmpty()) {
                path = text(node, "originalName");
            }
            if (path == null || path.isEmpty()) {
                dropped++;
                continue;
            }
            boolean directory = bool(node, "isDirectory") || bool(node, "directory") || path.endsWith("/");
            long size = Math.max(0L, node.path("size").asLong(0L));
            entries.add(new ArchiveEntry(path, directory ? 0L : size, directory));
        }
        if (dropped > 0) {
            log.warnf("Dropped %d entries without a path", dropped);
        }
        return entries;
    }

    // -- Private helpers --

    private List<RuleGroup> readGroupArray(JsonNode array) {
        if (!array.isArray()) return List.of();
        List<RuleGroup> groups = new ArrayList<>(array.size());
        int position = 0;
        for (JsonNode node : array) {
            readGroup(node, position++).ifPresent(groups::add);
        }
        return groups;
    }

    private Rule.Numbering readNumbering(JsonNode node) {
        Rule.Numbering defaults = Rule.Numbering.defaults();
        // zero and unparseable values fall back to the defaults
        int start = intOr(node, "start", 0);
        int padding = intOr(node, "padding", 0);
        String separator = text(node, "separator");
        return new Rule.Numbering(
                start == 0 ? defaults.start() : start,
                Math.max(padding, defaults.padding()),
                separator == null || separator.isEmpty() ? defaults.separator() : separator,
                "start".equals(text(node, "position"))
                        ? Rule.Numbering.Position.START
                        : Rule.Numbering.Position.END);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        return value.asText();
    }

    private static boolean bool(JsonNode node, String field) {
        return node.path(field).asBoolean(false);
    }

    private static int intOr(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (value.isNumber()) return value.asInt();
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
