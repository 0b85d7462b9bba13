package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.RuleGroup;
import com.ziprenamer.types.ArchiveEntry;
import com.ziprenamer.util.PathParts;

import java.util.Locale;

/**
 * Decides whether a rule group applies to an entry. Matching always looks at the
 * entry as listed, never at a name produced by an earlier group.
 */
public class ScopeMatcher {

    public boolean matches(RuleGroup group, ArchiveEntry entry) {
        return switch (group.scope()) {
            case GLOBAL -> !entry.directory();
            case FOLDERS -> entry.directory();
            case EXTENSION -> !entry.directory() && matchesExtension(group, entry);
            case FOLDER -> entry.path().startsWith(PathParts.normalize(group.scopeValue()));
            case ANY -> true;
        };
    }

    private static boolean matchesExtension(RuleGroup group, ArchiveEntry entry) {
        String extension = PathParts.ofFile(entry.path()).extension().toLowerCase(Locale.ROOT);
        boolean same = extension.equals(extensionTarget(group.scopeValue()));
        return group.exclude() != same;
    }

    static String extensionTarget(String scopeValue) {
        String target = scopeValue.trim().toLowerCase(Locale.ROOT);
        return target.startsWith(".") ? target : "." + target;
    }
}
