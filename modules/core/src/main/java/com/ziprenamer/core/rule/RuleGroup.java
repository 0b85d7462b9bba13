package com.ziprenamer.core.rule;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list of rules applied to the entries its scope selects.
 *
 * @param id         stable token; groups sharing an id share one counter
 * @param scope      entry selection
 * @param scopeValue extension or folder prefix, required by those scopes
 * @param exclude    inverts the extension comparison only
 * @param rules      applied in order, each consuming the previous result
 */
public record RuleGroup(
        String id,
        RuleScope scope,
        String scopeValue,
        boolean exclude,
        List<Rule> rules
) {

    public RuleGroup {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        scopeValue = scopeValue == null ? "" : scopeValue;
        if (scope.requiresValue() && scopeValue.isBlank()) {
            throw new IllegalArgumentException("scope " + scope.label() + " requires a scopeValue");
        }
        rules = List.copyOf(rules);
    }

    public static RuleGroup global(String id, List<Rule> rules) {
        return new RuleGroup(id, RuleScope.GLOBAL, "", false, rules);
    }

    public static RuleGroup folders(String id, List<Rule> rules) {
        return new RuleGroup(id, RuleScope.FOLDERS, "", false, rules);
    }

    public static RuleGroup extension(String id, String extension, boolean exclude, List<Rule> rules) {
        return new RuleGroup(id, RuleScope.EXTENSION, extension, exclude, rules);
    }

    public static RuleGroup folder(String id, String prefix, List<Rule> rules) {
        return new RuleGroup(id, RuleScope.FOLDER, prefix, false, rules);
    }
}
