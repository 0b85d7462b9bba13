package com.ziprenamer.core.rename;

import com.ziprenamer.core.rule.RuleGroup;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run match counters, one per group id. Created fresh for each rename run.
 */
class GroupCounters {

    private final Map<String, Integer> counters = new HashMap<>();

    GroupCounters(List<RuleGroup> groups) {
        for (RuleGroup group : groups) {
            counters.put(group.id(), 0);
        }
    }

    /** Returns the group's current index and advances it. */
    int next(RuleGroup group) {
        int index = counters.getOrDefault(group.id(), 0);
        counters.put(group.id(), index + 1);
        return index;
    }
}
