package com.routedesk.support.routing.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines the rule-based assignee list with an advisor suggestion.
 * <p>
 * Below the confidence bar, or with an empty suggestion, the rule list is
 * returned as is. Above it: the advisor's first pick (if valid) leads, then
 * every rule assignee in rule order, then the advisor's remaining valid picks.
 * Rule assignees are never dropped and no identifier appears twice.
 */
public final class AssigneeMerger {

    /** Advisor confidence must be strictly greater than this to affect the result. */
    public static final double CONFIDENCE_THRESHOLD = 0.8;

    private AssigneeMerger() {
    }

    public static boolean shouldMerge(List<String> advisorAssignees, double confidence) {
        return confidence > CONFIDENCE_THRESHOLD && advisorAssignees != null && !advisorAssignees.isEmpty();
    }

    public static List<String> merge(
            List<String> ruleAssignees,
            List<String> advisorAssignees,
            double confidence,
            Set<String> validAssignees
    ) {
        var rules = ruleAssignees == null ? List.<String>of() : ruleAssignees;
        if (!shouldMerge(advisorAssignees, confidence)) {
            return List.copyOf(rules);
        }
        var valid = validAssignees == null ? Set.<String>of() : validAssignees;

        var merged = new LinkedHashSet<String>();
        var primary = advisorAssignees.get(0);
        if (primary != null && valid.contains(primary)) {
            merged.add(primary);
        }
        for (var a : rules) {
            if (a != null) merged.add(a);
        }
        for (var a : advisorAssignees.subList(1, advisorAssignees.size())) {
            if (a != null && valid.contains(a)) merged.add(a);
        }

        if (merged.isEmpty()) return List.of(DefaultAssignmentPolicy.FALLBACK_QUEUE);
        return List.copyOf(merged);
    }
}
