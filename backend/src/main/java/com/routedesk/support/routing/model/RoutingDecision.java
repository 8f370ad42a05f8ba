package com.routedesk.support.routing.model;

import java.util.List;

/**
 * Outcome of one routing evaluation. {@code assignees} is never empty and its
 * first element is the primary owner.
 */
public record RoutingDecision(
        List<String> assignees,
        Source source,
        boolean usedAdvisor,
        AdvisorSuggestion advisorSuggestion
) {

    public enum Source {
        RULE,
        DEFAULT
    }

    public RoutingDecision {
        if (assignees == null || assignees.isEmpty()) {
            throw new IllegalArgumentException("assignees_required");
        }
        assignees = List.copyOf(assignees);
    }

    public String primaryAssignee() {
        return assignees.get(0);
    }
}
