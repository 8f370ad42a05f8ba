package com.routedesk.support.routing.model;

import com.routedesk.support.routing.value.ContextValue;

import java.util.List;
import java.util.Map;

/**
 * @param predicate field path to required value; a {@link ContextValue.Sequence} value means "any of"
 * @param order     ascending evaluation priority, ties broken by {@code id}
 */
public record RoutingRule(
        Long id,
        Map<String, ContextValue> predicate,
        List<String> assignees,
        boolean active,
        int order
) {

    public RoutingRule {
        predicate = predicate == null ? Map.of() : Map.copyOf(predicate);
        assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    /**
     * Active rules must name at least one non-blank assignee.
     */
    public RoutingRule validated() {
        if (active && assignees.isEmpty()) {
            throw new IllegalArgumentException("assignees_required");
        }
        for (var a : assignees) {
            if (a == null || a.isBlank()) throw new IllegalArgumentException("assignee_blank");
        }
        return this;
    }

    public RoutingRule withId(Long newId) {
        return new RoutingRule(newId, predicate, assignees, active, order);
    }
}
