package com.routedesk.support.routing.model;

import com.routedesk.support.routing.value.ContextValue;

import java.util.List;
import java.util.Map;

/**
 * Partial rule update; null fields are left unchanged.
 */
public record RoutingRulePatch(
        Map<String, ContextValue> predicate,
        List<String> assignees,
        Boolean active,
        Integer order
) {

    public RoutingRule applyTo(RoutingRule rule) {
        return new RoutingRule(
                rule.id(),
                predicate != null ? predicate : rule.predicate(),
                assignees != null ? assignees : rule.assignees(),
                active != null ? active : rule.active(),
                order != null ? order : rule.order()
        );
    }
}
