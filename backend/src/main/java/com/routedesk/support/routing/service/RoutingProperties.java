package com.routedesk.support.routing.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * @param validAssignees identifiers an advisor suggestion may promote into the result
 */
@ConfigurationProperties(prefix = "app.routing")
public record RoutingProperties(List<String> validAssignees) {

    static final List<String> DEFAULT_VALID_ASSIGNEES = List.of(
            "sales-team", "coa-team", "logistics-team", "customer-service", "Adnan", "Lori"
    );

    public RoutingProperties {
        if (validAssignees == null || validAssignees.isEmpty()) {
            validAssignees = DEFAULT_VALID_ASSIGNEES;
        }
        validAssignees = validAssignees.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .toList();
    }

    public static RoutingProperties defaults() {
        return new RoutingProperties(null);
    }

    public Set<String> validAssigneeSet() {
        return new LinkedHashSet<>(validAssignees);
    }
}
