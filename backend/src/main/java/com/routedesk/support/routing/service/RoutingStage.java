package com.routedesk.support.routing.service;

/**
 * Progress of a single routing decision. {@link #PERSISTED} is terminal.
 */
public enum RoutingStage {
    PENDING,
    RULES_EVALUATED,
    ADVISOR_CONSULTED,
    ADVISOR_SKIPPED,
    MERGED,
    PERSISTED
}
