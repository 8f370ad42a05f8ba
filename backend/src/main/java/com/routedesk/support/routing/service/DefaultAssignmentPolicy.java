package com.routedesk.support.routing.service;

import com.routedesk.support.routing.model.RequestType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed queue per request type, used when no active rule matches.
 */
public final class DefaultAssignmentPolicy {

    public static final String FALLBACK_QUEUE = "customer-service";

    private static final Map<RequestType, List<String>> DEFAULTS = new EnumMap<>(Map.of(
            RequestType.QUOTE, List.of("sales-team"),
            RequestType.COA, List.of("coa-team"),
            RequestType.FREIGHT, List.of("logistics-team"),
            RequestType.CLAIM, List.of(FALLBACK_QUEUE),
            RequestType.OTHER, List.of(FALLBACK_QUEUE)
    ));

    private DefaultAssignmentPolicy() {
    }

    public static List<String> assigneesFor(RequestType requestType) {
        if (requestType == null) return List.of(FALLBACK_QUEUE);
        return DEFAULTS.getOrDefault(requestType, List.of(FALLBACK_QUEUE));
    }
}
