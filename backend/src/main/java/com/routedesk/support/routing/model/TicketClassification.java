package com.routedesk.support.routing.model;

import java.util.List;

public record TicketClassification(
        RequestType requestType,
        TicketPriority priority,
        double confidence,
        List<String> suggestedTags,
        String reasoning
) {

    public TicketClassification {
        if (requestType == null) requestType = RequestType.OTHER;
        if (priority == null) priority = TicketPriority.NORMAL;
        suggestedTags = suggestedTags == null ? List.of() : List.copyOf(suggestedTags);
    }
}
