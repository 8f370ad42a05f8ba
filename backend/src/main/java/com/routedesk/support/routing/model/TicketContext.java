package com.routedesk.support.routing.model;

import com.routedesk.support.routing.value.ContextValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of the ticket fields routing looks at.
 */
public record TicketContext(
        RequestType requestType,
        TicketPriority priority,
        String customerEmail,
        String summary,
        ContextValue.Mapping data
) {

    public TicketContext {
        if (requestType == null) requestType = RequestType.OTHER;
        if (priority == null) priority = TicketPriority.NORMAL;
        if (data == null) data = ContextValue.Mapping.empty();
    }

    public static TicketContext of(RequestType requestType) {
        return new TicketContext(requestType, TicketPriority.NORMAL, null, null, null);
    }

    /**
     * Root mapping that predicate paths are resolved against. Optional fields
     * that are null are left out, so a path into them resolves to absent.
     */
    public ContextValue.Mapping asValue() {
        var root = new LinkedHashMap<String, ContextValue>();
        root.put("requestType", ContextValue.text(requestType.code()));
        root.put("priority", ContextValue.text(priority.code()));
        if (customerEmail != null) root.put("customerEmail", ContextValue.text(customerEmail));
        if (summary != null) root.put("summary", ContextValue.text(summary));
        root.put("data", data);
        return new ContextValue.Mapping(Map.copyOf(root));
    }
}
