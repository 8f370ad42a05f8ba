package com.routedesk.support.routing.error;

import java.util.List;

/**
 * Writing the routing outcome failed after assignees were computed.
 */
public class TicketPersistenceException extends RoutingException {

    private final long ticketId;
    private final List<String> assignees;

    public TicketPersistenceException(long ticketId, List<String> assignees, Throwable cause) {
        super("persistence_failed", cause);
        this.ticketId = ticketId;
        this.assignees = assignees == null ? List.of() : List.copyOf(assignees);
    }

    public long ticketId() {
        return ticketId;
    }

    public List<String> assignees() {
        return assignees;
    }
}
