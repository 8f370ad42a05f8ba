package com.routedesk.support.routing.error;

public class TicketNotFoundException extends RoutingException {

    private final long ticketId;

    public TicketNotFoundException(long ticketId) {
        super("ticket_not_found");
        this.ticketId = ticketId;
    }

    public long ticketId() {
        return ticketId;
    }
}
