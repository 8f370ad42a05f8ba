package com.routedesk.support.routing.repo;

import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketContext;

import java.util.List;
import java.util.Optional;

public interface TicketStore {

    Optional<TicketContext> findContext(long ticketId);

    /**
     * Sets the primary assignee, status and advisor suggestion (nullable) on one ticket row.
     *
     * @return number of rows updated (0 when the ticket no longer exists)
     */
    int updateRouting(long ticketId, String primaryAssignee, String status, AdvisorSuggestion suggestion);

    /**
     * Most recently resolved tickets of the given type that have an assignee.
     */
    List<HistoricalAssignment> listResolvedAssignments(RequestType requestType, int limit);
}
