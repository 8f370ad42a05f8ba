package com.routedesk.support.routing.advisor;

import com.routedesk.support.routing.error.AdvisorException;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketClassification;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.value.ContextValue;

import java.util.List;

/**
 * Probabilistic classification and routing advice. Implementations enforce
 * their own time bound and report any failure as an exception, usually
 * {@link AdvisorException}; callers must not let a failure block routing.
 */
public interface AdvisorPort {

    /**
     * Short provider label recorded in the audit log, e.g. {@code openai}.
     */
    String providerName();

    String model();

    TicketClassification classify(TicketContext context);

    AdvisorSuggestion suggestRouting(
            RequestType requestType,
            TicketPriority priority,
            String summary,
            String customerEmail,
            ContextValue.Mapping data,
            List<HistoricalAssignment> historicalAssignments
    );
}
