package com.routedesk.support.routing.support;

import com.routedesk.support.routing.advisor.AdvisorPort;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketClassification;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.value.ContextValue;

import java.util.List;

/**
 * Advisor double returning a fixed suggestion, or throwing a fixed error.
 */
public class StubAdvisor implements AdvisorPort {

    private final AdvisorSuggestion suggestion;
    private final RuntimeException error;
    private int calls;
    private List<HistoricalAssignment> lastHistory;

    private StubAdvisor(AdvisorSuggestion suggestion, RuntimeException error) {
        this.suggestion = suggestion;
        this.error = error;
    }

    public static StubAdvisor returning(List<String> assignees, double confidence) {
        return new StubAdvisor(AdvisorSuggestion.of(assignees, confidence), null);
    }

    public static StubAdvisor failing(RuntimeException error) {
        return new StubAdvisor(null, error);
    }

    public int calls() {
        return calls;
    }

    public List<HistoricalAssignment> lastHistory() {
        return lastHistory;
    }

    @Override
    public String providerName() {
        return "stub";
    }

    @Override
    public String model() {
        return "stub-1";
    }

    @Override
    public TicketClassification classify(TicketContext context) {
        return new TicketClassification(context.requestType(), context.priority(), 1.0, List.of(), null);
    }

    @Override
    public AdvisorSuggestion suggestRouting(
            RequestType requestType,
            TicketPriority priority,
            String summary,
            String customerEmail,
            ContextValue.Mapping data,
            List<HistoricalAssignment> historicalAssignments
    ) {
        calls++;
        lastHistory = historicalAssignments;
        if (error != null) throw error;
        return suggestion;
    }
}
