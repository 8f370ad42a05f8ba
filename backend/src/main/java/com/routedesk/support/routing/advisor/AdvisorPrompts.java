package com.routedesk.support.routing.advisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.value.ContextValue;
import com.routedesk.support.routing.value.ContextValues;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

final class AdvisorPrompts {

    static final String CLASSIFY_SYSTEM =
            "You are an AI assistant specialized in classifying customer service tickets for a chemical supply company.";
    static final String ROUTE_SYSTEM =
            "You are an AI routing specialist for customer service tickets.";

    private static final Map<String, String> KNOWN_ROLES = Map.of(
            "sales-team", "Handles quotes and pricing",
            "coa-team", "Handles Certificate of Analysis requests",
            "logistics-team", "Handles freight and shipping",
            "customer-service", "General inquiries and claims",
            "Adnan", "Senior sales specialist for complex quotes",
            "Lori", "Logistics manager for freight issues"
    );

    private AdvisorPrompts() {
    }

    static String classify(TicketContext context) {
        return """
                Analyze the following customer service request and classify it:

                %s

                Classify this into one of these request types:
                - quote: Request for pricing or product quotes
                - coa: Certificate of Analysis request
                - freight: Shipping, delivery, or logistics inquiries
                - claim: Complaints, issues, or damage claims
                - other: Anything else

                Also determine priority (low, normal, high, urgent) based on customer sentiment and urgency,
                business impact and time sensitivity.

                Respond in JSON format with:
                {
                  "requestType": "...",
                  "priority": "...",
                  "confidence": 0.0-1.0,
                  "suggestedTags": [],
                  "reasoning": "..."
                }
                """.formatted(context.summary() == null ? "" : context.summary());
    }

    static String route(
            ObjectMapper objectMapper,
            RequestType requestType,
            TicketPriority priority,
            String summary,
            String customerEmail,
            ContextValue.Mapping data,
            List<HistoricalAssignment> history,
            List<String> assignees
    ) {
        var historyBlock = history == null || history.isEmpty()
                ? ""
                : "Historical assignments for similar tickets:\n" + history.stream()
                .map(h -> h.requestType() + " -> " + h.assignee())
                .collect(Collectors.joining("\n")) + "\n";

        var directory = assignees.stream()
                .map(a -> KNOWN_ROLES.containsKey(a) ? "- " + a + ": " + KNOWN_ROLES.get(a) : "- " + a)
                .collect(Collectors.joining("\n"));

        String dataJson;
        try {
            dataJson = objectMapper.writeValueAsString(ContextValues.toJson(data));
        } catch (JsonProcessingException e) {
            dataJson = "{}";
        }

        return """
                Analyze this ticket and suggest the best team/person to handle it:

                Request Type: %s
                Priority: %s
                Summary: %s
                Customer Email: %s
                Additional Data: %s

                %s
                Available teams/assignees:
                %s

                Suggest primary and alternative assignees with reasoning.

                Respond in JSON format:
                {
                  "suggestedAssignees": [],
                  "confidence": 0.0-1.0,
                  "reasoning": "...",
                  "alternativeAssignees": [],
                  "estimatedResponseTime": minutes
                }
                """.formatted(
                requestType.code(),
                priority.code(),
                summary == null || summary.isBlank() ? "N/A" : summary,
                customerEmail == null || customerEmail.isBlank() ? "N/A" : customerEmail,
                dataJson,
                historyBlock,
                directory
        );
    }
}
