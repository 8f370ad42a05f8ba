package com.routedesk.support.routing.model;

import java.util.List;

public record AdvisorSuggestion(
        List<String> suggestedAssignees,
        double confidence,
        String reasoning,
        List<String> alternativeAssignees,
        Integer estimatedResponseMinutes
) {

    public AdvisorSuggestion {
        suggestedAssignees = suggestedAssignees == null ? List.of() : List.copyOf(suggestedAssignees);
        alternativeAssignees = alternativeAssignees == null ? List.of() : List.copyOf(alternativeAssignees);
    }

    public static AdvisorSuggestion of(List<String> suggestedAssignees, double confidence) {
        return new AdvisorSuggestion(suggestedAssignees, confidence, null, null, null);
    }

    public boolean confidenceInRange() {
        return !Double.isNaN(confidence) && confidence >= 0.0 && confidence <= 1.0;
    }
}
