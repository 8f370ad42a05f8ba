package com.routedesk.support.routing.model;

public record HistoricalAssignment(String requestType, String assignee) {
}
