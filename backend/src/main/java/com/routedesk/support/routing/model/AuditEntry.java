package com.routedesk.support.routing.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One advisor call as recorded in the audit log. {@code output} is null when
 * the call failed.
 */
public record AuditEntry(
        Long ticketId,
        String operation,
        String provider,
        String model,
        JsonNode input,
        JsonNode output,
        boolean success,
        long latencyMs,
        String errorMessage
) {

    public static AuditEntry succeeded(Long ticketId, String operation, String provider, String model,
                                       JsonNode input, JsonNode output, long latencyMs) {
        return new AuditEntry(ticketId, operation, provider, model, input, output, true, latencyMs, null);
    }

    public static AuditEntry failed(Long ticketId, String operation, String provider, String model,
                                    JsonNode input, long latencyMs, String errorMessage) {
        return new AuditEntry(ticketId, operation, provider, model, input, null, false, latencyMs, errorMessage);
    }
}
