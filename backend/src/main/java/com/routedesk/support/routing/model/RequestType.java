package com.routedesk.support.routing.model;

import java.util.Locale;

/**
 * Ticket categories. {@link #code()} is the value stored on the ticket row and
 * used in rule predicates.
 */
public enum RequestType {
    QUOTE("quote"),
    COA("coa"),
    FREIGHT("freight"),
    CLAIM("claim"),
    OTHER("other");

    private final String code;

    RequestType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Lenient lookup; unknown or blank codes map to {@link #OTHER}.
     */
    public static RequestType fromCode(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        var key = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (key) {
            case "quote" -> QUOTE;
            case "coa", "certificate-of-analysis" -> COA;
            case "freight" -> FREIGHT;
            case "claim" -> CLAIM;
            default -> OTHER;
        };
    }
}
