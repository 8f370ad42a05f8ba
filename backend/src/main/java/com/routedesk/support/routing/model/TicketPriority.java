package com.routedesk.support.routing.model;

import java.util.Locale;

public enum TicketPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String code;

    TicketPriority(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TicketPriority fromCode(String raw) {
        if (raw == null || raw.isBlank()) return NORMAL;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high" -> HIGH;
            case "urgent" -> URGENT;
            default -> NORMAL;
        };
    }
}
