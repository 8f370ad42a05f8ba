package com.routedesk.support.routing.repo;

import com.routedesk.support.routing.model.AuditEntry;

/**
 * Append-only sink for advisor call records. Never read back by routing.
 */
public interface AuditLog {

    void append(AuditEntry entry);
}
