package com.routedesk.support.routing.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.model.AuditEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
public class JdbcAuditLog implements AuditLog {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcAuditLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEntry entry) {
        var pg = """
                insert into ai_operation(ticket_id, operation, provider, model, input, output,
                                         success, response_time_ms, error_message, created_at)
                values (?, ?, ?, ?, cast(? as jsonb), cast(? as jsonb), ?, ?, ?, ?)
                """;
        var plain = """
                insert into ai_operation(ticket_id, operation, provider, model, input, output,
                                         success, response_time_ms, error_message, created_at)
                values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        JsonColumns.update(jdbcTemplate, pg, plain,
                entry.ticketId(),
                entry.operation(),
                entry.provider() == null ? "unknown" : entry.provider(),
                entry.model(),
                JsonColumns.write(objectMapper, entry.input() == null ? objectMapper.createObjectNode() : entry.input()),
                JsonColumns.write(objectMapper, entry.output()),
                entry.success(),
                entry.latencyMs(),
                truncate(entry.errorMessage(), 2000),
                Timestamp.from(Instant.now())
        );
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
