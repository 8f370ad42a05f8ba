package com.routedesk.support.routing.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.error.StoreUnavailableException;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.value.ContextValues;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTicketStore implements TicketStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcTicketStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<TicketContext> findContext(long ticketId) {
        var sql = """
                select request_type, priority, customer_email, summary, data
                from ticket
                where id = ?
                limit 1
                """;
        try {
            var list = jdbcTemplate.query(sql, (rs, rowNum) -> new TicketContext(
                    RequestType.fromCode(rs.getString("request_type")),
                    TicketPriority.fromCode(rs.getString("priority")),
                    rs.getString("customer_email"),
                    rs.getString("summary"),
                    ContextValues.mappingFromJson(JsonColumns.read(objectMapper, rs.getString("data")))
            ), ticketId);
            return list.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ticket", e);
        }
    }

    @Override
    public int updateRouting(long ticketId, String primaryAssignee, String status, AdvisorSuggestion suggestion) {
        var pg = """
                update ticket
                set assignee = ?, status = ?, ai_routing_suggestion = cast(? as jsonb)
                where id = ?
                """;
        var plain = """
                update ticket
                set assignee = ?, status = ?, ai_routing_suggestion = ?
                where id = ?
                """;
        try {
            return JsonColumns.update(jdbcTemplate, pg, plain,
                    primaryAssignee, status, JsonColumns.write(objectMapper, suggestion), ticketId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ticket", e);
        }
    }

    @Override
    public List<HistoricalAssignment> listResolvedAssignments(RequestType requestType, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 100));
        var sql = """
                select request_type, assignee
                from ticket
                where request_type = ?
                  and status = 'resolved'
                  and assignee is not null
                  and assignee <> ''
                order by resolved_at desc, id desc
                limit ?
                """;
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> new HistoricalAssignment(
                    rs.getString("request_type"),
                    rs.getString("assignee")
            ), requestType.code(), safeLimit);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ticket", e);
        }
    }
}
