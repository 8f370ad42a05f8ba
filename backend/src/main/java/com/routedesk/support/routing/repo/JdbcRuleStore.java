package com.routedesk.support.routing.repo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.error.StoreUnavailableException;
import com.routedesk.support.routing.model.RoutingRule;
import com.routedesk.support.routing.model.RoutingRulePatch;
import com.routedesk.support.routing.value.ContextValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRuleStore.class);

    private static final String SELECT_COLUMNS = "select id, predicate, assignees, active, rule_order from routing_rule";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcRuleStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RoutingRule> listActiveRules() {
        return query(SELECT_COLUMNS + " where active = true order by rule_order asc, id asc");
    }

    @Override
    public List<RoutingRule> listRules() {
        return query(SELECT_COLUMNS + " order by rule_order asc, id asc");
    }

    @Override
    public long createRule(RoutingRule rule) {
        rule.validated();
        var predicateJson = JsonColumns.write(objectMapper, ContextValues.toJson(rule.predicate()));
        var assigneesJson = JsonColumns.write(objectMapper, rule.assignees());

        var pg = """
                insert into routing_rule(predicate, assignees, active, rule_order)
                values (cast(? as jsonb), cast(? as jsonb), ?, ?)
                """;
        var plain = """
                insert into routing_rule(predicate, assignees, active, rule_order)
                values (?, ?, ?, ?)
                """;

        try {
            return insertReturningId(pg, predicateJson, assigneesJson, rule);
        } catch (DataAccessException e) {
            return insertReturningId(plain, predicateJson, assigneesJson, rule);
        }
    }

    @Override
    public RoutingRule updateRule(long id, RoutingRulePatch patch) {
        var existing = findById(id).orElseThrow(() -> new IllegalArgumentException("rule_not_found"));
        var updated = (patch == null ? existing : patch.applyTo(existing)).validated();

        var pg = """
                update routing_rule
                set predicate = cast(? as jsonb), assignees = cast(? as jsonb), active = ?, rule_order = ?
                where id = ?
                """;
        var plain = """
                update routing_rule
                set predicate = ?, assignees = ?, active = ?, rule_order = ?
                where id = ?
                """;
        JsonColumns.update(jdbcTemplate, pg, plain,
                JsonColumns.write(objectMapper, ContextValues.toJson(updated.predicate())),
                JsonColumns.write(objectMapper, updated.assignees()),
                updated.active(),
                updated.order(),
                id);
        return updated;
    }

    public Optional<RoutingRule> findById(long id) {
        return query(SELECT_COLUMNS + " where id = ?", id).stream().findFirst();
    }

    private long insertReturningId(String sql, String predicateJson, String assigneesJson, RoutingRule rule) {
        var keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            var ps = con.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, predicateJson);
            ps.setString(2, assigneesJson);
            ps.setBoolean(3, rule.active());
            ps.setInt(4, rule.order());
            return ps;
        }, keyHolder);
        var key = keyHolder.getKey();
        if (key == null) throw new IllegalStateException("rule_id_not_generated");
        return key.longValue();
    }

    private List<RoutingRule> query(String sql, Object... args) {
        List<RoutingRule> rows;
        try {
            rows = jdbcTemplate.query(sql, (rs, rowNum) -> mapRow(rs), args);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("routing_rule", e);
        }
        var out = new ArrayList<RoutingRule>(rows.size());
        for (var r : rows) {
            if (r != null) out.add(r);
        }
        return out;
    }

    private RoutingRule mapRow(ResultSet rs) throws SQLException {
        var id = rs.getLong("id");
        JsonNode predicate = JsonColumns.read(objectMapper, rs.getString("predicate"));
        if (!predicate.isObject()) {
            // a rule we cannot read must never match everything
            log.warn("routing_rule_predicate_unreadable ruleId={}", id);
            return null;
        }
        var assignees = new ArrayList<String>();
        for (var a : JsonColumns.read(objectMapper, rs.getString("assignees"))) {
            if (a.isTextual() && !a.textValue().isBlank()) assignees.add(a.textValue());
        }
        return new RoutingRule(
                id,
                ContextValues.predicateFromJson(predicate),
                assignees,
                rs.getBoolean("active"),
                rs.getInt("rule_order")
        );
    }
}
