package com.routedesk.support.routing.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * JSON column helpers shared by the JDBC adapters. Statements are written for
 * PostgreSQL ({@code cast(? as jsonb)}) with a plain-parameter variant for H2.
 */
final class JsonColumns {

    private JsonColumns() {
    }

    static int update(JdbcTemplate jdbcTemplate, String pgSql, String plainSql, Object... args) {
        try {
            return jdbcTemplate.update(pgSql, args);
        } catch (DataAccessException e) {
            // H2 has no jsonb type
            return jdbcTemplate.update(plainSql, args);
        }
    }

    static String write(ObjectMapper objectMapper, Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("json_not_serializable", e);
        }
    }

    static JsonNode read(ObjectMapper objectMapper, String raw) {
        if (raw == null || raw.isBlank()) return objectMapper.nullNode();
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return objectMapper.nullNode();
        }
    }
}
