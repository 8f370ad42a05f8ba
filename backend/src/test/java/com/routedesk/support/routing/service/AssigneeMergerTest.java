package com.routedesk.support.routing.service;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AssigneeMergerTest {

    private static final Set<String> VALID = RoutingProperties.defaults().validAssigneeSet();

    @Test
    void high_confidence_puts_advisor_pick_first() {
        var merged = AssigneeMerger.merge(List.of("sales-team"), List.of("Adnan", "sales-team"), 0.9, VALID);
        assertEquals(List.of("Adnan", "sales-team"), merged);
    }

    @Test
    void rule_order_kept_then_remaining_valid_advisor_picks() {
        var merged = AssigneeMerger.merge(
                List.of("logistics-team", "customer-service"),
                List.of("Lori", "unknown-bot", "sales-team", "logistics-team"),
                0.95,
                VALID
        );
        assertEquals(List.of("Lori", "logistics-team", "customer-service", "sales-team"), merged);
    }

    @Test
    void threshold_is_exclusive() {
        var rules = List.of("coa-team");
        assertEquals(rules, AssigneeMerger.merge(rules, List.of("Adnan"), 0.8, VALID));
        assertEquals(rules, AssigneeMerger.merge(rules, List.of("Adnan"), 0.2, VALID));
        assertEquals(List.of("Adnan", "coa-team"), AssigneeMerger.merge(rules, List.of("Adnan"), 0.81, VALID));
    }

    @Test
    void empty_advisor_list_keeps_rules() {
        assertEquals(List.of("coa-team"), AssigneeMerger.merge(List.of("coa-team"), List.of(), 0.99, VALID));
    }

    @Test
    void invalid_primary_is_skipped_but_rules_survive() {
        var merged = AssigneeMerger.merge(List.of("sales-team"), List.of("Mallory", "Adnan"), 0.9, VALID);
        assertEquals(List.of("sales-team", "Adnan"), merged);
    }

    @Test
    void nothing_left_falls_back_to_customer_service() {
        var merged = AssigneeMerger.merge(List.of(), List.of("Mallory"), 0.9, VALID);
        assertEquals(List.of("customer-service"), merged);
    }

    @Test
    void never_returns_duplicates() {
        var merged = AssigneeMerger.merge(
                List.of("sales-team", "Adnan", "sales-team"),
                List.of("Adnan", "Adnan", "sales-team", "Lori", "Lori"),
                0.9,
                VALID
        );
        assertEquals(merged.size(), new HashSet<>(merged).size());
        assertEquals(List.of("Adnan", "sales-team", "Lori"), merged);
    }

    @Test
    void whitelist_is_configurable() {
        var custom = Set.of("night-desk");
        var merged = AssigneeMerger.merge(List.of("sales-team"), List.of("night-desk", "Adnan"), 0.9, custom);
        assertEquals(List.of("night-desk", "sales-team"), merged);
    }
}
