package com.routedesk.support.routing.service;

import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.value.ContextPath;
import com.routedesk.support.routing.value.ContextValue;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Evaluates a rule predicate against a ticket. Every key must hold; a
 * sequence-valued key holds when the resolved value is one of its items,
 * any other key holds on exact equality. A path that does not resolve never
 * holds, and neither does a key whose expected value is absent (JSON null).
 * Stateless.
 */
@Component
public class PredicateMatcher {

    public boolean matches(TicketContext context, Map<String, ContextValue> predicate) {
        if (predicate == null || predicate.isEmpty()) return true;
        return matches(context.asValue(), predicate);
    }

    boolean matches(ContextValue.Mapping root, Map<String, ContextValue> predicate) {
        for (var e : predicate.entrySet()) {
            var actual = ContextPath.resolve(root, e.getKey());
            if (!actual.isPresent()) return false;

            var expected = e.getValue();
            if (expected == null || !expected.isPresent()) return false;
            if (expected instanceof ContextValue.Sequence accepted) {
                if (!accepted.contains(actual)) return false;
            } else if (!actual.equals(expected)) {
                return false;
            }
        }
        return true;
    }
}
