package com.routedesk.support.routing.repo;

import com.routedesk.support.routing.error.StoreUnavailableException;
import com.routedesk.support.routing.model.RoutingRule;
import com.routedesk.support.routing.model.RoutingRulePatch;

import java.util.List;

public interface RuleStore {

    /**
     * @return active rules by {@code order} ascending, then insertion order
     * @throws StoreUnavailableException if the backing store cannot be read
     */
    List<RoutingRule> listActiveRules();

    /**
     * All rules, active or not, in evaluation order.
     */
    List<RoutingRule> listRules();

    /**
     * @return id of the new rule
     */
    long createRule(RoutingRule rule);

    /**
     * @throws IllegalArgumentException {@code rule_not_found} for an unknown id
     */
    RoutingRule updateRule(long id, RoutingRulePatch patch);
}
