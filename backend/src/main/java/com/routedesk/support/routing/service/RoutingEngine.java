package com.routedesk.support.routing.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.routedesk.support.routing.advisor.AdvisorPort;
import com.routedesk.support.routing.error.AdvisorException;
import com.routedesk.support.routing.error.TicketNotFoundException;
import com.routedesk.support.routing.error.TicketPersistenceException;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.AuditEntry;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RoutingDecision;
import com.routedesk.support.routing.model.RoutingRule;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.repo.AuditLog;
import com.routedesk.support.routing.repo.RuleStore;
import com.routedesk.support.routing.repo.TicketStore;
import com.routedesk.support.routing.value.ContextValues;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Routes one ticket: first matching active rule (or the per-type default),
 * optionally refined by the advisor, then persisted on the ticket.
 * <p>
 * Only a missing ticket, an unreadable ticket store and a failed ticket write
 * escape {@link #assignTicket}; every other failure falls back to the best
 * assignee list computed so far.
 * <p>
 * Two concurrent calls for the same ticket are not deduplicated here; the
 * later write wins.
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    static final int HISTORY_SAMPLE_LIMIT = 10;
    static final String STATUS_ROUTED = "routed";
    static final String OPERATION_ROUTE = "route";

    private final RuleStore ruleStore;
    private final TicketStore ticketStore;
    private final AuditLog auditLog;
    private final PredicateMatcher predicateMatcher;
    private final ObjectProvider<AdvisorPort> advisorProvider;
    private final Set<String> validAssignees;
    private final ObjectMapper objectMapper;

    private final Counter ruleDecisions;
    private final Counter defaultDecisions;
    private final Counter advisorMerged;
    private final Counter advisorBelowThreshold;
    private final Counter advisorFailed;
    private final Counter advisorSkipped;
    private final Timer assignDuration;

    private record RuleOutcome(List<String> assignees, RoutingDecision.Source source) {
    }

    public RoutingEngine(
            RuleStore ruleStore,
            TicketStore ticketStore,
            AuditLog auditLog,
            PredicateMatcher predicateMatcher,
            ObjectProvider<AdvisorPort> advisorProvider,
            RoutingProperties routingProperties,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        this.ruleStore = ruleStore;
        this.ticketStore = ticketStore;
        this.auditLog = auditLog;
        this.predicateMatcher = predicateMatcher;
        this.advisorProvider = advisorProvider;
        this.validAssignees = Set.copyOf(routingProperties.validAssigneeSet());
        this.objectMapper = objectMapper;

        this.ruleDecisions = Counter.builder("routedesk.routing.decisions")
                .description("Routing decisions by rule-side source")
                .tag("source", "rule")
                .register(meterRegistry);
        this.defaultDecisions = Counter.builder("routedesk.routing.decisions")
                .description("Routing decisions by rule-side source")
                .tag("source", "default")
                .register(meterRegistry);
        this.advisorMerged = advisorCounter(meterRegistry, "merged");
        this.advisorBelowThreshold = advisorCounter(meterRegistry, "below_threshold");
        this.advisorFailed = advisorCounter(meterRegistry, "failed");
        this.advisorSkipped = advisorCounter(meterRegistry, "skipped");
        this.assignDuration = Timer.builder("routedesk.routing.assign.duration")
                .description("End-to-end duration of assignTicket")
                .register(meterRegistry);
    }

    private static Counter advisorCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("routedesk.routing.advisor")
                .description("Advisor participation in routing decisions")
                .tag("outcome", outcome)
                .register(registry);
    }

    /**
     * Routes the ticket and records the primary assignee with status {@code routed}.
     *
     * @return assignees, primary first; never empty
     * @throws TicketNotFoundException     if the ticket does not exist
     * @throws TicketPersistenceException  if the outcome could not be written
     */
    public List<String> assignTicket(long ticketId, boolean enableAdvisor) {
        Timer.Sample sample = Timer.start();
        try {
            var context = ticketStore.findContext(ticketId)
                    .orElseThrow(() -> new TicketNotFoundException(ticketId));

            var decision = evaluate(ticketId, context, enableAdvisor);

            int updated;
            try {
                updated = ticketStore.updateRouting(ticketId, decision.primaryAssignee(), STATUS_ROUTED,
                        decision.advisorSuggestion());
            } catch (RuntimeException e) {
                log.warn("ticket_route_persist_failed ticketId={} assignee={}", ticketId, decision.primaryAssignee(), e);
                throw new TicketPersistenceException(ticketId, decision.assignees(), e);
            }
            if (updated == 0) {
                throw new TicketNotFoundException(ticketId);
            }

            log.info("ticket_routed ticketId={} assignee={} source={} usedAdvisor={} stage={}",
                    ticketId, decision.primaryAssignee(), decision.source(), decision.usedAdvisor(),
                    RoutingStage.PERSISTED);
            return decision.assignees();
        } finally {
            sample.stop(assignDuration);
        }
    }

    /**
     * Computes a decision without writing to the ticket. Advisor calls made
     * here are still audited.
     *
     * @param ticketId recorded on audit entries; may be null for previews
     */
    public RoutingDecision evaluate(Long ticketId, TicketContext context, boolean enableAdvisor) {
        log.debug("routing_stage ticketId={} stage={}", ticketId, RoutingStage.PENDING);

        var ruleOutcome = evaluateRules(context);
        var ruleAssignees = ruleOutcome.assignees();
        if (ruleOutcome.source() == RoutingDecision.Source.RULE) {
            ruleDecisions.increment();
        } else {
            defaultDecisions.increment();
        }
        log.debug("routing_stage ticketId={} stage={} source={} assignees={}",
                ticketId, RoutingStage.RULES_EVALUATED, ruleOutcome.source(), ruleAssignees);

        var advisor = enableAdvisor ? advisorProvider.getIfAvailable() : null;
        if (advisor == null) {
            advisorSkipped.increment();
            log.debug("routing_stage ticketId={} stage={}", ticketId, RoutingStage.ADVISOR_SKIPPED);
            return new RoutingDecision(ruleAssignees, ruleOutcome.source(), false, null);
        }

        var suggestion = consultAdvisor(ticketId, context, advisor);
        log.debug("routing_stage ticketId={} stage={} ok={}", ticketId, RoutingStage.ADVISOR_CONSULTED, suggestion != null);
        if (suggestion == null) {
            advisorFailed.increment();
            return new RoutingDecision(ruleAssignees, ruleOutcome.source(), false, null);
        }

        var used = AssigneeMerger.shouldMerge(suggestion.suggestedAssignees(), suggestion.confidence());
        List<String> assignees = ruleAssignees;
        if (used) {
            try {
                assignees = AssigneeMerger.merge(ruleAssignees, suggestion.suggestedAssignees(),
                        suggestion.confidence(), validAssignees);
            } catch (RuntimeException e) {
                log.warn("routing_merge_failed ticketId={}", ticketId, e);
                assignees = ruleAssignees;
                used = false;
            }
        }
        if (assignees.isEmpty()) {
            assignees = List.of(DefaultAssignmentPolicy.FALLBACK_QUEUE);
        }
        (used ? advisorMerged : advisorBelowThreshold).increment();
        log.debug("routing_stage ticketId={} stage={} assignees={} usedAdvisor={}",
                ticketId, RoutingStage.MERGED, assignees, used);

        return new RoutingDecision(assignees, ruleOutcome.source(), used, suggestion);
    }

    private RuleOutcome evaluateRules(TicketContext context) {
        List<RoutingRule> rules;
        try {
            rules = ruleStore.listActiveRules();
        } catch (RuntimeException e) {
            log.warn("routing_rules_unavailable requestType={} fallback=default", context.requestType().code(), e);
            return defaults(context);
        }

        // stable sort: equal order keeps the store's insertion order
        var ordered = rules.stream()
                .filter(RoutingRule::active)
                .sorted(Comparator.comparingInt(RoutingRule::order))
                .toList();

        for (var rule : ordered) {
            boolean matched;
            try {
                matched = predicateMatcher.matches(context, rule.predicate());
            } catch (RuntimeException e) {
                log.warn("routing_rule_eval_failed ruleId={}", rule.id(), e);
                continue;
            }
            if (matched) {
                if (rule.assignees().isEmpty()) break;
                log.debug("routing_rule_matched ruleId={} order={}", rule.id(), rule.order());
                return new RuleOutcome(rule.assignees(), RoutingDecision.Source.RULE);
            }
        }
        return defaults(context);
    }

    private static RuleOutcome defaults(TicketContext context) {
        return new RuleOutcome(DefaultAssignmentPolicy.assigneesFor(context.requestType()), RoutingDecision.Source.DEFAULT);
    }

    /**
     * @return a usable suggestion, or null if the call failed; exactly one audit entry either way
     */
    private AdvisorSuggestion consultAdvisor(Long ticketId, TicketContext context, AdvisorPort advisor) {
        var history = loadHistory(context);
        var input = auditInput(ticketId, context, history);
        var provider = advisor.providerName();
        var model = advisor.model();

        long started = System.nanoTime();
        try {
            var suggestion = advisor.suggestRouting(
                    context.requestType(),
                    context.priority(),
                    context.summary(),
                    context.customerEmail(),
                    context.data(),
                    history
            );
            if (suggestion == null) {
                throw new AdvisorException("advisor_empty_response");
            }
            if (!suggestion.confidenceInRange()) {
                throw new AdvisorException("advisor_confidence_out_of_range confidence=" + suggestion.confidence());
            }
            appendAudit(AuditEntry.succeeded(ticketId, OPERATION_ROUTE, provider, model,
                    input, objectMapper.valueToTree(suggestion), elapsedMs(started)));
            return suggestion;
        } catch (RuntimeException e) {
            var message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("advisor_routing_failed ticketId={} provider={} error={}", ticketId, provider, message);
            appendAudit(AuditEntry.failed(ticketId, OPERATION_ROUTE, provider, model,
                    input, elapsedMs(started), message));
            return null;
        }
    }

    private List<HistoricalAssignment> loadHistory(TicketContext context) {
        try {
            var rows = ticketStore.listResolvedAssignments(context.requestType(), HISTORY_SAMPLE_LIMIT);
            return rows.size() > HISTORY_SAMPLE_LIMIT ? rows.subList(0, HISTORY_SAMPLE_LIMIT) : rows;
        } catch (RuntimeException e) {
            log.warn("routing_history_unavailable requestType={}", context.requestType().code(), e);
            return List.of();
        }
    }

    private ObjectNode auditInput(Long ticketId, TicketContext context, List<HistoricalAssignment> history) {
        ObjectNode input = objectMapper.createObjectNode();
        if (ticketId != null) input.put("ticketId", ticketId);
        input.put("requestType", context.requestType().code());
        input.put("priority", context.priority().code());
        if (context.customerEmail() != null) input.put("customerEmail", context.customerEmail());
        if (context.summary() != null) input.put("summary", context.summary());
        input.set("data", ContextValues.toJson(context.data()));
        input.set("historicalAssignments", objectMapper.valueToTree(history));
        return input;
    }

    private void appendAudit(AuditEntry entry) {
        try {
            auditLog.append(entry);
        } catch (RuntimeException e) {
            log.warn("audit_append_failed ticketId={} operation={}", entry.ticketId(), entry.operation(), e);
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
