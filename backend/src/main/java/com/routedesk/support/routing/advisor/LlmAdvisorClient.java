package com.routedesk.support.routing.advisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.routedesk.support.routing.error.AdvisorException;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketClassification;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.value.ContextValue;
import com.routedesk.support.routing.value.ContextValues;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Advisor backed by a chat-completion style LLM API that answers in JSON.
 * Subclasses only know how to send one system+user prompt pair and extract
 * the model's text reply.
 */
public abstract class LlmAdvisorClient implements AdvisorPort {

    private static final Logger log = LoggerFactory.getLogger(LlmAdvisorClient.class);

    private static final int CACHE_MAX_ENTRIES = 100;

    protected final AdvisorProperties properties;
    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;
    private final List<String> assigneeDirectory;

    private final Counter requests;
    private final Counter failures;
    private final Counter cacheHits;
    private final Timer latency;

    private final Cache<String, AdvisorSuggestion> suggestionCache;
    private final Cache<String, TicketClassification> classificationCache;

    protected record Completion(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
    }

    protected LlmAdvisorClient(
            AdvisorProperties properties,
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            List<String> assigneeDirectory,
            MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.assigneeDirectory = List.copyOf(assigneeDirectory);

        this.requests = Counter.builder("routedesk.advisor.requests")
                .description("Advisor calls sent upstream")
                .register(meterRegistry);
        this.failures = Counter.builder("routedesk.advisor.failures")
                .description("Advisor calls that failed or returned an unusable reply")
                .register(meterRegistry);
        this.cacheHits = Counter.builder("routedesk.advisor.cache_hits")
                .description("Advisor calls answered from the response cache")
                .register(meterRegistry);
        this.latency = Timer.builder("routedesk.advisor.duration")
                .description("Upstream advisor call latency")
                .register(meterRegistry);

        this.suggestionCache = Caffeine.newBuilder()
                .maximumSize(CACHE_MAX_ENTRIES)
                .expireAfterWrite(Duration.ofMillis(properties.cacheTtlMs()))
                .build();
        this.classificationCache = Caffeine.newBuilder()
                .maximumSize(CACHE_MAX_ENTRIES)
                .expireAfterWrite(Duration.ofMillis(properties.cacheTtlMs()))
                .build();
    }

    /**
     * Sends one prompt and returns the raw text the model replied with.
     */
    protected abstract String complete(Completion completion);

    protected abstract String defaultModel();

    @Override
    public String model() {
        var m = properties.model();
        return m == null || m.isBlank() ? defaultModel() : m.trim();
    }

    @Override
    public TicketClassification classify(TicketContext context) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("summary", context.summary());

        return cached(classificationCache, "classify", input, () -> {
            var reply = callJson(new Completion(
                    systemPrompt(AdvisorPrompts.CLASSIFY_SYSTEM),
                    AdvisorPrompts.classify(context),
                    temperature(0.3),
                    maxTokens(1000)
            ));
            return parseClassification(reply);
        });
    }

    @Override
    public AdvisorSuggestion suggestRouting(
            RequestType requestType,
            TicketPriority priority,
            String summary,
            String customerEmail,
            ContextValue.Mapping data,
            List<HistoricalAssignment> historicalAssignments
    ) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("requestType", requestType.code());
        input.put("priority", priority.code());
        input.put("summary", summary);
        input.put("customerEmail", customerEmail);
        input.set("data", ContextValues.toJson(data));
        input.set("historicalAssignments", objectMapper.valueToTree(
                historicalAssignments == null ? List.of() : historicalAssignments));

        return cached(suggestionCache, "suggestRouting", input, () -> {
            var reply = callJson(new Completion(
                    systemPrompt(AdvisorPrompts.ROUTE_SYSTEM),
                    AdvisorPrompts.route(objectMapper, requestType, priority, summary, customerEmail,
                            data, historicalAssignments, assigneeDirectory),
                    temperature(0.4),
                    maxTokens(800)
            ));
            return parseSuggestion(reply);
        });
    }

    private JsonNode callJson(Completion completion) {
        requests.increment();
        Timer.Sample sample = Timer.start();
        try {
            var text = complete(completion);
            return parseReply(text);
        } catch (ResourceAccessException e) {
            failures.increment();
            var code = e.getCause() instanceof SocketTimeoutException ? "advisor_timeout" : "advisor_unreachable";
            log.warn("advisor_io_error provider={} code={}", providerName(), code);
            throw new AdvisorException(code, e);
        } catch (RestClientResponseException e) {
            failures.increment();
            log.warn("advisor_http_error provider={} status={}", providerName(), e.getStatusCode().value());
            throw new AdvisorException("advisor_http_error", e);
        } catch (RestClientException e) {
            failures.increment();
            throw new AdvisorException("advisor_upstream_error", e);
        } catch (AdvisorException e) {
            failures.increment();
            throw e;
        } finally {
            sample.stop(latency);
        }
    }

    JsonNode parseReply(String text) {
        if (text == null || text.isBlank()) {
            throw new AdvisorException("advisor_empty_response");
        }
        var body = stripCodeFence(text.trim());
        try {
            var node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new AdvisorException("advisor_malformed_response");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new AdvisorException("advisor_malformed_response", e);
        }
    }

    AdvisorSuggestion parseSuggestion(JsonNode reply) {
        var confidence = reply.path("confidence");
        if (!confidence.isNumber()) {
            throw new AdvisorException("advisor_malformed_response");
        }
        var minutes = reply.path("estimatedResponseTime");
        return new AdvisorSuggestion(
                textList(reply.path("suggestedAssignees")),
                confidence.doubleValue(),
                reply.path("reasoning").isTextual() ? reply.path("reasoning").textValue() : null,
                textList(reply.path("alternativeAssignees")),
                minutes.isNumber() ? minutes.intValue() : null
        );
    }

    TicketClassification parseClassification(JsonNode reply) {
        var confidence = reply.path("confidence");
        return new TicketClassification(
                RequestType.fromCode(reply.path("requestType").asText(null)),
                TicketPriority.fromCode(reply.path("priority").asText(null)),
                confidence.isNumber() ? confidence.doubleValue() : 0.0,
                textList(reply.path("suggestedTags")),
                reply.path("reasoning").isTextual() ? reply.path("reasoning").textValue() : null
        );
    }

    private <T> T cached(Cache<String, T> cache, String operation, JsonNode input, Supplier<T> loader) {
        if (!properties.cacheEnabled()) {
            return loader.get();
        }
        var key = operation + ":" + input.toString();
        var hit = cache.getIfPresent(key);
        if (hit != null) {
            cacheHits.increment();
            return hit;
        }

        // only successful replies reach the cache
        var value = loader.get();
        cache.put(key, value);
        return value;
    }

    long cacheSize() {
        suggestionCache.cleanUp();
        classificationCache.cleanUp();
        return suggestionCache.estimatedSize() + classificationCache.estimatedSize();
    }

    private String systemPrompt(String fallback) {
        var custom = properties.systemPrompt();
        return custom == null || custom.isBlank() ? fallback : custom;
    }

    private double temperature(double operationDefault) {
        return properties.temperature() == null ? operationDefault : properties.temperature();
    }

    private int maxTokens(int operationDefault) {
        return properties.maxTokens() == null ? operationDefault : Math.max(1, properties.maxTokens());
    }

    private static List<String> textList(JsonNode node) {
        var out = new ArrayList<String>();
        if (node == null || !node.isArray()) return out;
        for (var item : node) {
            if (item.isTextual() && !item.textValue().isBlank()) out.add(item.textValue().trim());
        }
        return out;
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) return text;
        var firstNewline = text.indexOf('\n');
        var lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) return text;
        return text.substring(firstNewline + 1, lastFence).trim();
    }
}
