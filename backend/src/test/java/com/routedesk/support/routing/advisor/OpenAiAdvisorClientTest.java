package com.routedesk.support.routing.advisor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.error.AdvisorException;
import com.routedesk.support.routing.model.AdvisorSuggestion;
import com.routedesk.support.routing.model.HistoricalAssignment;
import com.routedesk.support.routing.model.RequestType;
import com.routedesk.support.routing.model.TicketContext;
import com.routedesk.support.routing.model.TicketPriority;
import com.routedesk.support.routing.service.RoutingProperties;
import com.routedesk.support.routing.value.ContextValue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiAdvisorClientTest {

    private static final String URL = "http://llm.test/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private OpenAiAdvisorClient client(boolean cacheEnabled) {
        var props = new AdvisorProperties(true, "openai", "http://llm.test/", "sk-test", null,
                null, null, 1000, null, cacheEnabled, 0);
        return new OpenAiAdvisorClient(props, restTemplate, objectMapper,
                RoutingProperties.defaults().validAssignees(), meters);
    }

    private String reply(String content) throws Exception {
        var body = objectMapper.createObjectNode();
        body.putArray("choices").addObject().putObject("message")
                .put("role", "assistant")
                .put("content", content);
        return objectMapper.writeValueAsString(body);
    }

    private AdvisorSuggestion suggest(OpenAiAdvisorClient client) {
        return client.suggestRouting(RequestType.QUOTE, TicketPriority.HIGH, "20 drums of acetone",
                "buyer@example.com", ContextValue.Mapping.empty(),
                List.of(new HistoricalAssignment("quote", "Adnan")));
    }

    @Test
    void suggest_routing_posts_chat_completion_and_parses_reply() throws Exception {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andExpect(jsonPath("$.temperature").value(0.4))
                .andExpect(jsonPath("$.max_tokens").value(800))
                .andExpect(jsonPath("$.messages[1].content").value(containsString("quote -> Adnan")))
                .andExpect(jsonPath("$.messages[1].content").value(containsString("- Lori: Logistics manager")))
                .andRespond(withSuccess(reply("""
                        {"suggestedAssignees":["Adnan","sales-team"],"confidence":0.92,
                         "reasoning":"bulk solvent quote","alternativeAssignees":["Lori"],"estimatedResponseTime":30}
                        """), MediaType.APPLICATION_JSON));

        var suggestion = suggest(client(false));

        server.verify();
        assertEquals(List.of("Adnan", "sales-team"), suggestion.suggestedAssignees());
        assertEquals(0.92, suggestion.confidence());
        assertEquals("bulk solvent quote", suggestion.reasoning());
        assertEquals(List.of("Lori"), suggestion.alternativeAssignees());
        assertEquals(30, suggestion.estimatedResponseMinutes());
        assertEquals(1.0, meters.get("routedesk.advisor.requests").counter().count());
    }

    @Test
    void fenced_reply_is_accepted() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(reply("```json\n{\"suggestedAssignees\":[\"Lori\"],\"confidence\":0.5}\n```"),
                        MediaType.APPLICATION_JSON));

        var suggestion = suggest(client(false));

        assertEquals(List.of("Lori"), suggestion.suggestedAssignees());
        assertNull(suggestion.reasoning());
        assertNull(suggestion.estimatedResponseMinutes());
    }

    @Test
    void malformed_reply_raises_advisor_exception() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(reply("I think Adnan should take it."), MediaType.APPLICATION_JSON));

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));

        assertEquals("advisor_malformed_response", e.code());
        assertEquals(1.0, meters.get("routedesk.advisor.failures").counter().count());
    }

    @Test
    void missing_confidence_is_malformed() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(reply("{\"suggestedAssignees\":[\"Lori\"],\"confidence\":\"high\"}"),
                        MediaType.APPLICATION_JSON));

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));
        assertEquals("advisor_malformed_response", e.code());
    }

    @Test
    void empty_choices_is_empty_response() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));
        assertEquals("advisor_empty_response", e.code());
    }

    @Test
    void server_error_is_http_error() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));
        assertEquals("advisor_http_error", e.code());
    }

    @Test
    void cached_answer_skips_second_call() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(reply("{\"suggestedAssignees\":[\"Adnan\"],\"confidence\":0.9}"),
                        MediaType.APPLICATION_JSON));
        var client = client(true);

        var first = suggest(client);
        var second = suggest(client);

        server.verify();
        assertEquals(first, second);
        assertEquals(1, client.cacheSize());
        assertEquals(1.0, meters.get("routedesk.advisor.cache_hits").counter().count());
    }

    @Test
    void cache_is_bounded() throws Exception {
        server.expect(ExpectedCount.manyTimes(), requestTo(URL))
                .andRespond(withSuccess(reply("{\"suggestedAssignees\":[\"Adnan\"],\"confidence\":0.9}"),
                        MediaType.APPLICATION_JSON));
        var client = client(true);

        for (int i = 0; i < 250; i++) {
            client.suggestRouting(RequestType.QUOTE, TicketPriority.NORMAL, "order " + i, null,
                    ContextValue.Mapping.empty(), List.of());
        }

        assertTrue(client.cacheSize() <= 100);
    }

    @Test
    void read_timeout_is_reported_as_timeout() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));
        assertEquals("advisor_timeout", e.code());
    }

    @Test
    void refused_connection_is_reported_as_unreachable() {
        server.expect(requestTo(URL)).andRespond(request -> {
            throw new ConnectException("Connection refused");
        });

        var e = assertThrows(AdvisorException.class, () -> suggest(client(false)));
        assertEquals("advisor_unreachable", e.code());
    }

    @Test
    void failures_are_not_cached() throws Exception {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL))
                .andRespond(withSuccess(reply("{\"suggestedAssignees\":[\"Adnan\"],\"confidence\":0.9}"),
                        MediaType.APPLICATION_JSON));
        var client = client(true);

        assertThrows(AdvisorException.class, () -> suggest(client));
        assertEquals(List.of("Adnan"), suggest(client).suggestedAssignees());
        server.verify();
    }

    @Test
    void classify_parses_type_and_priority() throws Exception {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.temperature").value(0.3))
                .andExpect(jsonPath("$.max_tokens").value(1000))
                .andRespond(withSuccess(reply("""
                        {"requestType":"certificate-of-analysis","priority":"urgent","confidence":0.7,
                         "suggestedTags":["coa","lot-4411"],"reasoning":"asks for lot paperwork"}
                        """), MediaType.APPLICATION_JSON));

        var context = new TicketContext(RequestType.OTHER, TicketPriority.NORMAL, null,
                "Need the CoA for lot 4411 today", null);
        var classification = client(false).classify(context);

        assertEquals(RequestType.COA, classification.requestType());
        assertEquals(TicketPriority.URGENT, classification.priority());
        assertEquals(0.7, classification.confidence());
        assertEquals(List.of("coa", "lot-4411"), classification.suggestedTags());
    }
}
