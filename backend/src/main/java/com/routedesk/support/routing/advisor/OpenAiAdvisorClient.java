package com.routedesk.support.routing.advisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * OpenAI-compatible {@code /v1/chat/completions} with JSON response format.
 */
public class OpenAiAdvisorClient extends LlmAdvisorClient {

    static final String DEFAULT_BASE_URL = "https://api.openai.com";

    public OpenAiAdvisorClient(
            AdvisorProperties properties,
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            List<String> assigneeDirectory,
            MeterRegistry meterRegistry
    ) {
        super(properties, restTemplate, objectMapper, assigneeDirectory, meterRegistry);
    }

    @Override
    public String providerName() {
        return "openai";
    }

    @Override
    protected String defaultModel() {
        return "gpt-4o-mini";
    }

    @Override
    protected String complete(Completion completion) {
        var body = objectMapper.createObjectNode();
        body.put("model", model());
        var messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", completion.systemPrompt());
        messages.addObject().put("role", "user").put("content", completion.userPrompt());
        body.put("temperature", completion.temperature());
        body.put("max_tokens", completion.maxTokens());
        body.putObject("response_format").put("type", "json_object");

        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            headers.setBearerAuth(properties.apiKey());
        }

        var url = baseUrl() + "/v1/chat/completions";
        JsonNode resp = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        if (resp == null) return null;
        var content = resp.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.textValue() : null;
    }

    private String baseUrl() {
        var url = properties.baseUrl();
        if (url == null || url.isBlank()) return DEFAULT_BASE_URL;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
