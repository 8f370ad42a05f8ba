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
 * Google Gemini {@code generateContent} with a JSON response mime type.
 */
public class GeminiAdvisorClient extends LlmAdvisorClient {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";

    public GeminiAdvisorClient(
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
        return "gemini";
    }

    @Override
    protected String defaultModel() {
        return "gemini-1.5-flash";
    }

    @Override
    protected String complete(Completion completion) {
        var body = objectMapper.createObjectNode();
        body.putObject("systemInstruction").putArray("parts").addObject().put("text", completion.systemPrompt());
        var user = body.putArray("contents").addObject();
        user.put("role", "user");
        user.putArray("parts").addObject().put("text", completion.userPrompt());
        var generation = body.putObject("generationConfig");
        generation.put("temperature", completion.temperature());
        generation.put("maxOutputTokens", completion.maxTokens());
        generation.put("responseMimeType", "application/json");

        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            headers.set("x-goog-api-key", properties.apiKey());
        }

        var url = baseUrl() + "/v1beta/models/" + model() + ":generateContent";
        JsonNode resp = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        if (resp == null) return null;
        var text = resp.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        return text.isTextual() ? text.textValue() : null;
    }

    private String baseUrl() {
        var url = properties.baseUrl();
        if (url == null || url.isBlank()) return DEFAULT_BASE_URL;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
