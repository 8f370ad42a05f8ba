package com.routedesk.support.routing.advisor;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.advisor")
public record AdvisorProperties(
        boolean enabled,
        String provider,
        String baseUrl,
        String apiKey,
        String model,
        Double temperature,
        Integer maxTokens,
        long timeoutMs,
        String systemPrompt,
        boolean cacheEnabled,
        long cacheTtlMs
) {

    public AdvisorProperties {
        provider = provider == null || provider.isBlank() ? "openai" : provider.trim().toLowerCase();
        if (timeoutMs <= 0) timeoutMs = 15_000;
        if (cacheTtlMs <= 0) cacheTtlMs = 300_000;
    }
}
