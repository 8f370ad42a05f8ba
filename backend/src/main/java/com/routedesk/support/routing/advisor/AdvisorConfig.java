package com.routedesk.support.routing.advisor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routedesk.support.routing.service.RoutingProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Registers the routing advisor only when {@code app.advisor.enabled=true}.
 * Without it the routing engine runs rules-only.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.advisor", name = "enabled", havingValue = "true")
public class AdvisorConfig {

    private static final Logger log = LoggerFactory.getLogger(AdvisorConfig.class);

    @Bean
    public RestTemplate advisorRestTemplate(AdvisorProperties props) {
        var factory = new SimpleClientHttpRequestFactory();
        var timeout = (int) Math.min(Integer.MAX_VALUE, props.timeoutMs());
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return new RestTemplate(factory);
    }

    @Bean
    public AdvisorPort advisorPort(
            AdvisorProperties props,
            RestTemplate advisorRestTemplate,
            ObjectMapper objectMapper,
            RoutingProperties routingProperties,
            MeterRegistry meterRegistry
    ) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            log.warn("advisor_api_key_missing provider={}", props.provider());
        }
        var directory = routingProperties.validAssignees();
        LlmAdvisorClient client = switch (props.provider()) {
            case "openai" -> new OpenAiAdvisorClient(props, advisorRestTemplate, objectMapper, directory, meterRegistry);
            case "gemini" -> new GeminiAdvisorClient(props, advisorRestTemplate, objectMapper, directory, meterRegistry);
            default -> throw new IllegalStateException("unsupported_advisor_provider " + props.provider());
        };
        log.info("advisor_enabled provider={} model={} cache={}", client.providerName(), client.model(), props.cacheEnabled());
        return client;
    }
}
