package com.polkadot.analytics.engine.insight;

import com.fasterxml.jackson.databind.JsonNode;
import com.polkadot.analytics.config.AnalyticsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rewrites rule-based insights through an OpenAI-compatible chat completion endpoint.
 * Any failure (network, quota, unexpected payload) returns the rule-based list unchanged.
 */
public class GenerativeInsightEnhancer implements InsightEnhancer {

    private static final Logger log = LoggerFactory.getLogger(GenerativeInsightEnhancer.class);

    private final AnalyticsConfig.Enhancer config;
    private final RestClient restClient;

    public GenerativeInsightEnhancer(AnalyticsConfig.Enhancer config) {
        this(config, RestClient.builder()
                .requestFactory(requestFactory(config.getTimeoutSeconds()))
                .defaultHeader("Authorization", "Bearer " + config.getApiKey())
                .build());
    }

    GenerativeInsightEnhancer(AnalyticsConfig.Enhancer config, RestClient restClient) {
        this.config = config;
        this.restClient = restClient;
    }

    @Override
    public List<String> enhance(List<String> insights, String entityId, int timeRangeDays) {
        if (insights.isEmpty()) {
            return insights;
        }
        try {
            Map<String, Object> body = Map.of(
                    "model", config.getModel(),
                    "messages", List.of(Map.of("role", "user", "content", buildPrompt(insights, entityId))),
                    "max_tokens", config.getMaxTokens(),
                    "temperature", config.getTemperature());

            JsonNode response = restClient.post()
                    .uri(config.getEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            String content = response == null ? ""
                    : response.path("choices").path(0).path("message").path("content").asText("").trim();
            List<String> enhanced = parseLines(content);
            if (enhanced.isEmpty()) {
                log.warn("Insight enhancer returned no usable lines for {}; keeping rule-based insights",
                        entityId != null ? entityId : "all parachains");
                return insights;
            }
            log.info("Enhanced {} insights into {} for {} ({} days)", insights.size(), enhanced.size(),
                    entityId != null ? entityId : "all parachains", timeRangeDays);
            return enhanced;
        } catch (Exception e) {
            log.error("Failed to enhance insights for {}: {}",
                    entityId != null ? entityId : "all parachains", e.getMessage(), e);
            return insights;
        }
    }

    @Override
    public boolean isActive() {
        return true;
    }

    static String buildPrompt(List<String> insights, String entityId) {
        String subject = entityId != null ? "a Polkadot parachain" : "Polkadot parachains";
        String raw = insights.stream().map(i -> "- " + i).collect(Collectors.joining("\n"));
        return "You are an expert blockchain analyst. Based on the following raw insights about " + subject
                + ", provide enhanced, professional insights:\n\n"
                + "Raw insights:\n" + raw + "\n\n"
                + "Please provide 3-5 enhanced insights that are:\n"
                + "1. More detailed and actionable\n"
                + "2. Include specific recommendations\n"
                + "3. Use professional financial/blockchain terminology\n"
                + "4. Focus on investment and operational implications\n\n"
                + "Format each insight as a clear, concise statement.";
    }

    static List<String> parseLines(String content) {
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("Enhanced")) {
                continue;
            }
            while (trimmed.startsWith("-")) {
                trimmed = trimmed.substring(1).strip();
            }
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutSeconds * 1000);
        factory.setReadTimeout(timeoutSeconds * 1000);
        return factory;
    }
}
