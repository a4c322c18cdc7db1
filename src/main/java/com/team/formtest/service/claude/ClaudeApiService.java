package com.team.formtest.service.claude;

import com.team.formtest.config.ClaudeApiConfig;
import com.team.formtest.exception.AiGenerationException;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Client for test data requests to the Anthropic Messages API.
 * Each request spends one token of the {@code claudeApiRateLimiter} bucket; an empty
 * bucket fails the request at once instead of waiting.
 */
@Service
@Slf4j
public class ClaudeApiService {

    private static final String ANTHROPIC_API_URL = "https://api.anthropic.com/v1/messages";
    private static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final String SYSTEM_PROMPT =
            "You generate test data for automated web form tests. Answer with a single JSON document and nothing else.";

    private final ClaudeApiConfig config;
    private final Bucket rateLimiter;
    private final WebClient webClient;

    public ClaudeApiService(ClaudeApiConfig config,
                            @Qualifier("claudeApiRateLimiter") Bucket rateLimiter) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.webClient = WebClient.builder()
                .baseUrl(ANTHROPIC_API_URL)
                .defaultHeader("x-api-key", config.getApiKey())
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public boolean isConfigured() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Send a test data prompt and return the text of the answer.
     */
    public Mono<String> requestTestData(String prompt) {
        if (!isConfigured()) {
            return Mono.error(new AiGenerationException("No Claude API key configured"));
        }
        ConsumptionProbe probe = rateLimiter.tryConsumeAndReturnRemaining(1);
        if (!probe.isConsumed()) {
            long waitSeconds = TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill());
            log.warn("Test data request refused by rate limit, next token in {}s", waitSeconds);
            return Mono.error(new AiGenerationException("Claude API rate limit reached, retry in " + waitSeconds + "s"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "max_tokens", config.getMaxTokens(),
                "system", SYSTEM_PROMPT,
                "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        log.debug("Requesting test data from {} ({} prompt chars, {} requests left)",
                config.getModel(), prompt.length(), probe.getRemainingTokens());

        return webClient.post()
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .map(this::answerText)
                .doOnSuccess(answer -> log.debug("Test data answer received ({} chars)", answer != null ? answer.length() : 0))
                .doOnError(error -> log.warn("Test data request failed: {}", error.getMessage()));
    }

    /**
     * Joins the text blocks of a Messages API response. An answer cut off at the token
     * limit is incomplete JSON, so it counts as a failure.
     */
    @SuppressWarnings("unchecked")
    String answerText(Map<String, Object> response) {
        if ("max_tokens".equals(response.get("stop_reason"))) {
            throw new AiGenerationException("Claude answer truncated at " + config.getMaxTokens() + " tokens");
        }
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        String text = content == null ? "" : content.stream()
                .filter(block -> "text".equals(block.get("type")))
                .map(block -> Objects.toString(block.get("text"), ""))
                .collect(Collectors.joining());
        if (text.isBlank()) {
            throw new AiGenerationException("Claude answer has no text");
        }
        return text;
    }
}
