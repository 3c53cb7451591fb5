package com.z254.concord.conductor.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.exception.TransportException;
import com.z254.concord.conductor.llm.CompletionService;
import com.z254.concord.conductor.llm.LLMRequest;
import com.z254.concord.conductor.llm.LLMResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion service backed by an OpenAI-compatible chat completions endpoint.
 */
@Component
@Slf4j
public class OpenAICompletionService implements CompletionService {

    private static final String PROVIDER_ID = "openai";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final ConductorProperties.LLMProperties.OpenAIProperties config;
    private final Timer callTimer;
    private final Counter callCounter;
    private final Counter errorCounter;

    @Autowired
    public OpenAICompletionService(ConductorProperties properties, MeterRegistry meterRegistry) {
        this(properties, meterRegistry, WebClient.builder());
    }

    OpenAICompletionService(ConductorProperties properties, MeterRegistry meterRegistry,
                            WebClient.Builder builder) {
        this.config = properties.getLlm().getOpenai();

        builder.baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        } else {
            log.warn("No API key configured for the {} completion service", PROVIDER_ID);
        }
        this.webClient = builder.build();

        this.callTimer = Timer.builder("concord.llm.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.callCounter = Counter.builder("concord.llm.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.errorCounter = Counter.builder("concord.llm.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getDefaultModel() {
        return config.getModel();
    }

    @Override
    @CircuitBreaker(name = "completion")
    public Mono<LLMResponse> complete(LLMRequest request) {
        return Mono.defer(() -> {
            callCounter.increment();
            long startTime = System.currentTimeMillis();

            return webClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .bodyValue(buildRequestBody(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(config.getTimeout())
                    .switchIfEmpty(Mono.error(() ->
                            new TransportException(PROVIDER_ID + " returned an empty response body")))
                    .map(json -> parseResponse(json, startTime))
                    .doOnNext(response -> {
                        callTimer.record(Duration.ofMillis(response.getLatencyMs()));
                        log.debug("Completion from {}: {}ms, {} tokens", PROVIDER_ID,
                                response.getLatencyMs(), response.getTotalTokens());
                    })
                    .doOnError(e -> {
                        errorCounter.increment();
                        log.error("Completion error from {}: {}", PROVIDER_ID, e.getMessage());
                    });
        });
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", request.getModel() != null ? request.getModel() : config.getModel());

        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(message -> Map.<String, Object>of(
                        "role", message.getRole(),
                        "content", message.getContent() != null ? message.getContent() : ""))
                .toList();
        body.put("messages", messages);

        body.put("temperature", request.getTemperature() != null ? request.getTemperature() : config.getTemperature());
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens());

        if (request.getResponseFormat() == LLMRequest.ResponseFormat.JSON_OBJECT) {
            body.put("response_format", Map.of("type", request.getResponseFormat().getWireName()));
        }
        return body;
    }

    LLMResponse parseResponse(JsonNode json, long startTime) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode message = choice.path("message");
        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        JsonNode usage = json.path("usage");
        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.path("model").asText(null))
                .providerId(PROVIDER_ID)
                .content(content)
                .finishReason(mapFinishReason(choice.path("finish_reason").asText("stop")))
                .inputTokens(usage.path("prompt_tokens").asInt(0))
                .outputTokens(usage.path("completion_tokens").asInt(0))
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private LLMResponse.FinishReason mapFinishReason(String reason) {
        return switch (reason) {
            case "length" -> LLMResponse.FinishReason.LENGTH;
            case "content_filter" -> LLMResponse.FinishReason.CONTENT_FILTER;
            case "stop" -> LLMResponse.FinishReason.STOP;
            default -> LLMResponse.FinishReason.ERROR;
        };
    }
}
