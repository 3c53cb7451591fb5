package com.z254.concord.conductor.routing;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.conversation.TranscriptEntry;
import com.z254.concord.conductor.conversation.TranscriptRenderer;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.RoutingDecision;
import com.z254.concord.conductor.exception.ValidationException;
import com.z254.concord.conductor.llm.CompletionService;
import com.z254.concord.conductor.llm.LLMRequest;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the next routing decision for a conversation.
 *
 * <p>The turn log is rendered as a transcript and sent with the routing instructions to the
 * completion service in JSON mode. An answer that cannot be parsed, or that names an unknown
 * agent, fails the call with {@link ValidationException}; there is no retry here. The engine
 * never applies the decision it returns.
 */
@Service
@Slf4j
public class RoutingEngine {

    private final CompletionService completionService;
    private final TranscriptRenderer transcriptRenderer;
    private final RoutingPromptBuilder promptBuilder;
    private final RoutingDecisionParser parser;
    private final StructuredLogger structuredLogger;
    private final ConductorProperties.RoutingProperties config;
    private final Timer decisionTimer;
    private final Counter malformedCounter;

    public RoutingEngine(
            CompletionService completionService,
            TranscriptRenderer transcriptRenderer,
            RoutingPromptBuilder promptBuilder,
            RoutingDecisionParser parser,
            StructuredLogger structuredLogger,
            ConductorProperties properties,
            MeterRegistry meterRegistry) {
        this.completionService = completionService;
        this.transcriptRenderer = transcriptRenderer;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.structuredLogger = structuredLogger;
        this.config = properties.getRouting();
        this.decisionTimer = Timer.builder("concord.routing.decision.latency").register(meterRegistry);
        this.malformedCounter = Counter.builder("concord.routing.decisions.malformed").register(meterRegistry);
    }

    public Mono<RoutingDecision> decide(Conversation conversation) {
        LLMRequest request = LLMRequest.builder()
                .model(config.getModel())
                .messages(messages(promptBuilder.routingInstructions(conversation), conversation))
                .temperature(config.getTemperature())
                .responseFormat(LLMRequest.ResponseFormat.JSON_OBJECT)
                .build();

        Timer.Sample sample = Timer.start();
        return completionService.complete(request)
                .map(response -> parser.parse(response.getContent()))
                .doOnNext(decision -> {
                    sample.stop(decisionTimer);
                    structuredLogger.logRoutingDecision(conversation.getId(), conversation.getPhase(), decision);
                })
                .doOnError(ValidationException.class, e -> {
                    malformedCounter.increment();
                    log.warn("Malformed routing decision for {}: {}", conversation.getId(), e.getMessage());
                });
    }

    /**
     * Ask a free-text question about the conversation's routing history.
     */
    public Mono<String> explain(Conversation conversation, String question) {
        List<LLMRequest.Message> messages = messages(promptBuilder.diagnosticInstructions(conversation), conversation);
        messages.add(LLMRequest.userMessage(question));
        LLMRequest request = LLMRequest.builder()
                .model(config.getModel())
                .messages(messages)
                .responseFormat(LLMRequest.ResponseFormat.TEXT)
                .build();
        return completionService.complete(request)
                .map(response -> response.getContent() != null ? response.getContent() : "");
    }

    private List<LLMRequest.Message> messages(String instructions, Conversation conversation) {
        List<LLMRequest.Message> messages = new ArrayList<>();
        messages.add(LLMRequest.systemMessage(instructions));
        for (TranscriptEntry entry : transcriptRenderer.transcript(conversation)) {
            messages.add(LLMRequest.message(entry.role(), entry.content()));
        }
        return messages;
    }
}
