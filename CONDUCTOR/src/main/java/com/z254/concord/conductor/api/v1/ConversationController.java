package com.z254.concord.conductor.api.v1;

import com.z254.concord.conductor.agent.AgentRegistry;
import com.z254.concord.conductor.api.dto.CloseTurnRequest;
import com.z254.concord.conductor.api.dto.CompletionRequest;
import com.z254.concord.conductor.api.dto.CompletionResponse;
import com.z254.concord.conductor.api.dto.ExplainRequest;
import com.z254.concord.conductor.api.dto.ExplainResponse;
import com.z254.concord.conductor.api.dto.PhaseTransitionRequest;
import com.z254.concord.conductor.api.dto.RoutingStatusResponse;
import com.z254.concord.conductor.api.dto.TranscriptResponse;
import com.z254.concord.conductor.conversation.CompletionMode;
import com.z254.concord.conductor.conversation.ConversationStore;
import com.z254.concord.conductor.conversation.TranscriptRenderer;
import com.z254.concord.conductor.delegation.DelegationService;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.PhaseTransition;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.orchestration.ConversationOrchestrator;
import com.z254.concord.conductor.orchestration.OrchestrationContext;
import com.z254.concord.conductor.phase.PhaseStateMachine;
import com.z254.concord.conductor.routing.RoutingEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Operator surface for inspecting and steering conversations. Every mutation goes through
 * the same store, phase and delegation operations the routing loop uses.
 */
@RestController
@RequestMapping("/api/v1/conversations")
@Tag(name = "Conversations", description = "Inspect and steer orchestrated conversations")
@Slf4j
public class ConversationController {

    private final ConversationStore store;
    private final PhaseStateMachine phaseStateMachine;
    private final DelegationService delegationService;
    private final RoutingEngine routingEngine;
    private final ConversationOrchestrator orchestrator;
    private final TranscriptRenderer transcriptRenderer;

    public ConversationController(OrchestrationContext context, ConversationOrchestrator orchestrator,
                                  TranscriptRenderer transcriptRenderer) {
        this.store = context.getStore();
        this.phaseStateMachine = context.getPhaseStateMachine();
        this.delegationService = context.getDelegationService();
        this.routingEngine = context.getRoutingEngine();
        this.orchestrator = orchestrator;
        this.transcriptRenderer = transcriptRenderer;
    }

    @GetMapping
    @Operation(summary = "List conversations")
    @ApiResponse(responseCode = "200", description = "Conversations retrieved",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = Conversation.class))))
    public Flux<Conversation> listConversations() {
        return store.findAll();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get conversation",
            description = "Full conversation record: phase, history, open turn, turn log and transitions")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Conversation found",
                    content = @Content(schema = @Schema(implementation = Conversation.class))),
            @ApiResponse(responseCode = "404", description = "Conversation not found")
    })
    public Mono<ResponseEntity<Conversation>> getConversation(
            @Parameter(description = "Conversation ID") @PathVariable String id) {
        return store.find(id)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/transcript")
    @Operation(summary = "Get routing transcript",
            description = "The turn log rendered exactly as the routing engine receives it")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Transcript rendered",
                    content = @Content(schema = @Schema(implementation = TranscriptResponse.class))),
            @ApiResponse(responseCode = "404", description = "Conversation not found")
    })
    public Mono<ResponseEntity<TranscriptResponse>> getTranscript(
            @Parameter(description = "Conversation ID") @PathVariable String id) {
        return store.find(id)
                .map(conversation -> ResponseEntity.ok(TranscriptResponse.builder()
                        .conversationId(id)
                        .phase(conversation.getPhase())
                        .validTransitions(phaseStateMachine.validTransitions(conversation))
                        .entries(transcriptRenderer.transcript(conversation))
                        .text(transcriptRenderer.render(conversation))
                        .build()))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/turns/current")
    @Operation(summary = "Get open turn")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Open turn",
                    content = @Content(schema = @Schema(implementation = RoutingEntry.class))),
            @ApiResponse(responseCode = "204", description = "No turn is open"),
            @ApiResponse(responseCode = "404", description = "Conversation not found")
    })
    public Mono<ResponseEntity<RoutingEntry>> getCurrentTurn(
            @Parameter(description = "Conversation ID") @PathVariable String id) {
        return store.find(id)
                .map(conversation -> conversation.hasOpenTurn()
                        ? ResponseEntity.ok(conversation.getCurrentTurn())
                        : ResponseEntity.noContent().<RoutingEntry>build())
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/phase")
    @Operation(summary = "Change phase",
            description = "Apply a phase transition. An open turn is closed first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Transition applied",
                    content = @Content(schema = @Schema(implementation = PhaseTransition.class))),
            @ApiResponse(responseCode = "400", description = "Transition not allowed")
    })
    public Mono<PhaseTransition> transition(
            @Parameter(description = "Conversation ID") @PathVariable String id,
            @Valid @RequestBody PhaseTransitionRequest request) {
        log.info("Manual phase transition of {} to {}", id, request.getPhase());
        return phaseStateMachine.transition(id, request.getPhase(), request.getInstructions(),
                request.getInitiatingAgent() != null ? request.getInitiatingAgent() : "operator",
                request.getReason());
    }

    @PostMapping("/{id}/turns/current/close")
    @Operation(summary = "Force-close open turn",
            description = "Close the open turn without waiting for the remaining agents")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Turn closed",
                    content = @Content(schema = @Schema(implementation = RoutingEntry.class))),
            @ApiResponse(responseCode = "204", description = "No turn was open")
    })
    public Mono<ResponseEntity<RoutingEntry>> closeTurn(
            @Parameter(description = "Conversation ID") @PathVariable String id,
            @RequestBody(required = false) CloseTurnRequest request) {
        String reason = request != null && StringUtils.hasText(request.getReason())
                ? request.getReason()
                : "closed by operator";
        return phaseStateMachine.forceCloseTurn(id, reason)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/completions")
    @Operation(summary = "Record completion",
            description = "Record an agent reply by hand. With recordAnyway the reply is kept even"
                    + " when it matches no open turn target; it never reopens a closed turn.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reply recorded",
                    content = @Content(schema = @Schema(implementation = CompletionResponse.class))),
            @ApiResponse(responseCode = "410", description = "Reply matches no open turn")
    })
    public Mono<CompletionResponse> recordCompletion(
            @Parameter(description = "Conversation ID") @PathVariable String id,
            @Valid @RequestBody CompletionRequest request) {
        Completion completion = Completion.builder()
                .agent(AgentRegistry.normalize(request.getAgent()))
                .content(request.getContent())
                .timestamp(Instant.now())
                .build();
        CompletionMode mode = request.isRecordAnyway() ? CompletionMode.RECORD_ANYWAY : CompletionMode.STRICT;
        return delegationService.recordCompletion(id, request.getTurnId(), completion, mode)
                .map(outcome -> CompletionResponse.builder()
                        .conversationId(id)
                        .agent(completion.getAgent())
                        .outcome(outcome)
                        .build());
    }

    @PostMapping("/{id}/explain")
    @Operation(summary = "Ask about routing",
            description = "Free-text diagnostic question answered by the completion service over the transcript")
    public Mono<ResponseEntity<ExplainResponse>> explain(
            @Parameter(description = "Conversation ID") @PathVariable String id,
            @Valid @RequestBody ExplainRequest request) {
        return store.find(id)
                .flatMap(conversation -> routingEngine.explain(conversation, request.getQuestion()))
                .map(answer -> ResponseEntity.ok(ExplainResponse.builder()
                        .conversationId(id)
                        .question(request.getQuestion())
                        .answer(answer)
                        .build()))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/routing")
    @Operation(summary = "Start routing loop")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Loop started"),
            @ApiResponse(responseCode = "409", description = "Loop already running"),
            @ApiResponse(responseCode = "404", description = "Conversation not found")
    })
    public Mono<ResponseEntity<RoutingStatusResponse>> startRouting(
            @Parameter(description = "Conversation ID") @PathVariable String id) {
        return store.find(id)
                .map(conversation -> {
                    boolean started = orchestrator.start(id);
                    RoutingStatusResponse body = status(id, started ? "started" : "already running");
                    return ResponseEntity.status(started ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(body);
                })
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/routing")
    @Operation(summary = "Routing loop status")
    public Mono<RoutingStatusResponse> routingStatus(
            @Parameter(description = "Conversation ID") @PathVariable String id) {
        return Mono.fromSupplier(() -> status(id, null));
    }

    @DeleteMapping("/{id}/routing")
    @Operation(summary = "Stop routing loop",
            description = "Cancel the pending delegation wait and close the open turn")
    public Mono<RoutingStatusResponse> stopRouting(
            @Parameter(description = "Conversation ID") @PathVariable String id,
            @RequestParam(defaultValue = "stopped by operator") String reason) {
        return orchestrator.stop(id, reason)
                .map(wasRunning -> status(id, wasRunning ? "stopped" : "not running"));
    }

    private RoutingStatusResponse status(String id, String message) {
        return RoutingStatusResponse.builder()
                .conversationId(id)
                .running(orchestrator.isRunning(id))
                .waiting(delegationService.isWaiting(id))
                .message(message)
                .build();
    }
}
