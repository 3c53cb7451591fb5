package com.z254.concord.conductor.api.v1;

import com.z254.concord.conductor.api.dto.LedgerStatusResponse;
import com.z254.concord.conductor.ingestion.ledger.ProcessedEventLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Administration of the processed-event ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@Tag(name = "Ledger", description = "Processed-event ledger administration")
@Slf4j
public class LedgerController {

    private final ProcessedEventLedger ledger;

    public LedgerController(ProcessedEventLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping
    @Operation(summary = "Ledger status")
    public Mono<LedgerStatusResponse> status() {
        return Mono.fromSupplier(() -> status(null));
    }

    @PostMapping("/flush")
    @Operation(summary = "Flush buffered ids now")
    public Mono<LedgerStatusResponse> flush() {
        return ledger.flush().map(this::status);
    }

    @DeleteMapping
    @Operation(summary = "Clear the ledger",
            description = "Forget every processed event id. Events replayed afterwards are handled again.")
    public Mono<LedgerStatusResponse> clear() {
        log.warn("Clearing processed event ledger on operator request");
        return ledger.clear().then(Mono.fromSupplier(() -> status(null)));
    }

    private LedgerStatusResponse status(Integer flushed) {
        return LedgerStatusResponse.builder()
                .size(ledger.size())
                .pending(ledger.pendingCount())
                .flushed(flushed)
                .lastFlushFailure(ledger.lastFlushFailure().orElse(null))
                .build();
    }
}
