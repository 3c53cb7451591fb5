package com.z254.concord.conductor.api.v1;

import com.z254.concord.conductor.ConductorTestFixtures;
import com.z254.concord.conductor.api.dto.LedgerStatusResponse;
import com.z254.concord.conductor.ingestion.ledger.FileLedgerStore;
import com.z254.concord.conductor.ingestion.ledger.ProcessedEventLedger;
import com.z254.concord.conductor.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for LedgerController.
 */
class LedgerControllerTest {

    private static final String BASE = "/api/v1/ledger";

    @TempDir
    Path directory;

    private ProcessedEventLedger ledger;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ledger = new ProcessedEventLedger(new FileLedgerStore(directory),
                new StructuredLogger(ConductorTestFixtures.objectMapper()), new SimpleMeterRegistry());
        client = WebTestClient.bindToController(new LedgerController(ledger)).build();
        ledger.tryAccept("evt-1");
        ledger.tryAccept("evt-2");
    }

    @Test
    void shouldReportBufferedIds() {
        client.get().uri(BASE)
                .exchange()
                .expectStatus().isOk()
                .expectBody(LedgerStatusResponse.class)
                .value(status -> {
                    assertThat(status.getSize()).isEqualTo(2);
                    assertThat(status.getPending()).isEqualTo(2);
                    assertThat(status.getFlushed()).isNull();
                });
    }

    @Test
    void shouldFlushOnRequest() {
        client.post().uri(BASE + "/flush")
                .exchange()
                .expectStatus().isOk()
                .expectBody(LedgerStatusResponse.class)
                .value(status -> {
                    assertThat(status.getFlushed()).isEqualTo(2);
                    assertThat(status.getPending()).isZero();
                    assertThat(status.getLastFlushFailure()).isNull();
                });
    }

    @Test
    void shouldForgetEverythingOnClear() {
        client.delete().uri(BASE)
                .exchange()
                .expectStatus().isOk()
                .expectBody(LedgerStatusResponse.class)
                .value(status -> assertThat(status.getSize()).isZero());

        assertThat(ledger.tryAccept("evt-1")).isTrue();
    }
}
