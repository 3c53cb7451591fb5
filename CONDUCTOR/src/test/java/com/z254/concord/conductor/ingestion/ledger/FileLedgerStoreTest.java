package com.z254.concord.conductor.ingestion.ledger;

import com.z254.concord.conductor.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FileLedgerStore.
 */
class FileLedgerStoreTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 5, 13);
    private static final LocalDate TUESDAY = LocalDate.of(2024, 5, 14);

    @TempDir
    Path directory;

    private FileLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new FileLedgerStore(directory.resolve("ledger"));
    }

    @Test
    void shouldAppendOneIdPerLineToTheDaySegment() throws IOException {
        // When
        store.append(TUESDAY, List.of("evt-1", "evt-2")).block();
        store.append(TUESDAY, List.of("evt-3")).block();

        // Then
        Path segment = store.segmentFor(TUESDAY);
        assertThat(segment.getFileName().toString()).isEqualTo("processed-events-2024-05-14.log");
        assertThat(Files.readAllLines(segment, StandardCharsets.UTF_8)).containsExactly("evt-1", "evt-2", "evt-3");
    }

    @Test
    void shouldLoadEverySegment() throws IOException {
        // Given
        store.append(MONDAY, List.of("evt-1", "evt-2")).block();
        store.append(TUESDAY, List.of("evt-3")).block();
        Files.writeString(directory.resolve("ledger").resolve("notes.txt"), "not-an-id\n");

        // When / Then
        StepVerifier.create(store.loadAll().collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("evt-1", "evt-2", "evt-3"))
                .verifyComplete();
    }

    @Test
    void shouldSkipBlankLines() throws IOException {
        Path ledger = Files.createDirectories(directory.resolve("ledger"));
        Files.writeString(ledger.resolve("processed-events-2024-05-13.log"), "evt-1\n\n  \nevt-2\n");

        StepVerifier.create(store.loadAll().collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("evt-1", "evt-2"))
                .verifyComplete();
    }

    @Test
    void shouldLoadNothingFromMissingDirectory() {
        StepVerifier.create(store.loadAll())
                .verifyComplete();
    }

    @Test
    void shouldClearSegmentsOnly() throws IOException {
        store.append(MONDAY, List.of("evt-1")).block();
        Path notes = directory.resolve("ledger").resolve("notes.txt");
        Files.writeString(notes, "keep me");

        store.clear().block();

        assertThat(Files.exists(store.segmentFor(MONDAY))).isFalse();
        assertThat(Files.exists(notes)).isTrue();
    }

    @Test
    void shouldReportUnwritableDirectory() throws IOException {
        Path blocked = directory.resolve("blocked");
        Files.writeString(blocked, "a file where the directory should be");
        FileLedgerStore broken = new FileLedgerStore(blocked);

        StepVerifier.create(broken.append(TUESDAY, List.of("evt-1")))
                .expectError(PersistenceException.class)
                .verify();
    }
}
