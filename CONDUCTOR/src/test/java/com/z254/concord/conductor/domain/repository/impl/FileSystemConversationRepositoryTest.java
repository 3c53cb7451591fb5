package com.z254.concord.conductor.domain.repository.impl;

import com.z254.concord.conductor.ConductorTestFixtures;
import com.z254.concord.conductor.domain.model.Completion;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.model.RoutingEntry;
import com.z254.concord.conductor.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FileSystemConversationRepository")
class FileSystemConversationRepositoryTest {

    @TempDir
    Path directory;

    private FileSystemConversationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileSystemConversationRepository(directory, ConductorTestFixtures.objectMapper());
    }

    private static Conversation conversation(String id, long revision, String title) {
        Instant now = Instant.parse("2024-05-14T10:00:00Z");
        Conversation conversation = Conversation.builder()
                .id(id)
                .title(title)
                .phase("PLAN")
                .originalRequest("Add rate limiting")
                .revision(revision)
                .createdAt(now)
                .updatedAt(now)
                .build();
        List<Completion> completions = new ArrayList<>();
        completions.add(Completion.builder().agent("planner").content("1. bucket").timestamp(now).build());
        conversation.openTurn(RoutingEntry.builder()
                .turnId("turn-1")
                .createdAt(now)
                .phase("PLAN")
                .agents(List.of("planner", "a"))
                .completions(completions)
                .reason("need a plan")
                .initiator("orchestrator")
                .build(), now);
        return conversation;
    }

    @Test
    @DisplayName("a saved record reads back with its open turn")
    void roundTrip() {
        StepVerifier.create(repository.save(conversation("conv-1", 1, "Rate limits"))
                        .then(repository.findById("conv-1")))
                .assertNext(found -> {
                    assertThat(found.getTitle()).isEqualTo("Rate limits");
                    assertThat(found.getPhase()).isEqualTo("PLAN");
                    assertThat(found.hasOpenTurn()).isTrue();
                    assertThat(found.getCurrentTurn().pendingAgents()).containsExactly("a");
                    assertThat(found.getCurrentTurn().getCompletions()).extracting(Completion::getAgent)
                            .containsExactly("planner");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("a write older than the stored revision is skipped")
    void staleWrite() {
        repository.save(conversation("conv-1", 5, "newer")).block();
        repository.save(conversation("conv-1", 4, "older")).block();

        assertThat(repository.findById("conv-1").block().getTitle()).isEqualTo("newer");
    }

    @Test
    @DisplayName("records survive a new repository instance")
    void survivesRestart() {
        repository.save(conversation("conv-1", 1, "first")).block();
        repository.save(conversation("conv/2", 1, "second")).block();

        FileSystemConversationRepository reopened =
                new FileSystemConversationRepository(directory, ConductorTestFixtures.objectMapper());

        StepVerifier.create(reopened.findAll().map(Conversation::getTitle).collectList())
                .assertNext(titles -> assertThat(titles).containsExactlyInAnyOrder("first", "second"))
                .verifyComplete();
        assertThat(reopened.existsById("conv/2").block()).isTrue();
    }

    @Test
    @DisplayName("delete removes the record")
    void delete() {
        repository.save(conversation("conv-1", 1, "first")).block();

        StepVerifier.create(repository.deleteById("conv-1").then(repository.existsById("conv-1")))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(repository.findById("conv-1")).verifyComplete();
    }

    @Test
    @DisplayName("an unreadable record is a persistence error")
    void corruptRecord() throws IOException {
        Files.writeString(directory.resolve("broken.json"), "{not json");

        StepVerifier.create(repository.findById("broken"))
                .expectError(PersistenceException.class)
                .verify();
    }
}
