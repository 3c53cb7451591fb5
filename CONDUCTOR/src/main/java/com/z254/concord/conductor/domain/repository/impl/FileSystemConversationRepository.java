package com.z254.concord.conductor.domain.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.domain.model.Conversation;
import com.z254.concord.conductor.domain.repository.ConversationRepository;
import com.z254.concord.conductor.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link ConversationRepository} keeping one JSON document per conversation on disk.
 * Documents are written to a temporary file and moved into place.
 */
@Repository
@ConditionalOnProperty(prefix = "concord.store", name = "type", havingValue = "file", matchIfMissing = true)
@Slf4j
public class FileSystemConversationRepository implements ConversationRepository {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    // Highest revision written per conversation
    private final Map<String, Long> writtenRevisions = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemConversationRepository(ConductorProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getStore().getDirectory()), objectMapper);
    }

    public FileSystemConversationRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        log.info("Conversation records stored under {}", directory.toAbsolutePath());
    }

    @Override
    public Mono<Conversation> save(Conversation conversation) {
        return Mono.fromCallable(() -> {
                    writtenRevisions.compute(conversation.getId(), (id, written) -> {
                        if (written != null && written > conversation.getRevision()) {
                            log.debug("Skipping stale write of conversation {} (revision {} < {})",
                                    id, conversation.getRevision(), written);
                            return written;
                        }
                        write(conversation);
                        return conversation.getRevision();
                    });
                    return conversation;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Conversation> findById(String id) {
        return Mono.fromCallable(() -> {
                    Path file = fileFor(id);
                    return Files.exists(file) ? read(file) : null;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<Conversation> findAll() {
        return Mono.fromCallable(this::listFiles)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(files -> files)
                .map(this::read);
    }

    @Override
    public Mono<Void> deleteById(String id) {
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        Files.deleteIfExists(fileFor(id));
                        writtenRevisions.remove(id);
                    } catch (IOException e) {
                        throw new PersistenceException("Failed to delete conversation " + id, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> existsById(String id) {
        return Mono.fromCallable(() -> Files.exists(fileFor(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void write(Conversation conversation) {
        Path target = fileFor(conversation.getId());
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "conversation-", ".tmp");
            objectMapper.writeValue(temp.toFile(), conversation);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write conversation " + conversation.getId(), e);
        }
    }

    private Conversation read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Conversation.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read conversation record " + file.getFileName(), e);
        }
    }

    private List<Path> listFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(file -> file.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        }
    }

    private Path fileFor(String id) {
        return directory.resolve(id.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX);
    }
}
