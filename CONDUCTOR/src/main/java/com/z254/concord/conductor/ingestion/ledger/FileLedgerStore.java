package com.z254.concord.conductor.ingestion.ledger;

import com.z254.concord.conductor.config.ConductorProperties;
import com.z254.concord.conductor.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Ledger segments as plain text files, one event id per line:
 * {@code processed-events-YYYY-MM-DD.log}.
 */
@Component
@ConditionalOnProperty(prefix = "concord.ledger", name = "store", havingValue = "file", matchIfMissing = true)
@Slf4j
public class FileLedgerStore implements LedgerStore {

    static final String PREFIX = "processed-events-";
    static final String SUFFIX = ".log";
    private static final Pattern SEGMENT = Pattern.compile("processed-events-\\d{4}-\\d{2}-\\d{2}\\.log");

    private final Path directory;

    @Autowired
    public FileLedgerStore(ConductorProperties properties) {
        this(Paths.get(properties.getLedger().getDirectory()));
    }

    public FileLedgerStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Flux<String> loadAll() {
        return Mono.fromCallable(this::readAll)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapIterable(ids -> ids);
    }

    @Override
    public Mono<Void> append(LocalDate day, Collection<String> eventIds) {
        return Mono.<Void>fromRunnable(() -> {
                    Path segment = segmentFor(day);
                    try {
                        Files.createDirectories(directory);
                        Files.write(segment, eventIds, StandardCharsets.UTF_8,
                                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                    } catch (IOException e) {
                        throw new PersistenceException("Failed to append to ledger segment " + segment.getFileName(), e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> clear() {
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        for (Path segment : segments()) {
                            Files.deleteIfExists(segment);
                        }
                    } catch (IOException e) {
                        throw new PersistenceException("Failed to clear ledger under " + directory, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String describe() {
        return "file:" + directory.toAbsolutePath();
    }

    Path segmentFor(LocalDate day) {
        return directory.resolve(PREFIX + day + SUFFIX);
    }

    private List<String> readAll() {
        List<String> ids = new ArrayList<>();
        try {
            for (Path segment : segments()) {
                for (String line : Files.readAllLines(segment, StandardCharsets.UTF_8)) {
                    String id = line.trim();
                    if (!id.isEmpty()) {
                        ids.add(id);
                    }
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to read ledger under " + directory, e);
        }
        return ids;
    }

    private List<Path> segments() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(file -> SEGMENT.matcher(file.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        }
    }
}
