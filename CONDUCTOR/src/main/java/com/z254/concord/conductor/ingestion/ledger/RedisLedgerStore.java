package com.z254.concord.conductor.ingestion.ledger;

import com.z254.concord.conductor.config.ConductorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Ledger segments as Redis sets, one per day, plus an index set of segment keys.
 */
@Component
@ConditionalOnProperty(prefix = "concord.ledger", name = "store", havingValue = "redis")
@Slf4j
public class RedisLedgerStore implements LedgerStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisLedgerStore(
            @Qualifier("ledgerRedisTemplate") ReactiveRedisTemplate<String, String> redisTemplate,
            ConductorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getLedger().getRedisKeyPrefix();
    }

    @Override
    public Flux<String> loadAll() {
        return redisTemplate.opsForSet()
                .members(indexKey())
                .concatMap(segment -> redisTemplate.opsForSet().members(segment));
    }

    @Override
    public Mono<Void> append(LocalDate day, Collection<String> eventIds) {
        if (eventIds.isEmpty()) {
            return Mono.empty();
        }
        String segment = segmentKey(day);
        return redisTemplate.opsForSet()
                .add(segment, eventIds.toArray(String[]::new))
                .then(redisTemplate.opsForSet().add(indexKey(), segment))
                .doOnSuccess(added -> log.debug("Appended {} ids to {}", eventIds.size(), segment))
                .then();
    }

    @Override
    public Mono<Void> clear() {
        return redisTemplate.opsForSet()
                .members(indexKey())
                .concatWithValues(indexKey())
                .collectList()
                .flatMap(keys -> redisTemplate.delete(keys.toArray(String[]::new)))
                .doOnSuccess(removed -> log.info("Cleared {} ledger keys", removed))
                .then();
    }

    @Override
    public String describe() {
        return "redis:" + keyPrefix;
    }

    String segmentKey(LocalDate day) {
        return keyPrefix + day;
    }

    String indexKey() {
        return keyPrefix + "segments";
    }
}
