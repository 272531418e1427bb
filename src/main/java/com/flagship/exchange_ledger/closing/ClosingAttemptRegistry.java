package com.flagship.exchange_ledger.closing;

import com.flagship.exchange_ledger.exception.ConcurrencyConflictException;
import com.flagship.exchange_ledger.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of closing attempts that have not been submitted yet.
 *
 * Nothing here is persisted: a restart drops open attempts and the operator
 * starts the closing again. Attempts idle longer than the TTL are evicted.
 */
@Component
@Slf4j
public class ClosingAttemptRegistry implements SmartLifecycle {

    private final Map<UUID, ClosingAttempt> attempts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration attemptTtl;
    private volatile boolean running;

    public ClosingAttemptRegistry(Clock clock,
                                  @Value("${exchange.closing.attempt-ttl:PT12H}") Duration attemptTtl) {
        this.clock = clock;
        this.attemptTtl = attemptTtl;
    }

    public void register(ClosingAttempt attempt) {
        attempts.put(attempt.getId(), attempt);
    }

    /**
     * @throws NotFoundException if the attempt is unknown or has been evicted
     */
    public ClosingAttempt require(UUID attemptId) {
        ClosingAttempt attempt = attempts.get(attemptId);
        if (attempt == null) {
            throw new NotFoundException("Closing attempt not found or expired: " + attemptId);
        }
        return attempt;
    }

    /**
     * Swaps {@code current} for {@code next} only if no other request changed the attempt in between.
     *
     * @throws ConcurrencyConflictException if the attempt changed concurrently
     */
    public void transition(ClosingAttempt current, ClosingAttempt next) {
        if (!attempts.replace(current.getId(), current, next)) {
            throw new ConcurrencyConflictException(
                "Closing attempt " + current.getId() + " was changed by a concurrent request, please reload it", null);
        }
    }

    /**
     * Removes attempts idle for longer than the TTL, submitted ones included.
     *
     * @return number of attempts removed
     */
    @Scheduled(fixedDelayString = "${exchange.closing.eviction-interval:600000}")
    public int evictExpired() {
        if (!running) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(attemptTtl);
        int before = attempts.size();
        attempts.values().removeIf(attempt -> attempt.getUpdatedAt().isBefore(cutoff));
        int evicted = before - attempts.size();
        if (evicted > 0) {
            log.info("Evicted {} idle closing attempts", evicted);
        }
        return evicted;
    }

    public int size() {
        return attempts.size();
    }

    @Override
    public void start() {
        running = true;
        log.info("Closing attempt registry started: ttl={}", attemptTtl);
    }

    @Override
    public void stop() {
        running = false;
        int open = attempts.size();
        attempts.clear();
        if (open > 0) {
            log.warn("Closing attempt registry stopped with {} open attempts discarded", open);
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
