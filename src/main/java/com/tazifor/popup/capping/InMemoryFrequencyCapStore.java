package com.tazifor.popup.capping;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.tazifor.popup.model.FrequencyCapConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory frequency cap store for single-node deployments and tests.
 *
 * ATOMICITY: every check-and-reserve runs inside {@code ConcurrentMap.compute}
 * for the visitor's {@link VisitorCaps}, so a campaign's counters and the
 * visitor's global counters change together, and two requests for the same
 * visitor serialize on that visitor only.
 *
 * EXPIRY: each entry lives until the longest live window of the visitor ends.
 * Caffeine reads time from the injected clock, so tests can move time forward.
 *
 * SIZE BOUND: {@code maximumVisitors} caps the number of visitors held. When it
 * is reached Caffeine evicts whole visitors before their windows end, and their
 * counts restart from zero. Every such eviction is logged at WARN; size the bound
 * above the number of visitors active within a month.
 */
@Slf4j
public class InMemoryFrequencyCapStore implements FrequencyCapStore {

    private final Clock clock;
    private final Duration sessionTtl;
    private final Cache<String, VisitorCaps> visitors;

    public InMemoryFrequencyCapStore(Clock clock, Duration sessionTtl, long maximumVisitors) {
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.visitors = Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .maximumSize(maximumVisitors)
            .evictionListener((String visitorId, VisitorCaps caps, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.warn("Cap counters of visitor {} evicted before expiry, raise popup.memory-max-entries",
                        visitorId);
                }
            })
            .expireAfter(new Expiry<String, VisitorCaps>() {
                @Override
                public long expireAfterCreate(String key, VisitorCaps value, long currentTime) {
                    return value.timeToLive(clock.instant()).toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, VisitorCaps value, long currentTime, long currentDuration) {
                    return value.timeToLive(clock.instant()).toNanos();
                }

                @Override
                public long expireAfterRead(String key, VisitorCaps value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public CapDecision checkAndReserve(String capKey, String visitorId, String sessionId,
                                       String fireId, FrequencyCapConfig cfg) {
        Instant now = clock.instant();
        AtomicReference<CapDecision> outcome = new AtomicReference<>();

        visitors.asMap().compute(visitorId, (key, current) -> {
            VisitorCaps state = current != null ? current : VisitorCaps.EMPTY;
            VisitorCaps.Reservation reservation = state.reserve(capKey, sessionId, fireId, cfg, now, sessionTtl);
            outcome.set(reservation.getDecision());
            return reservation.isWrite() ? reservation.getNext() : current;
        });

        return outcome.get();
    }

    @Override
    public CapDecision check(String capKey, String visitorId, String sessionId, FrequencyCapConfig cfg) {
        VisitorCaps state = visitors.getIfPresent(visitorId);
        if (state == null) {
            return CapDecision.allowed();
        }
        return state.reserve(capKey, sessionId, null, cfg, clock.instant(), sessionTtl).getDecision();
    }

    /**
     * Visitors currently held, after pending maintenance.
     */
    long visitorCount() {
        visitors.cleanUp();
        return visitors.estimatedSize();
    }
}
