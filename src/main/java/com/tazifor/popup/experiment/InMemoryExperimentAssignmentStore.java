package com.tazifor.popup.experiment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public class InMemoryExperimentAssignmentStore implements ExperimentAssignmentStore {

    private final Cache<String, String> assignments;

    public InMemoryExperimentAssignmentStore(Clock clock, Duration ttl, long maximumSize) {
        this.assignments = Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfterWrite(ttl)
            .maximumSize(maximumSize)
            .build();
    }

    @Override
    public Optional<String> find(String experimentId, String visitorId) {
        return Optional.ofNullable(assignments.getIfPresent(keyOf(experimentId, visitorId)));
    }

    @Override
    public String putIfAbsent(String experimentId, String visitorId, String variantKey) {
        String existing = assignments.asMap().putIfAbsent(keyOf(experimentId, visitorId), variantKey);
        return existing != null ? existing : variantKey;
    }

    private static String keyOf(String experimentId, String visitorId) {
        return visitorId + "|" + experimentId;
    }
}
