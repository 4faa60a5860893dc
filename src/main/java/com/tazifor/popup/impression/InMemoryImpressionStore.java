package com.tazifor.popup.impression;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tazifor.popup.model.ImpressionRecord;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class InMemoryImpressionStore implements ImpressionStore {

    private final Cache<String, ImpressionRecord> impressions;

    public InMemoryImpressionStore(Clock clock, Duration ttl, long maximumSize) {
        this.impressions = Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfterWrite(ttl)
            .maximumSize(maximumSize)
            .build();
    }

    @Override
    public boolean recordIfAbsent(ImpressionRecord record) {
        return impressions.asMap().putIfAbsent(record.dedupeKey(), record) == null;
    }
}
