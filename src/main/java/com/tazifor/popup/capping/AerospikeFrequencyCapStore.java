package com.tazifor.popup.capping;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.model.FrequencyCapConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * AerospikeFrequencyCapStore - atomic impression capping
 *
 * THE PROBLEM:
 * A visitor with two open tabs can fire the same popup twice within a few
 * milliseconds. With maxPerSession = 1 both requests read count = 0, both pass
 * the check, and the visitor sees the popup twice.
 *
 * THE SOLUTION:
 * Optimistic read-modify-write on one record per visitor:
 * 1. Read the record and its generation
 * 2. Evaluate limits locally
 * 3. Write back with EXPECT_GEN_EQUAL (or CREATE_ONLY for a new record)
 * 4. If another writer got there first, the server rejects the write and we
 *    re-read and re-evaluate
 *
 * Only one of the two racing requests can take the last slot. The loser re-reads
 * the updated counters and is Denied. The campaign's counters and the visitor's
 * global counters live in the same record, so both change in one write.
 *
 * RECORD LAYOUT (set "caps", key = visitorId):
 *   caps - map of cap key (or "global") to its counters:
 *     sid  - session the session count belongs to
 *     sc   - session count
 *     sexp - session window end (epoch millis)
 *     hr/hc, day/dc, wk/wc, mo/mc - window id and count per calendar window
 *     cool - cooldown end (epoch millis)
 *     last - last shown (epoch millis)
 *     fire - fireIds of the most recent reservations
 *
 * TTL: the record expires when the longest live window of any cap key ends.
 */
@Slf4j
public class AerospikeFrequencyCapStore implements FrequencyCapStore {

    static final String CAP_SET = "caps";
    static final String CAPS_BIN = "caps";

    private final IAerospikeClient client;
    private final WritePolicy capWritePolicy;
    private final String namespace;
    private final Clock clock;
    private final Duration sessionTtl;
    private final int maxRetries;

    public AerospikeFrequencyCapStore(IAerospikeClient client,
                                      WritePolicy capWritePolicy,
                                      String namespace,
                                      Clock clock,
                                      Duration sessionTtl,
                                      int maxRetries) {
        this.client = client;
        this.capWritePolicy = capWritePolicy;
        this.namespace = namespace;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.maxRetries = Math.max(1, maxRetries);
    }

    @Override
    public CapDecision checkAndReserve(String capKey, String visitorId, String sessionId,
                                       String fireId, FrequencyCapConfig cfg) {
        Key key = keyOf(visitorId);

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Instant now = clock.instant();
            Record record = read(key);
            VisitorCaps.Reservation reservation = toVisitorCaps(record)
                .reserve(capKey, sessionId, fireId, cfg, now, sessionTtl);
            if (!reservation.isWrite()) {
                return reservation.getDecision();
            }

            VisitorCaps next = reservation.getNext();
            WritePolicy policy = new WritePolicy(capWritePolicy);
            policy.expiration = (int) Math.min(Integer.MAX_VALUE, next.timeToLive(now).toSeconds());
            if (record == null) {
                policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
            } else {
                policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                policy.generation = record.generation;
            }

            try {
                client.put(policy, key, toBin(next));
                return reservation.getDecision();
            } catch (AerospikeException e) {
                if (!isLostRace(e)) {
                    throw new TransientStoreException("Cap store write failed for " + capKey, e);
                }
                log.debug("Cap record for {} changed concurrently, attempt {}/{}", capKey, attempt, maxRetries);
            }
        }

        throw new TransientStoreException("Cap store contention for " + capKey
            + " after " + maxRetries + " attempts");
    }

    @Override
    public CapDecision check(String capKey, String visitorId, String sessionId, FrequencyCapConfig cfg) {
        return toVisitorCaps(read(keyOf(visitorId)))
            .reserve(capKey, sessionId, null, cfg, clock.instant(), sessionTtl)
            .getDecision();
    }

    private Record read(Key key) {
        try {
            return client.get(null, key);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Cap store read failed", e);
        }
    }

    private Key keyOf(String visitorId) {
        return new Key(namespace, CAP_SET, visitorId);
    }

    private static boolean isLostRace(AerospikeException e) {
        return e.getResultCode() == ResultCode.GENERATION_ERROR
            || e.getResultCode() == ResultCode.KEY_EXISTS_ERROR;
    }

    // ===== Record mapping =====

    static VisitorCaps toVisitorCaps(Record record) {
        if (record == null || record.getMap(CAPS_BIN) == null) {
            return VisitorCaps.EMPTY;
        }
        Map<String, CapCounters> counters = new HashMap<>();
        record.getMap(CAPS_BIN).forEach((capKey, value) -> {
            if (value instanceof Map<?, ?> fields) {
                counters.put(String.valueOf(capKey), toCounters(fields));
            }
        });
        return new VisitorCaps(Map.copyOf(counters));
    }

    static Bin toBin(VisitorCaps caps) {
        Map<String, Object> byKey = new HashMap<>();
        caps.getCounters().forEach((capKey, counters) -> byKey.put(capKey, toFields(counters)));
        return new Bin(CAPS_BIN, byKey);
    }

    static CapCounters toCounters(Map<?, ?> fields) {
        return CapCounters.builder()
            .sessionId(text(fields, "sid"))
            .sessionCount(number(fields, "sc"))
            .sessionExpiresAt(number(fields, "sexp"))
            .hour(text(fields, "hr"))
            .hourCount(number(fields, "hc"))
            .day(text(fields, "day"))
            .dayCount(number(fields, "dc"))
            .week(text(fields, "wk"))
            .weekCount(number(fields, "wc"))
            .month(text(fields, "mo"))
            .monthCount(number(fields, "mc"))
            .cooldownUntil(number(fields, "cool"))
            .lastShownAt(number(fields, "last"))
            .recentFireIds(fireIds(fields.get("fire")))
            .build();
    }

    static Map<String, Object> toFields(CapCounters counters) {
        Map<String, Object> fields = new HashMap<>();
        putIfPresent(fields, "sid", counters.getSessionId());
        fields.put("sc", counters.getSessionCount());
        fields.put("sexp", counters.getSessionExpiresAt());
        putIfPresent(fields, "hr", counters.getHour());
        fields.put("hc", counters.getHourCount());
        putIfPresent(fields, "day", counters.getDay());
        fields.put("dc", counters.getDayCount());
        putIfPresent(fields, "wk", counters.getWeek());
        fields.put("wc", counters.getWeekCount());
        putIfPresent(fields, "mo", counters.getMonth());
        fields.put("mc", counters.getMonthCount());
        fields.put("cool", counters.getCooldownUntil());
        fields.put("last", counters.getLastShownAt());
        fields.put("fire", counters.getRecentFireIds() != null ? counters.getRecentFireIds() : List.of());
        return fields;
    }

    private static void putIfPresent(Map<String, Object> fields, String name, String value) {
        if (value != null) {
            fields.put(name, value);
        }
    }

    private static String text(Map<?, ?> fields, String name) {
        Object value = fields.get(name);
        return value != null ? value.toString() : null;
    }

    private static long number(Map<?, ?> fields, String name) {
        return fields.get(name) instanceof Number value ? value.longValue() : 0L;
    }

    private static List<String> fireIds(Object value) {
        List<String> fires = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.forEach(fire -> fires.add(String.valueOf(fire)));
        }
        return List.copyOf(fires);
    }
}
