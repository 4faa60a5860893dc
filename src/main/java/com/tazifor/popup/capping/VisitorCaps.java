package com.tazifor.popup.capping;

import com.tazifor.popup.model.FrequencyCapConfig;
import com.tazifor.popup.model.GlobalCapConfig;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All cap counters of one visitor: one {@link CapCounters} per cap key plus the
 * visitor's global counters under {@link #GLOBAL_KEY}.
 *
 * Both stores keep this as a single entry per visitor, so a reservation that
 * counts against a campaign and against the global counters is one atomic write.
 */
@Value
public class VisitorCaps {

    /** Cap keys are "cmp:" or "exp:" prefixed, so this never collides. */
    public static final String GLOBAL_KEY = "global";

    public static final VisitorCaps EMPTY = new VisitorCaps(Map.of());

    Map<String, CapCounters> counters;

    public CapCounters countersFor(String capKey) {
        return counters.getOrDefault(capKey, CapCounters.EMPTY);
    }

    /**
     * Evaluate one impression of {@code capKey} without changing anything.
     *
     * CHECK ORDER: replay, the key's own limits, then the global limits.
     *
     * @return the decision, plus the counters to write back when it is a new reservation
     */
    public Reservation reserve(String capKey, String sessionId, String fireId, FrequencyCapConfig cfg,
                               Instant now, Duration sessionTtl) {
        CapCounters own = countersFor(capKey);
        if (own.isReplayOf(fireId)) {
            return Reservation.unchanged(CapDecision.allowed());
        }

        Optional<DenialReason> denial = own.denialFor(cfg, sessionId, now);
        if (denial.isPresent()) {
            return Reservation.unchanged(CapDecision.denied(denial.get()));
        }

        CapCounters global = countersFor(GLOBAL_KEY);
        GlobalCapConfig globalLimits = cfg.getCrossCampaignLimits();
        FrequencyCapConfig globalCfg = globalLimits != null ? globalLimits.asCapConfig() : FrequencyCapConfig.unlimited();
        Optional<DenialReason> globalDenial = global.denialFor(globalCfg, sessionId, now);
        if (globalDenial.isPresent()) {
            return Reservation.unchanged(CapDecision.denied(globalDenial.get().asGlobal()));
        }

        Map<String, CapCounters> next = live(now);
        next.put(capKey, own.reserve(cfg, sessionId, fireId, now, sessionTtl));
        if (cfg.countsTowardGlobal()) {
            next.put(GLOBAL_KEY, global.reserve(globalCfg, sessionId, fireId, now, sessionTtl));
        }
        return new Reservation(CapDecision.allowed(), new VisitorCaps(Map.copyOf(next)));
    }

    /**
     * Time until the longest live window of any key has expired, at least one second.
     */
    public Duration timeToLive(Instant now) {
        long until = counters.values().stream()
            .mapToLong(counter -> counter.expiresAtMillis(now))
            .max()
            .orElse(0L);
        return Duration.ofMillis(Math.max(1000, until - now.toEpochMilli()));
    }

    // expired keys are dropped on every write
    private Map<String, CapCounters> live(Instant now) {
        Map<String, CapCounters> live = new HashMap<>();
        counters.forEach((key, counter) -> {
            if (!counter.isExpired(now)) {
                live.put(key, counter);
            }
        });
        return live;
    }

    /**
     * Outcome of {@link #reserve}. {@code next} is null when nothing has to be written.
     */
    @Value
    public static class Reservation {
        CapDecision decision;
        VisitorCaps next;

        static Reservation unchanged(CapDecision decision) {
            return new Reservation(decision, null);
        }

        public boolean isWrite() {
            return next != null;
        }
    }
}
