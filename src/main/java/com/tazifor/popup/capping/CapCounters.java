package com.tazifor.popup.capping;

import com.tazifor.popup.model.FrequencyCapConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Counter state for one (visitor, cap key).
 *
 * Each window carries its own expiry:
 * - session count: only while the same sessionId is seen and before {@code sessionExpiresAt}
 * - hour, day, week and month counts: only for the UTC {@link CapWindow} they were recorded in
 * - cooldown: until {@code cooldownUntil}
 *
 * Session and day are always counted. Hour, week and month are only counted
 * while the config limits them.
 *
 * An expired window reads as zero, so counters never go negative and only ever
 * grow inside a live window.
 */
@Value
@Builder(toBuilder = true)
public class CapCounters {

    public static final CapCounters EMPTY = CapCounters.builder().build();

    /** Reservations remembered for replay detection. */
    static final int MAX_RECENT_FIRES = 8;

    String sessionId;
    long sessionCount;
    long sessionExpiresAt;      // epoch millis

    String hour;                // CapWindow ids
    long hourCount;
    String day;
    long dayCount;
    String week;
    long weekCount;
    String month;
    long monthCount;

    long cooldownUntil;         // epoch millis, 0 = none
    long lastShownAt;           // epoch millis
    List<String> recentFireIds; // oldest first

    public long liveSessionCount(String currentSessionId, long nowMillis) {
        return currentSessionId != null && currentSessionId.equals(sessionId) && nowMillis < sessionExpiresAt
            ? sessionCount
            : 0;
    }

    public long liveCount(CapWindow window, Instant now) {
        return switch (window) {
            case HOUR -> window.idOf(now).equals(hour) ? hourCount : 0;
            case DAY -> window.idOf(now).equals(day) ? dayCount : 0;
            case WEEK -> window.idOf(now).equals(week) ? weekCount : 0;
            case MONTH -> window.idOf(now).equals(month) ? monthCount : 0;
        };
    }

    public boolean isReplayOf(String fireId) {
        return fireId != null && recentFireIds != null && recentFireIds.contains(fireId);
    }

    /**
     * CHECK ORDER: cooldown, session, hour, day, week, month.
     *
     * @return the first limit that blocks another impression, if any
     */
    public Optional<DenialReason> denialFor(FrequencyCapConfig cfg, String currentSessionId, Instant now) {
        long nowMillis = now.toEpochMilli();
        if (cfg.hasCooldown() && nowMillis < cooldownUntil) {
            return Optional.of(DenialReason.COOLDOWN_ACTIVE);
        }
        if (cfg.hasSessionLimit() && liveSessionCount(currentSessionId, nowMillis) >= cfg.getMaxPerSession()) {
            return Optional.of(DenialReason.SESSION_LIMIT_REACHED);
        }
        if (cfg.hasHourlyLimit() && liveCount(CapWindow.HOUR, now) >= cfg.getMaxPerHour()) {
            return Optional.of(DenialReason.HOURLY_LIMIT_REACHED);
        }
        if (cfg.hasDailyLimit() && liveCount(CapWindow.DAY, now) >= cfg.getMaxPerDay()) {
            return Optional.of(DenialReason.DAILY_LIMIT_REACHED);
        }
        if (cfg.hasWeeklyLimit() && liveCount(CapWindow.WEEK, now) >= cfg.getMaxPerWeek()) {
            return Optional.of(DenialReason.WEEKLY_LIMIT_REACHED);
        }
        if (cfg.hasMonthlyLimit() && liveCount(CapWindow.MONTH, now) >= cfg.getMaxPerMonth()) {
            return Optional.of(DenialReason.MONTHLY_LIMIT_REACHED);
        }
        return Optional.empty();
    }

    /**
     * Counters after one more impression.
     */
    public CapCounters reserve(FrequencyCapConfig cfg, String currentSessionId, String fireId,
                               Instant now, Duration sessionTtl) {
        long nowMillis = now.toEpochMilli();
        CapCountersBuilder next = CapCounters.builder()
            .sessionId(currentSessionId)
            .sessionCount(liveSessionCount(currentSessionId, nowMillis) + 1)
            .sessionExpiresAt(nowMillis + sessionTtl.toMillis())
            .day(CapWindow.DAY.idOf(now))
            .dayCount(liveCount(CapWindow.DAY, now) + 1)
            .cooldownUntil(cfg.hasCooldown() ? nowMillis + cfg.getCooldownSeconds() * 1000 : cooldownUntil)
            .lastShownAt(nowMillis)
            .recentFireIds(withFireId(fireId));

        if (cfg.hasHourlyLimit()) {
            next.hour(CapWindow.HOUR.idOf(now)).hourCount(liveCount(CapWindow.HOUR, now) + 1);
        }
        if (cfg.hasWeeklyLimit()) {
            next.week(CapWindow.WEEK.idOf(now)).weekCount(liveCount(CapWindow.WEEK, now) + 1);
        }
        if (cfg.hasMonthlyLimit()) {
            next.month(CapWindow.MONTH.idOf(now)).monthCount(liveCount(CapWindow.MONTH, now) + 1);
        }
        return next.build();
    }

    /**
     * When the last live window held by these counters ends: the latest of
     * session end, cooldown end and the end of every calendar window still current.
     */
    public long expiresAtMillis(Instant now) {
        long until = Math.max(sessionExpiresAt, cooldownUntil);
        if (liveCount(CapWindow.DAY, now) > 0) {
            until = Math.max(until, CapWindow.DAY.endOf(now).toEpochMilli());
        }
        if (liveCount(CapWindow.WEEK, now) > 0) {
            until = Math.max(until, CapWindow.WEEK.endOf(now).toEpochMilli());
        }
        if (liveCount(CapWindow.MONTH, now) > 0) {
            until = Math.max(until, CapWindow.MONTH.endOf(now).toEpochMilli());
        }
        return until;
    }

    public boolean isExpired(Instant now) {
        return expiresAtMillis(now) <= now.toEpochMilli();
    }

    /**
     * Time until every window held by these counters has expired, at least one second.
     */
    public Duration timeToLive(Instant now) {
        return Duration.ofMillis(Math.max(1000, expiresAtMillis(now) - now.toEpochMilli()));
    }

    private List<String> withFireId(String fireId) {
        List<String> fires = new ArrayList<>(recentFireIds != null ? recentFireIds : List.of());
        if (fireId != null) {
            fires.add(fireId);
        }
        int overflow = fires.size() - MAX_RECENT_FIRES;
        return List.copyOf(overflow > 0 ? fires.subList(overflow, fires.size()) : fires);
    }
}
