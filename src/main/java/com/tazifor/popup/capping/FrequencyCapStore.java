package com.tazifor.popup.capping;

import com.tazifor.popup.model.FrequencyCapConfig;

/**
 * Frequency Cap Store
 *
 * TTL-keyed impression counters per (visitorId, capKey), plus per-visitor global
 * counters shared by every campaign that opts into global limits. The cap key is
 * the campaign id, or the experiment id for campaigns that are experiment variants.
 *
 * Implementations throw {@link com.tazifor.popup.exception.TransientStoreException}
 * when the backing store cannot be reached. Callers decide whether to fail open.
 */
public interface FrequencyCapStore {

    /**
     * Atomically check every limit and, if none blocks, record one impression
     * against the cap key and, when {@code cfg} counts toward global limits,
     * against the visitor's global counters.
     *
     * Two concurrent calls for the same visitor can never both take the last
     * permitted slot. Repeating a call with the fireId of one of the visitor's
     * recent reservations for this key returns Allowed without counting again.
     */
    CapDecision checkAndReserve(String capKey, String visitorId, String sessionId,
                                String fireId, FrequencyCapConfig cfg);

    /**
     * Same checks as {@link #checkAndReserve}, without recording anything.
     * Served by the cap diagnostics endpoint.
     */
    CapDecision check(String capKey, String visitorId, String sessionId, FrequencyCapConfig cfg);
}
