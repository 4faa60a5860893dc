package com.tazifor.popup.capping;

/**
 * Cap Decision
 *
 * IMMUTABLE: Allowed, or Denied with a reason.
 * {@code degraded} marks an Allowed produced by failing open on a store error.
 */
public final class CapDecision {

    private static final CapDecision ALLOWED = new CapDecision(true, null, false);
    private static final CapDecision DEGRADED = new CapDecision(true, null, true);

    private final boolean allowed;
    private final DenialReason reason;
    private final boolean degraded;

    private CapDecision(boolean allowed, DenialReason reason, boolean degraded) {
        this.allowed = allowed;
        this.reason = reason;
        this.degraded = degraded;
    }

    public static CapDecision allowed() {
        return ALLOWED;
    }

    public static CapDecision denied(DenialReason reason) {
        return new CapDecision(false, reason, false);
    }

    public static CapDecision failedOpen() {
        return DEGRADED;
    }

    public boolean isAllowed() { return allowed; }
    public DenialReason getReason() { return reason; }
    public boolean isDegraded() { return degraded; }

    @Override
    public String toString() {
        if (allowed) {
            return degraded ? "Allowed(degraded)" : "Allowed";
        }
        return "Denied(" + reason + ")";
    }
}
