package com.tazifor.popup.capping;

public enum DenialReason {
    SESSION_LIMIT_REACHED,
    HOURLY_LIMIT_REACHED,
    DAILY_LIMIT_REACHED,
    WEEKLY_LIMIT_REACHED,
    MONTHLY_LIMIT_REACHED,
    COOLDOWN_ACTIVE,

    // visitor-wide, across every campaign that opts into global limits
    GLOBAL_SESSION_LIMIT_REACHED,
    GLOBAL_DAILY_LIMIT_REACHED,
    GLOBAL_COOLDOWN_ACTIVE;

    /**
     * The visitor-wide counterpart of a limit hit on the global counters.
     */
    DenialReason asGlobal() {
        return switch (this) {
            case SESSION_LIMIT_REACHED -> GLOBAL_SESSION_LIMIT_REACHED;
            case DAILY_LIMIT_REACHED -> GLOBAL_DAILY_LIMIT_REACHED;
            case COOLDOWN_ACTIVE -> GLOBAL_COOLDOWN_ACTIVE;
            default -> this;
        };
    }
}
