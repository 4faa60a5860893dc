package com.tazifor.popup.trigger;

/**
 * Satisfied after {@code idleMillis} without pointer, scroll or input activity.
 */
final class IdleTracker extends ConditionTracker {

    private final long idleMillis;
    private Long lastActivity;

    IdleTracker(long idleMillis) {
        this.idleMillis = idleMillis;
    }

    @Override
    protected boolean evaluate(Signal signal) {
        long now = signal.getTimestamp();
        if (lastActivity == null) {
            lastActivity = now;
            return false;
        }
        if (now - lastActivity >= idleMillis) {
            return true;
        }
        if (isActivity(signal)) {
            lastActivity = now;
        }
        return false;
    }

    private static boolean isActivity(Signal signal) {
        return signal instanceof Signal.PointerMoved
            || signal instanceof Signal.Scrolled
            || signal instanceof Signal.UserActivity;
    }
}
