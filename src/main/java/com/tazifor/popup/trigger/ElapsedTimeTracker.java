package com.tazifor.popup.trigger;

/**
 * Satisfied once {@code delayMillis} have passed since page load.
 * Backs both PAGE_LOAD and TIME_DELAY triggers.
 */
final class ElapsedTimeTracker extends ConditionTracker {

    private final long delayMillis;
    private Long loadedAt;

    ElapsedTimeTracker(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    @Override
    protected boolean evaluate(Signal signal) {
        if (loadedAt == null || signal instanceof Signal.PageLoaded) {
            // first signal stands in for page load if the load event was missed
            loadedAt = loadedAt == null ? signal.getTimestamp() : Math.min(loadedAt, signal.getTimestamp());
        }
        return signal.getTimestamp() - loadedAt >= delayMillis;
    }
}
