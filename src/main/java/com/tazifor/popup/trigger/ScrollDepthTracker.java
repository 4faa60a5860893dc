package com.tazifor.popup.trigger;

/**
 * Direction-aware scroll depth.
 *
 * A scroll position only counts once it has settled: no newer scroll signal
 * within the debounce window. DOWN fires when a downward move settles at or
 * past the target depth. UP fires on an upward move after the target depth was
 * reached. BOTH fires on either.
 */
final class ScrollDepthTracker extends ConditionTracker {

    private final int targetDepth;
    private final TriggerSpec.ScrollDirection direction;
    private final long debounceMillis;

    private int settledDepth;
    private boolean targetReached;
    private Signal.Scrolled pending;

    ScrollDepthTracker(TriggerSpec.ScrollDepth spec) {
        this.targetDepth = spec.effectiveDepth();
        this.direction = spec.effectiveDirection();
        this.debounceMillis = spec.effectiveDebounceMillis();
    }

    @Override
    protected boolean evaluate(Signal signal) {
        if (pending != null && signal.getTimestamp() - pending.getTimestamp() >= debounceMillis) {
            Signal.Scrolled settled = pending;
            pending = null;
            if (settle(settled.getDepthPercent())) {
                return true;
            }
        }
        if (signal instanceof Signal.Scrolled) {
            pending = (Signal.Scrolled) signal;
            if (debounceMillis == 0) {
                pending = null;
                return settle(((Signal.Scrolled) signal).getDepthPercent());
            }
        }
        return false;
    }

    private boolean settle(int depth) {
        boolean movedDown = depth > settledDepth;
        boolean movedUp = depth < settledDepth;
        settledDepth = depth;

        boolean downHit = movedDown && depth >= targetDepth;
        boolean upHit = movedUp && targetReached;
        if (depth >= targetDepth) {
            targetReached = true;
        }

        switch (direction) {
            case DOWN:
                return downHit;
            case UP:
                return upHit;
            case BOTH:
                return downHit || upHit;
            default:
                throw new IllegalStateException("Unknown scroll direction: " + direction);
        }
    }
}
