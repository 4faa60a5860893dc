package com.tazifor.popup.trigger;

/**
 * Tracks one trigger condition across the signals of a page view.
 *
 * Once satisfied a tracker stays satisfied for the rest of the page view.
 */
abstract class ConditionTracker {

    private boolean satisfied;

    final void onSignal(Signal signal) {
        if (!satisfied) {
            satisfied = evaluate(signal);
        }
    }

    final boolean isSatisfied() {
        return satisfied;
    }

    /**
     * @return true when this signal completes the condition
     */
    protected abstract boolean evaluate(Signal signal);
}
