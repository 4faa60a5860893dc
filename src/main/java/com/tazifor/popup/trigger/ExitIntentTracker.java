package com.tazifor.popup.trigger;

import com.tazifor.popup.model.DeviceClass;

/**
 * Exit intent: the pointer heads up towards the browser chrome fast enough and
 * close enough to the top edge.
 *
 * VELOCITY:
 * Upward velocity is measured between the current sample and the previous
 * baseline. Samples arriving within {@link #DEBOUNCE_MILLIS} of the baseline are
 * dropped, so bursts of mouse events do not produce noisy velocities.
 *
 * ARMING:
 * Nothing fires until {@code delayMillis} after page load.
 */
final class ExitIntentTracker extends ConditionTracker {

    static final long DEBOUNCE_MILLIS = 10;

    private final ExitIntentSensitivity sensitivity;
    private final long armDelayMillis;
    private final boolean enabledOnDevice;

    private Long armedAt;
    private Signal.PointerMoved baseline;

    ExitIntentTracker(TriggerSpec.ExitIntent spec, DeviceClass deviceClass) {
        this.sensitivity = spec.effectiveSensitivity();
        this.armDelayMillis = spec.effectiveDelayMillis();
        // touch devices have no pointer hovering over the tab bar
        boolean touch = deviceClass == DeviceClass.MOBILE || deviceClass == DeviceClass.TABLET;
        this.enabledOnDevice = !touch || spec.isMobileEnabled();
    }

    @Override
    protected boolean evaluate(Signal signal) {
        if (!enabledOnDevice) {
            return false;
        }
        if (armedAt == null) {
            armedAt = signal.getTimestamp() + armDelayMillis;
        }
        if (!(signal instanceof Signal.PointerMoved)) {
            return false;
        }
        Signal.PointerMoved move = (Signal.PointerMoved) signal;
        if (baseline == null) {
            baseline = move;
            return false;
        }

        long elapsed = move.getTimestamp() - baseline.getTimestamp();
        if (elapsed < DEBOUNCE_MILLIS) {
            return false;
        }
        double upwardVelocity = (baseline.getY() - move.getY()) / elapsed;
        baseline = move;

        return move.getTimestamp() >= armedAt
            && move.getY() <= sensitivity.getEdgeDistancePx()
            && upwardVelocity >= sensitivity.getMinUpwardVelocity();
    }
}
