package com.tazifor.popup.trigger;

final class CartValueTracker extends ConditionTracker {

    private final TriggerSpec.CartValue spec;

    CartValueTracker(TriggerSpec.CartValue spec) {
        this.spec = spec;
    }

    @Override
    protected boolean evaluate(Signal signal) {
        return signal instanceof Signal.CartUpdated
            && spec.accepts(((Signal.CartUpdated) signal).getCartValue());
    }
}
