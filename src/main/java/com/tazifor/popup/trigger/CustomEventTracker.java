package com.tazifor.popup.trigger;

final class CustomEventTracker extends ConditionTracker {

    private final TriggerSpec.CustomEvent spec;

    CustomEventTracker(TriggerSpec.CustomEvent spec) {
        this.spec = spec;
    }

    @Override
    protected boolean evaluate(Signal signal) {
        return signal instanceof Signal.CustomEvent
            && spec.accepts(((Signal.CustomEvent) signal).getName());
    }
}
