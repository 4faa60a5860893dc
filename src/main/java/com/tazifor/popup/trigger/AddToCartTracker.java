package com.tazifor.popup.trigger;

/**
 * Fires {@code delaySeconds} after a matching add-to-cart event.
 */
final class AddToCartTracker extends ConditionTracker {

    private final TriggerSpec.AddToCart spec;
    private Long dueAt;

    AddToCartTracker(TriggerSpec.AddToCart spec) {
        this.spec = spec;
    }

    @Override
    protected boolean evaluate(Signal signal) {
        if (dueAt == null && signal instanceof Signal.AddedToCart) {
            Signal.AddedToCart added = (Signal.AddedToCart) signal;
            if (spec.accepts(added.getProductId(), added.getCollectionId())) {
                dueAt = added.getTimestamp() + spec.effectiveDelayMillis();
            }
        }
        return dueAt != null && signal.getTimestamp() >= dueAt;
    }
}
