package com.tazifor.popup.trigger;

/**
 * Discriminator of the trigger tagged union. Each constant has exactly one
 * {@link TriggerSpec} subtype and one tracker.
 */
public enum TriggerType {
    PAGE_LOAD,
    TIME_DELAY,
    EXIT_INTENT,
    SCROLL_DEPTH,
    IDLE_TIMER,
    CART_VALUE,
    ADD_TO_CART,
    CUSTOM_EVENT
}
