package com.tazifor.popup.experiment;

/**
 * What a visitor sees when the campaign of their assigned variant is no longer active.
 */
public enum VariantFallbackPolicy {
    CONTROL_VARIANT,    // Show the control arm if its campaign is still active
    EXCLUDE             // The experiment is ineligible for this visitor
}
