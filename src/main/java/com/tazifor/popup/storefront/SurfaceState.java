package com.tazifor.popup.storefront;

public enum SurfaceState {
    IDLE,
    EVALUATING,
    CANDIDATE_SELECTED,
    SHOWN,
    CLOSED,
    EXPIRED,
    CONVERTED;

    /**
     * Terminal states end display on the surface for the rest of the page view.
     */
    public boolean isTerminal() {
        return this == CLOSED || this == EXPIRED || this == CONVERTED;
    }
}
