package com.tazifor.popup.storefront;

import com.tazifor.popup.model.EligibilityResponse.SurfaceDecision;

/**
 * Draws a selected popup. Visuals are entirely the renderer's business.
 */
public interface PopupRenderer {

    /**
     * @return false if the popup could not be displayed
     */
    boolean render(SurfaceDecision decision);
}
