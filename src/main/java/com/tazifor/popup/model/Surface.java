package com.tazifor.popup.model;

/**
 * Visual placement a popup occupies on the page.
 *
 * Surfaces resolve independently: one campaign per surface, several surfaces at once.
 */
public enum Surface {
    CENTER_MODAL,
    CORNER_MODAL,
    BANNER,
    NOTIFICATION_STRIP
}
