package com.tazifor.popup.trigger;

/**
 * Exit-intent thresholds. Higher sensitivity reacts further from the top edge
 * and to slower upward pointer movement.
 */
public enum ExitIntentSensitivity {
    LOW(5, 1.2),
    MEDIUM(20, 0.6),
    HIGH(50, 0.3);

    private final int edgeDistancePx;
    private final double minUpwardVelocity;   // px per ms

    ExitIntentSensitivity(int edgeDistancePx, double minUpwardVelocity) {
        this.edgeDistancePx = edgeDistancePx;
        this.minUpwardVelocity = minUpwardVelocity;
    }

    public int getEdgeDistancePx() {
        return edgeDistancePx;
    }

    public double getMinUpwardVelocity() {
        return minUpwardVelocity;
    }
}
