package com.tazifor.popup.storefront;

import com.tazifor.popup.model.Surface;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Display state of one surface for one page view.
 *
 * <pre>
 * IDLE -> EVALUATING -> CANDIDATE_SELECTED -> SHOWN -> CLOSED | EXPIRED | CONVERTED
 *            |                 |
 *            +-> IDLE          +-> IDLE   (empty decision / timeout, render failure)
 * </pre>
 */
public class SurfaceStateMachine {

    private static final Map<SurfaceState, Set<SurfaceState>> TRANSITIONS = Map.of(
        SurfaceState.IDLE, EnumSet.of(SurfaceState.EVALUATING),
        SurfaceState.EVALUATING, EnumSet.of(SurfaceState.CANDIDATE_SELECTED, SurfaceState.IDLE),
        SurfaceState.CANDIDATE_SELECTED, EnumSet.of(SurfaceState.SHOWN, SurfaceState.IDLE),
        SurfaceState.SHOWN, EnumSet.of(SurfaceState.CLOSED, SurfaceState.EXPIRED, SurfaceState.CONVERTED),
        SurfaceState.CLOSED, EnumSet.noneOf(SurfaceState.class),
        SurfaceState.EXPIRED, EnumSet.noneOf(SurfaceState.class),
        SurfaceState.CONVERTED, EnumSet.noneOf(SurfaceState.class)
    );

    private final Surface surface;
    private volatile SurfaceState state = SurfaceState.IDLE;

    public SurfaceStateMachine(Surface surface) {
        this.surface = surface;
    }

    /**
     * @throws IllegalStateException if {@code next} is not reachable from the current state
     */
    public void transitionTo(SurfaceState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException(surface + ": illegal transition " + state + " -> " + next);
        }
        state = next;
    }

    public boolean canTransitionTo(SurfaceState next) {
        return TRANSITIONS.get(state).contains(next);
    }

    public SurfaceState getState() {
        return state;
    }

    public Surface getSurface() {
        return surface;
    }
}
