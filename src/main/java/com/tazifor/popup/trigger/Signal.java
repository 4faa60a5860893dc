package com.tazifor.popup.trigger;

import lombok.Value;

/**
 * Runtime signals observed on a storefront page. Timestamps are epoch millis.
 *
 * Clock-driven conditions (delays, idle time, debounce windows) advance on
 * whatever signal arrives next, so the page runtime emits {@link Tick}s
 * while it is otherwise quiet.
 */
public interface Signal {

    long getTimestamp();

    @Value
    class PageLoaded implements Signal {
        long timestamp;
    }

    @Value
    class Tick implements Signal {
        long timestamp;
    }

    @Value
    class PointerMoved implements Signal {
        long timestamp;
        double x;
        double y;          // Distance from the viewport's top edge
    }

    @Value
    class Scrolled implements Signal {
        long timestamp;
        int depthPercent;
    }

    /**
     * Keyboard, click or touch activity.
     */
    @Value
    class UserActivity implements Signal {
        long timestamp;
    }

    @Value
    class CartUpdated implements Signal {
        long timestamp;
        double cartValue;
    }

    @Value
    class AddedToCart implements Signal {
        long timestamp;
        String productId;
        String collectionId;
    }

    @Value
    class CustomEvent implements Signal {
        long timestamp;
        String name;
    }

    @Value
    class NavigatedAway implements Signal {
        long timestamp;
    }
}
