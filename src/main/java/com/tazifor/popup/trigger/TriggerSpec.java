package com.tazifor.popup.trigger;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * One configured trigger condition: a {@code type} tag plus its typed parameters.
 *
 * JSON form: {@code {"type": "SCROLL_DEPTH", "depthPercentage": 60, ...}}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TriggerSpec.PageLoad.class, name = "PAGE_LOAD"),
    @JsonSubTypes.Type(value = TriggerSpec.TimeDelay.class, name = "TIME_DELAY"),
    @JsonSubTypes.Type(value = TriggerSpec.ExitIntent.class, name = "EXIT_INTENT"),
    @JsonSubTypes.Type(value = TriggerSpec.ScrollDepth.class, name = "SCROLL_DEPTH"),
    @JsonSubTypes.Type(value = TriggerSpec.IdleTimer.class, name = "IDLE_TIMER"),
    @JsonSubTypes.Type(value = TriggerSpec.CartValue.class, name = "CART_VALUE"),
    @JsonSubTypes.Type(value = TriggerSpec.AddToCart.class, name = "ADD_TO_CART"),
    @JsonSubTypes.Type(value = TriggerSpec.CustomEvent.class, name = "CUSTOM_EVENT")
})
public interface TriggerSpec {

    TriggerType getType();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class PageLoad implements TriggerSpec {
        private Long delayMillis;

        @Override
        public TriggerType getType() {
            return TriggerType.PAGE_LOAD;
        }

        long effectiveDelayMillis() {
            return delayMillis != null ? Math.max(0, delayMillis) : 0;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class TimeDelay implements TriggerSpec {
        private Long delaySeconds;
        private boolean immediate;

        @Override
        public TriggerType getType() {
            return TriggerType.TIME_DELAY;
        }

        long effectiveDelayMillis() {
            if (immediate || delaySeconds == null || delaySeconds <= 0) {
                return 0;
            }
            return delaySeconds * 1000;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ExitIntent implements TriggerSpec {
        private ExitIntentSensitivity sensitivity;
        private Long delayMillis;          // Arming delay after page load
        private boolean mobileEnabled;

        @Override
        public TriggerType getType() {
            return TriggerType.EXIT_INTENT;
        }

        ExitIntentSensitivity effectiveSensitivity() {
            return sensitivity != null ? sensitivity : ExitIntentSensitivity.MEDIUM;
        }

        long effectiveDelayMillis() {
            return delayMillis != null ? Math.max(0, delayMillis) : 1000;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ScrollDepth implements TriggerSpec {
        private Integer depthPercentage;
        private ScrollDirection direction;
        private Long debounceMillis;

        @Override
        public TriggerType getType() {
            return TriggerType.SCROLL_DEPTH;
        }

        int effectiveDepth() {
            return depthPercentage != null ? depthPercentage : 50;
        }

        ScrollDirection effectiveDirection() {
            return direction != null ? direction : ScrollDirection.DOWN;
        }

        long effectiveDebounceMillis() {
            return debounceMillis != null ? Math.max(0, debounceMillis) : 100;
        }
    }

    enum ScrollDirection {
        DOWN,
        UP,
        BOTH
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class IdleTimer implements TriggerSpec {
        private Long idleSeconds;

        @Override
        public TriggerType getType() {
            return TriggerType.IDLE_TIMER;
        }

        long effectiveIdleMillis() {
            return (idleSeconds != null && idleSeconds > 0 ? idleSeconds : 30) * 1000;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class CartValue implements TriggerSpec {
        private Double minValue;
        private Double maxValue;

        @Override
        public TriggerType getType() {
            return TriggerType.CART_VALUE;
        }

        boolean accepts(double cartValue) {
            double min = minValue != null ? minValue : 0;
            return cartValue >= min && (maxValue == null || cartValue <= maxValue);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class AddToCart implements TriggerSpec {
        private Set<String> productIds;
        private Set<String> collectionIds;
        private Long delaySeconds;

        @Override
        public TriggerType getType() {
            return TriggerType.ADD_TO_CART;
        }

        /**
         * Product and collection filters are OR-combined; with neither configured any add matches.
         */
        boolean accepts(String productId, String collectionId) {
            boolean hasProductFilter = productIds != null && !productIds.isEmpty();
            boolean hasCollectionFilter = collectionIds != null && !collectionIds.isEmpty();
            if (!hasProductFilter && !hasCollectionFilter) {
                return true;
            }
            boolean productMatch = hasProductFilter && productId != null && productIds.contains(productId);
            boolean collectionMatch = hasCollectionFilter && collectionId != null
                && collectionIds.stream().anyMatch(id -> id.equals(collectionId) || id.endsWith("/" + collectionId));
            return productMatch || collectionMatch;
        }

        long effectiveDelayMillis() {
            return delaySeconds != null && delaySeconds > 0 ? delaySeconds * 1000 : 0;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class CustomEvent implements TriggerSpec {
        private Set<String> eventNames;

        @Override
        public TriggerType getType() {
            return TriggerType.CUSTOM_EVENT;
        }

        boolean accepts(String eventName) {
            return eventNames == null || eventNames.isEmpty() || eventNames.contains(eventName);
        }
    }
}
