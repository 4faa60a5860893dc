package com.tazifor.popup.trigger;

import com.tazifor.popup.model.DeviceClass;
import com.tazifor.popup.model.LogicOperator;
import com.tazifor.popup.model.Surface;
import com.tazifor.popup.model.TargetRules;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * TriggerDetector - per page view trigger state machine
 *
 * Feeds every observed {@link Signal} to the condition trackers of each watched
 * campaign and publishes a {@link TriggerFired} message the first time a
 * campaign's combined condition holds.
 *
 * GUARANTEES:
 * - A campaign fires at most once per page view.
 * - A campaign whose device targeting excludes the current device never fires.
 * - A tracker that throws disables only its own campaign; the error is logged
 *   at DEBUG and never reaches the shopper.
 * - After navigation (or {@link #tearDown()}) every tracker is released and
 *   later signals are ignored.
 *
 * THREADING: not thread-safe. One page view owns one detector and drives it
 * from a single task.
 */
@Slf4j
public class TriggerDetector {

    private final DeviceClass deviceClass;
    private final Consumer<TriggerFired> publisher;
    private final Supplier<String> fireIdSupplier;

    private final Map<String, Watch> watches = new LinkedHashMap<>();
    private boolean tornDown;

    public TriggerDetector(DeviceClass deviceClass, Consumer<TriggerFired> publisher) {
        this(deviceClass, publisher, () -> UUID.randomUUID().toString());
    }

    public TriggerDetector(DeviceClass deviceClass,
                           Consumer<TriggerFired> publisher,
                           Supplier<String> fireIdSupplier) {
        this.deviceClass = deviceClass;
        this.publisher = publisher;
        this.fireIdSupplier = fireIdSupplier;
    }

    /**
     * Start watching a campaign's triggers for this page view.
     */
    public void watch(String campaignId,
                      Surface surface,
                      TriggerConfig config,
                      TargetRules.DeviceTargeting deviceTargeting) {
        if (tornDown || watches.containsKey(campaignId)) {
            return;
        }
        if (deviceTargeting != null && !deviceTargeting.allows(deviceClass)) {
            watches.put(campaignId, Watch.disabled(campaignId, surface));
            return;
        }
        try {
            watches.put(campaignId, new Watch(campaignId, surface,
                config != null ? config.getEffectiveOperator() : LogicOperator.AND,
                buildTrackers(config)));
        } catch (RuntimeException e) {
            log.debug("Trigger detection disabled for campaign {}: {}", campaignId, e.getMessage());
            watches.put(campaignId, Watch.disabled(campaignId, surface));
        }
    }

    public void onSignal(Signal signal) {
        if (tornDown || signal == null) {
            return;
        }
        if (signal instanceof Signal.NavigatedAway) {
            tearDown();
            return;
        }

        for (Watch watch : watches.values()) {
            if (watch.state != WatchState.WATCHING) {
                continue;
            }
            try {
                if (watch.feed(signal)) {
                    watch.state = WatchState.FIRED;
                    publisher.accept(new TriggerFired(watch.campaignId, watch.surface,
                        fireIdSupplier.get(), Instant.ofEpochMilli(signal.getTimestamp())));
                }
            } catch (RuntimeException e) {
                log.debug("Trigger detection disabled for campaign {}: {}", watch.campaignId, e.getMessage());
                watch.state = WatchState.DISABLED;
            }
        }
    }

    /**
     * Release every tracker. Idempotent.
     */
    public void tearDown() {
        tornDown = true;
        watches.values().forEach(watch -> watch.trackers.clear());
    }

    public boolean isTornDown() {
        return tornDown;
    }

    public boolean hasFired(String campaignId) {
        Watch watch = watches.get(campaignId);
        return watch != null && watch.state == WatchState.FIRED;
    }

    public boolean isWatching(String campaignId) {
        Watch watch = watches.get(campaignId);
        return !tornDown && watch != null && watch.state == WatchState.WATCHING;
    }

    /**
     * Replay a finite signal stream against one trigger configuration.
     *
     * @return true if the configuration fires on this stream
     */
    public static boolean evaluate(TriggerConfig config,
                                   TargetRules.DeviceTargeting deviceTargeting,
                                   DeviceClass deviceClass,
                                   Iterable<Signal> signals) {
        List<TriggerFired> fired = new ArrayList<>(1);
        TriggerDetector detector = new TriggerDetector(deviceClass, fired::add);
        detector.watch("evaluation", Surface.CENTER_MODAL, config, deviceTargeting);
        for (Signal signal : signals) {
            detector.onSignal(signal);
            if (!fired.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private List<ConditionTracker> buildTrackers(TriggerConfig config) {
        List<ConditionTracker> trackers = new ArrayList<>();
        if (config == null || config.isEmpty()) {
            // no triggers configured: show on page load
            trackers.add(new ElapsedTimeTracker(0));
            return trackers;
        }
        for (TriggerSpec spec : config.getTriggers()) {
            trackers.add(trackerFor(spec));
        }
        return trackers;
    }

    private ConditionTracker trackerFor(TriggerSpec spec) {
        return switch (spec.getType()) {
            case PAGE_LOAD -> new ElapsedTimeTracker(((TriggerSpec.PageLoad) spec).effectiveDelayMillis());
            case TIME_DELAY -> new ElapsedTimeTracker(((TriggerSpec.TimeDelay) spec).effectiveDelayMillis());
            case EXIT_INTENT -> new ExitIntentTracker((TriggerSpec.ExitIntent) spec, deviceClass);
            case SCROLL_DEPTH -> new ScrollDepthTracker((TriggerSpec.ScrollDepth) spec);
            case IDLE_TIMER -> new IdleTracker(((TriggerSpec.IdleTimer) spec).effectiveIdleMillis());
            case CART_VALUE -> new CartValueTracker((TriggerSpec.CartValue) spec);
            case ADD_TO_CART -> new AddToCartTracker((TriggerSpec.AddToCart) spec);
            case CUSTOM_EVENT -> new CustomEventTracker((TriggerSpec.CustomEvent) spec);
        };
    }

    private enum WatchState {
        WATCHING,
        FIRED,
        DISABLED
    }

    private static final class Watch {
        private final String campaignId;
        private final Surface surface;
        private final LogicOperator operator;
        private final List<ConditionTracker> trackers;
        private WatchState state;

        private Watch(String campaignId, Surface surface, LogicOperator operator, List<ConditionTracker> trackers) {
            this.campaignId = campaignId;
            this.surface = surface;
            this.operator = operator;
            this.trackers = trackers;
            this.state = WatchState.WATCHING;
        }

        private static Watch disabled(String campaignId, Surface surface) {
            Watch watch = new Watch(campaignId, surface, LogicOperator.AND, new ArrayList<>());
            watch.state = WatchState.DISABLED;
            return watch;
        }

        private boolean feed(Signal signal) {
            // every tracker sees every signal, even once the outcome is known
            for (ConditionTracker tracker : trackers) {
                tracker.onSignal(signal);
            }
            return operator.combine(trackers, ConditionTracker::isSatisfied);
        }
    }
}
