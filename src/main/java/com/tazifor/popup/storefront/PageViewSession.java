package com.tazifor.popup.storefront;

import com.tazifor.popup.model.CampaignManifest;
import com.tazifor.popup.model.EligibilityRequest;
import com.tazifor.popup.model.EligibilityResponse;
import com.tazifor.popup.model.EligibilityResponse.SurfaceDecision;
import com.tazifor.popup.model.ImpressionReport;
import com.tazifor.popup.model.Surface;
import com.tazifor.popup.model.TriggerFire;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.trigger.Signal;
import com.tazifor.popup.trigger.TriggerDetector;
import com.tazifor.popup.trigger.TriggerFired;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * PageViewSession - storefront runtime for one page view
 *
 * THREADING:
 * Every signal, trigger fire and eligibility answer is handled as a task on one
 * single-thread executor. No state is shared with other threads except the
 * surface states, which are only read from outside.
 *
 * FLOW per surface:
 * 1. Trigger fires while IDLE -> EVALUATING, eligibility requested
 * 2. Fires arriving while EVALUATING are buffered
 * 3. Winner -> CANDIDATE_SELECTED -> rendered -> SHOWN, impression reported
 * 4. Empty answer, timeout or render failure -> IDLE; buffered fires are
 *    re-evaluated
 *
 * NAVIGATION tears down the trigger detector, cancels outstanding requests and
 * expires any popup still SHOWN.
 */
@Slf4j
public class PageViewSession implements AutoCloseable {

    private final String storeId;
    private final EligibilityClient client;
    private final PopupRenderer renderer;
    private final Duration decisionTimeout;
    private final ExecutorService executor;
    private final TriggerDetector detector;

    private final Map<Surface, SurfaceStateMachine> surfaces = new EnumMap<>(Surface.class);
    private final Map<Surface, List<TriggerFire>> bufferedFires = new EnumMap<>(Surface.class);
    private final Map<Surface, CompletableFuture<EligibilityResponse>> pending = new EnumMap<>(Surface.class);
    private final Map<String, String> assignments = Collections.synchronizedMap(new LinkedHashMap<>());

    private VisitorContext visitor;
    private volatile boolean closed;

    public PageViewSession(String storeId,
                           VisitorContext visitor,
                           CampaignManifest manifest,
                           EligibilityClient client,
                           PopupRenderer renderer,
                           Duration decisionTimeout) {
        this(storeId, visitor, manifest, client, renderer, decisionTimeout,
            Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "page-view-" + storeId);
                thread.setDaemon(true);
                return thread;
            }));
    }

    public PageViewSession(String storeId,
                           VisitorContext visitor,
                           CampaignManifest manifest,
                           EligibilityClient client,
                           PopupRenderer renderer,
                           Duration decisionTimeout,
                           ExecutorService executor) {
        this.storeId = storeId;
        this.visitor = visitor;
        this.client = client;
        this.renderer = renderer;
        this.decisionTimeout = decisionTimeout;
        this.executor = executor;

        for (Surface surface : Surface.values()) {
            surfaces.put(surface, new SurfaceStateMachine(surface));
            bufferedFires.put(surface, new ArrayList<>());
        }
        if (visitor.getAssignments() != null) {
            assignments.putAll(visitor.getAssignments());
        }
        if (manifest.getAssignments() != null) {
            assignments.putAll(manifest.getAssignments());
        }

        // fires are handed back to the executor as messages, never handled inline
        this.detector = new TriggerDetector(visitor.getDeviceClass(), fired -> submit(() -> onTriggerFired(fired)));
        if (manifest.getCampaigns() != null) {
            for (CampaignManifest.Entry entry : manifest.getCampaigns()) {
                detector.watch(entry.getCampaignId(), entry.getSurface(),
                    entry.getTriggerConfig(), entry.getDeviceTargeting());
            }
        }
    }

    /**
     * Queue a runtime signal. Navigation signals close the session.
     */
    public void signal(Signal signal) {
        if (signal instanceof Signal.NavigatedAway) {
            close();
            return;
        }
        submit(() -> detector.onSignal(signal));
    }

    /**
     * The shopper dismissed the popup on this surface.
     */
    public void popupClosed(Surface surface) {
        submit(() -> finish(surface, SurfaceState.CLOSED));
    }

    /**
     * The shopper completed the popup's call-to-action on this surface.
     */
    public void popupConverted(Surface surface) {
        submit(() -> finish(surface, SurfaceState.CONVERTED));
    }

    public SurfaceState stateOf(Surface surface) {
        return surfaces.get(surface).getState();
    }

    /**
     * Experiment tokens to persist client-side.
     */
    public Map<String, String> getAssignments() {
        synchronized (assignments) {
            return Map.copyOf(assignments);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Navigation away. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        // closed first: decisions completing during teardown must be dropped
        closed = true;
        submit(this::tearDown);
        executor.shutdown();
    }

    // ===== Tasks (run on the executor) =====

    private void onTriggerFired(TriggerFired fired) {
        if (closed) {
            return;
        }
        Surface surface = fired.getSurface();
        SurfaceStateMachine machine = surfaces.get(surface);

        switch (machine.getState()) {
            case IDLE -> {
                List<TriggerFire> fires = new ArrayList<>();
                fires.add(fired.toTriggerFire());
                evaluate(machine, fires);
            }
            case EVALUATING -> bufferedFires.get(surface).add(fired.toTriggerFire());
            default -> log.debug("Ignoring fire of {} on {} surface in state {}",
                fired.getCampaignId(), surface, machine.getState());
        }
    }

    private void evaluate(SurfaceStateMachine machine, List<TriggerFire> fires) {
        Surface surface = machine.getSurface();
        machine.transitionTo(SurfaceState.EVALUATING);

        EligibilityRequest request = EligibilityRequest.builder()
            .visitor(visitor.toBuilder().assignments(getAssignments()).build())
            .triggerFires(fires)
            .surface(surface)
            .build();

        CompletableFuture<EligibilityResponse> future;
        try {
            future = client.requestEligibility(request)
                .orTimeout(decisionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        pending.put(surface, future);
        future.whenComplete((response, error) -> submit(() -> onDecision(surface, response, error)));
    }

    private void onDecision(Surface surface, EligibilityResponse response, Throwable error) {
        pending.remove(surface);
        SurfaceStateMachine machine = surfaces.get(surface);
        if (closed || machine.getState() != SurfaceState.EVALUATING) {
            return;
        }

        if (error != null) {
            log.debug("No decision for {} surface: {}", surface, error.toString());
        } else if (response.getAssignments() != null) {
            assignments.putAll(response.getAssignments());
        }

        SurfaceDecision decision = error == null ? response.decisionFor(surface) : null;
        if (decision == null || decision.getCampaign() == null) {
            machine.transitionTo(SurfaceState.IDLE);
            reevaluateBuffered(machine);
            return;
        }

        machine.transitionTo(SurfaceState.CANDIDATE_SELECTED);
        bufferedFires.get(surface).clear();

        boolean rendered;
        try {
            rendered = renderer.render(decision);
        } catch (RuntimeException e) {
            log.debug("Rendering campaign {} failed: {}", decision.getCampaign().getId(), e.getMessage());
            rendered = false;
        }
        if (!rendered) {
            machine.transitionTo(SurfaceState.IDLE);
            return;
        }

        machine.transitionTo(SurfaceState.SHOWN);
        client.reportImpression(ImpressionReport.builder()
            .campaignId(decision.getCampaign().getId())
            .triggerFireId(decision.getTriggerFireId())
            .visitor(visitor)
            .build());
    }

    private void reevaluateBuffered(SurfaceStateMachine machine) {
        List<TriggerFire> buffered = bufferedFires.get(machine.getSurface());
        if (buffered.isEmpty()) {
            return;
        }
        List<TriggerFire> fires = new ArrayList<>(buffered);
        buffered.clear();
        evaluate(machine, fires);
    }

    private void finish(Surface surface, SurfaceState terminal) {
        SurfaceStateMachine machine = surfaces.get(surface);
        if (machine.canTransitionTo(terminal)) {
            machine.transitionTo(terminal);
        }
    }

    private void tearDown() {
        detector.tearDown();
        pending.values().forEach(future -> future.cancel(true));
        pending.clear();
        bufferedFires.values().forEach(List::clear);
        surfaces.values().stream()
            .filter(machine -> machine.getState() == SurfaceState.SHOWN)
            .forEach(machine -> machine.transitionTo(SurfaceState.EXPIRED));
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // session already closed
            log.debug("Dropping task for closed page view on store {}", storeId);
        }
    }
}
