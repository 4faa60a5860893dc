package com.tazifor.popup.experiment;

import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.Variant;
import com.tazifor.popup.model.VisitorContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * StickyAssignmentService - one variant per visitor per experiment, for life
 *
 * LOOKUP ORDER:
 * 1. Client token (from {@link VisitorContext#getAssignments()}), if it names a
 *    variant the experiment still has
 * 2. Server mirror, if enabled
 * 3. A variant the visitor holds but the experiment no longer has (token first,
 *    then mirror). It is kept, and {@link #effectiveVariant} decides between
 *    control and exclusion
 * 4. Fresh hash bucketing, written to the mirror first-writer-wins
 *
 * Once a visitor holds a variant it is never recomputed, so changing traffic
 * allocation only affects visitors who have not been bucketed yet.
 *
 * A mirror that cannot be reached is skipped with a WARN; the client token keeps
 * the visitor sticky in the meantime.
 */
@Slf4j
public class StickyAssignmentService {

    private final ExperimentAssigner assigner;
    private final ExperimentAssignmentStore mirror;   // null when mirroring is off
    private final VariantFallbackPolicy fallbackPolicy;

    public StickyAssignmentService(ExperimentAssigner assigner,
                                   ExperimentAssignmentStore mirror,
                                   VariantFallbackPolicy fallbackPolicy) {
        this.assigner = assigner;
        this.mirror = mirror;
        this.fallbackPolicy = fallbackPolicy != null ? fallbackPolicy : VariantFallbackPolicy.CONTROL_VARIANT;
    }

    /**
     * The variant this visitor holds in this experiment, assigning one on first sight.
     */
    public String assign(Experiment experiment, VisitorContext visitor) {
        String experimentId = experiment.getId();
        String visitorId = visitor.getVisitorId();

        String token = clientToken(visitor.getAssignments(), experimentId);
        if (token != null && experiment.hasVariant(token)) {
            mirrorQuietly(experimentId, visitorId, token);
            return token;
        }

        Optional<String> mirrored = findMirrored(experimentId, visitorId);
        if (mirrored.isPresent() && experiment.hasVariant(mirrored.get())) {
            return mirrored.get();
        }

        // variant removed from the experiment: stay on it so the fallback policy applies
        String retired = token != null ? token : mirrored.orElse(null);
        if (retired != null) {
            log.debug("Visitor {} holds retired variant {} of experiment {}", visitorId, retired, experimentId);
            return retired;
        }

        String computed = assigner.assign(experiment, visitorId);
        String stored = mirrorQuietly(experimentId, visitorId, computed);
        return StringUtils.isNotBlank(stored) ? stored : computed;
    }

    /**
     * Variant whose campaign should actually be considered for this visitor.
     *
     * @param assignedVariant     the sticky assignment
     * @param activeVariantKeys   variants whose campaign is currently active
     * @return the assigned variant if its campaign is active, otherwise what the
     *         fallback policy allows; empty if the experiment is ineligible
     */
    public Optional<String> effectiveVariant(Experiment experiment,
                                             String assignedVariant,
                                             Set<String> activeVariantKeys) {
        if (activeVariantKeys.contains(assignedVariant)) {
            return Optional.of(assignedVariant);
        }
        if (fallbackPolicy == VariantFallbackPolicy.EXCLUDE) {
            return Optional.empty();
        }
        return experiment.getControlVariant()
            .map(Variant::getVariantKey)
            .filter(activeVariantKeys::contains);
    }

    public VariantFallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    private Optional<String> findMirrored(String experimentId, String visitorId) {
        if (mirror == null) {
            return Optional.empty();
        }
        try {
            return mirror.find(experimentId, visitorId).filter(StringUtils::isNotBlank);
        } catch (TransientStoreException e) {
            log.warn("Assignment mirror unavailable, using computed variant for experiment {}: {}",
                experimentId, e.getMessage());
            return Optional.empty();
        }
    }

    private String mirrorQuietly(String experimentId, String visitorId, String variantKey) {
        if (mirror == null) {
            return variantKey;
        }
        try {
            return mirror.putIfAbsent(experimentId, visitorId, variantKey);
        } catch (TransientStoreException e) {
            log.warn("Assignment mirror unavailable, assignment for experiment {} not mirrored: {}",
                experimentId, e.getMessage());
            return variantKey;
        }
    }

    private static String clientToken(Map<String, String> assignments, String experimentId) {
        if (assignments == null) {
            return null;
        }
        return StringUtils.trimToNull(assignments.get(experimentId));
    }
}
