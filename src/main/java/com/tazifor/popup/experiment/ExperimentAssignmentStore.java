package com.tazifor.popup.experiment;

import java.util.Optional;

/**
 * Server-side mirror of client-held experiment assignments.
 *
 * Throws {@link com.tazifor.popup.exception.TransientStoreException} when unreachable.
 */
public interface ExperimentAssignmentStore {

    Optional<String> find(String experimentId, String visitorId);

    /**
     * Record an assignment unless one already exists.
     *
     * @return the stored variant, which is the earlier writer's if there was one
     */
    String putIfAbsent(String experimentId, String visitorId, String variantKey);
}
