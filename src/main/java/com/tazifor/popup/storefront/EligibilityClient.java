package com.tazifor.popup.storefront;

import com.tazifor.popup.model.EligibilityRequest;
import com.tazifor.popup.model.EligibilityResponse;
import com.tazifor.popup.model.ImpressionReport;

import java.util.concurrent.CompletableFuture;

/**
 * Storefront-side view of the eligibility API. Implementations must not block
 * the calling thread.
 */
public interface EligibilityClient {

    CompletableFuture<EligibilityResponse> requestEligibility(EligibilityRequest request);

    /**
     * Fire-and-forget; retries are safe because reports are idempotent per trigger fire.
     */
    void reportImpression(ImpressionReport report);
}
