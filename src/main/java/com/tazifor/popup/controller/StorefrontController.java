package com.tazifor.popup.controller;

import com.tazifor.popup.model.AnalyticsEvent;
import com.tazifor.popup.model.CampaignAction;
import com.tazifor.popup.model.CampaignManifest;
import com.tazifor.popup.model.EligibilityRequest;
import com.tazifor.popup.model.EligibilityResponse;
import com.tazifor.popup.model.ImpressionReport;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.service.CampaignActionService;
import com.tazifor.popup.service.EligibilityService;
import com.tazifor.popup.service.ImpressionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * StorefrontController - endpoints called from the shopper's browser
 *
 * POST /api/storefront/{storeId}/manifest     - campaigns to watch on this page
 * POST /api/storefront/{storeId}/eligibility  - decision after trigger fires
 * POST /api/storefront/{storeId}/impressions  - popup was rendered
 * POST /api/storefront/{storeId}/events       - CLICK / CLOSE
 * POST /api/storefront/{storeId}/actions      - call-to-action and lead submission
 *
 * Eligibility always answers 200: any failure becomes "no campaign".
 */
@RestController
@RequestMapping("/api/storefront/{storeId}")
public class StorefrontController {

    @Autowired
    private EligibilityService eligibilityService;

    @Autowired
    private ImpressionService impressionService;

    @Autowired
    private CampaignActionService actionService;

    @PostMapping("/manifest")
    public ResponseEntity<CampaignManifest> manifest(@PathVariable String storeId,
                                                     @RequestBody VisitorContext visitor) {
        return ResponseEntity.ok(eligibilityService.manifest(storeId, visitor));
    }

    @PostMapping("/eligibility")
    public ResponseEntity<EligibilityResponse> eligibility(@PathVariable String storeId,
                                                           @RequestBody EligibilityRequest request) {
        long startTime = System.nanoTime();
        EligibilityResponse response = eligibilityService.evaluate(storeId, request);
        long latencyMs = (System.nanoTime() - startTime) / 1_000_000;

        return ResponseEntity.ok()
            .header("X-Processing-Time-Ms", String.valueOf(latencyMs))
            .body(response);
    }

    @PostMapping("/impressions")
    public ResponseEntity<ImpressionReport.Ack> impression(@PathVariable String storeId,
                                                           @RequestBody ImpressionReport report) {
        return ResponseEntity.ok(impressionService.record(storeId, report));
    }

    @PostMapping("/events")
    public ResponseEntity<Void> event(@PathVariable String storeId,
                                      @RequestBody AnalyticsEvent event) {
        actionService.track(storeId, event);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/actions")
    public ResponseEntity<CampaignAction.Result> action(@PathVariable String storeId,
                                                        @RequestBody CampaignAction action) {
        return ResponseEntity.ok(actionService.handle(storeId, action));
    }
}
