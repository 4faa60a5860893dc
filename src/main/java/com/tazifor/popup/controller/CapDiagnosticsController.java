package com.tazifor.popup.controller;

import com.tazifor.popup.model.CapStatus;
import com.tazifor.popup.service.EligibilityService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * CapDiagnosticsController - read-only view of a visitor's frequency caps
 *
 * GET /api/stores/{storeId}/caps/{campaignId}?visitorId=..&sessionId=..
 *
 * Answers whether the campaign could show to that visitor now and, if not,
 * which limit blocks it. Never consumes a cap slot.
 */
@RestController
@RequestMapping("/api/stores/{storeId}/caps")
public class CapDiagnosticsController {

    @Autowired
    private EligibilityService eligibilityService;

    @GetMapping("/{campaignId}")
    public ResponseEntity<CapStatus> capStatus(@PathVariable String storeId,
                                               @PathVariable String campaignId,
                                               @RequestParam String visitorId,
                                               @RequestParam String sessionId) {
        return ResponseEntity.ok(eligibilityService.capStatus(storeId, campaignId, visitorId, sessionId));
    }
}
