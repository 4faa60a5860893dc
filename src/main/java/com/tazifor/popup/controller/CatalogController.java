package com.tazifor.popup.controller;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.service.CatalogService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CatalogController - campaign/experiment sync from the authoring side
 *
 * PUT  /api/stores/{storeId}/catalog/campaigns/{id}
 * POST /api/stores/{storeId}/catalog/campaigns/{id}/activate
 * POST /api/stores/{storeId}/catalog/campaigns/{id}/deactivate
 * PUT  /api/stores/{storeId}/catalog/experiments/{id}
 * POST /api/stores/{storeId}/catalog/experiments/{id}/activate
 *
 * Invalid configuration is answered with 400 and the list of violations.
 */
@RestController
@RequestMapping("/api/stores/{storeId}/catalog")
public class CatalogController {

    @Autowired
    private CatalogService catalogService;

    @PutMapping("/campaigns/{campaignId}")
    public ResponseEntity<Campaign> upsertCampaign(@PathVariable String storeId,
                                                   @PathVariable String campaignId,
                                                   @RequestBody Campaign campaign) {
        campaign.setId(campaignId);
        return ResponseEntity.ok(catalogService.upsertCampaign(storeId, campaign));
    }

    @PostMapping("/campaigns/{campaignId}/activate")
    public ResponseEntity<Campaign> activateCampaign(@PathVariable String storeId,
                                                     @PathVariable String campaignId) {
        return ResponseEntity.ok(catalogService.activateCampaign(storeId, campaignId));
    }

    @PostMapping("/campaigns/{campaignId}/deactivate")
    public ResponseEntity<Campaign> deactivateCampaign(@PathVariable String storeId,
                                                       @PathVariable String campaignId) {
        return ResponseEntity.ok(catalogService.deactivateCampaign(storeId, campaignId));
    }

    @PutMapping("/experiments/{experimentId}")
    public ResponseEntity<Experiment> upsertExperiment(@PathVariable String storeId,
                                                       @PathVariable String experimentId,
                                                       @RequestBody Experiment experiment) {
        experiment.setId(experimentId);
        return ResponseEntity.ok(catalogService.upsertExperiment(storeId, experiment));
    }

    @PostMapping("/experiments/{experimentId}/activate")
    public ResponseEntity<Experiment> activateExperiment(@PathVariable String storeId,
                                                         @PathVariable String experimentId) {
        return ResponseEntity.ok(catalogService.activateExperiment(storeId, experimentId));
    }
}
