package com.tazifor.popup.model;

import com.tazifor.popup.trigger.TriggerConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Preflight answer: the campaigns whose targeting matches this page view, with
 * the trigger configuration the storefront must watch for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignManifest {

    private List<Entry> campaigns;

    /**
     * Experiment tokens the client must persist: experimentId to variantKey.
     */
    private Map<String, String> assignments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String campaignId;
        private Surface surface;
        private int priority;
        private TriggerConfig triggerConfig;
        private TargetRules.DeviceTargeting deviceTargeting;
    }
}
