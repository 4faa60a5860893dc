package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tazifor.popup.trigger.TriggerConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Campaign Model
 *
 * A marketing popup campaign as seen by the decision engine: where it may show
 * (targeting + surface), when it may show (triggers + frequency cap), and which
 * experiment arm it belongs to.
 *
 * Owned by the authoring subsystem. The engine only reads it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    // ===== Basic Info =====
    private String id;
    private String storeId;
    private String name;

    // ===== Status =====
    private CampaignStatus status;

    // ===== Arbitration =====
    private Integer priority;        // Higher wins
    private Surface surface;         // Display slot this campaign occupies

    // ===== Rules =====
    private TargetRules targetRules;
    private TriggerConfig triggerConfig;
    private FrequencyCapConfig frequencyCap;

    // ===== Experiment back-reference (never a live pointer) =====
    private String experimentId;
    private String variantKey;

    // ===== Call to action =====
    private DiscountRequirement discount;

    // ===== Timestamps =====
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Campaign Status
     */
    public enum CampaignStatus {
        DRAFT,      // Not yet active
        ACTIVE,     // Eligible for evaluation
        PAUSED,     // Manually paused
        ARCHIVED    // Deleted/archived
    }

    @JsonIgnore
    public boolean isActive() {
        return status == CampaignStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isInExperiment() {
        return experimentId != null;
    }

    /**
     * Key the frequency cap is tracked under.
     *
     * All variants of one experiment share a single counter, so a visitor moving
     * between arms cannot see the experiment more often than the cap allows.
     */
    @JsonIgnore
    public String getCapTrackingKey() {
        return experimentId != null ? "exp:" + experimentId : "cmp:" + id;
    }

    @JsonIgnore
    public int getEffectivePriority() {
        return priority != null ? priority : 0;
    }

    @JsonIgnore
    public Surface getEffectiveSurface() {
        return surface != null ? surface : Surface.CENTER_MODAL;
    }

    @JsonIgnore
    public FrequencyCapConfig getEffectiveFrequencyCap() {
        return frequencyCap != null ? frequencyCap : FrequencyCapConfig.unlimited();
    }
}
