package com.tazifor.popup.config;

import com.tazifor.popup.experiment.VariantFallbackPolicy;
import com.tazifor.popup.model.GlobalCapConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code popup.*}.
 */
@Data
@ConfigurationProperties(prefix = "popup")
public class PopupEngineProperties {

    /**
     * Backend for caps, assignments, impressions and the catalog: aerospike or memory.
     */
    private String store = "aerospike";

    // ===== Frequency capping =====
    private Duration sessionTtl = Duration.ofMinutes(30);
    private int storeMaxRetries = 3;

    /**
     * Visitor-wide limits for campaigns that respect global limits without
     * defining their own cross-campaign limits. Unset means none.
     */
    private GlobalCapConfig globalCap = new GlobalCapConfig();

    // ===== Experiments =====
    private boolean mirrorAssignments = true;
    private Duration assignmentTtl = Duration.ofDays(90);
    private VariantFallbackPolicy variantFallback = VariantFallbackPolicy.CONTROL_VARIANT;

    // ===== Impressions =====
    private Duration impressionTtl = Duration.ofHours(24);

    // ===== Catalog =====
    private Duration campaignCacheTtl = Duration.ofSeconds(60);

    // ===== In-memory backend =====
    private long memoryMaxEntries = 1_000_000;

}
