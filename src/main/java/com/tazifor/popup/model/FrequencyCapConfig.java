package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-visitor impression limits for one campaign (or one experiment).
 *
 * A null or zero limit means "no limit" for that window.
 *
 * GLOBAL LIMITS:
 * A campaign with {@code respectGlobalLimits} or its own {@code crossCampaignLimits}
 * counts every impression against the visitor's global counters. The global limits
 * it is checked against are its own {@code crossCampaignLimits}, or the engine-wide
 * default when it has none.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FrequencyCapConfig {

    private Integer maxPerSession;
    private Integer maxPerHour;
    private Integer maxPerDay;
    private Integer maxPerWeek;
    private Integer maxPerMonth;
    private Long cooldownSeconds;

    private boolean respectGlobalLimits;
    private GlobalCapConfig crossCampaignLimits;

    public static FrequencyCapConfig unlimited() {
        return FrequencyCapConfig.builder().cooldownSeconds(0L).build();
    }

    /**
     * This config with {@code storeDefault} as its global limits, if it respects
     * global limits without defining its own.
     */
    public FrequencyCapConfig withGlobalDefault(GlobalCapConfig storeDefault) {
        if (!respectGlobalLimits || crossCampaignLimits != null
            || storeDefault == null || !storeDefault.hasLimits()) {
            return this;
        }
        return toBuilder().crossCampaignLimits(storeDefault).build();
    }

    @JsonIgnore
    public boolean countsTowardGlobal() {
        return respectGlobalLimits || crossCampaignLimits != null;
    }

    @JsonIgnore
    public boolean hasSessionLimit() {
        return isLimit(maxPerSession);
    }

    @JsonIgnore
    public boolean hasHourlyLimit() {
        return isLimit(maxPerHour);
    }

    @JsonIgnore
    public boolean hasDailyLimit() {
        return isLimit(maxPerDay);
    }

    @JsonIgnore
    public boolean hasWeeklyLimit() {
        return isLimit(maxPerWeek);
    }

    @JsonIgnore
    public boolean hasMonthlyLimit() {
        return isLimit(maxPerMonth);
    }

    @JsonIgnore
    public boolean hasCooldown() {
        return cooldownSeconds != null && cooldownSeconds > 0;
    }

    private static boolean isLimit(Integer limit) {
        return limit != null && limit > 0;
    }
}
