package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Limits shared by every campaign of a visitor that opts into global capping.
 *
 * Used both as a campaign's own cross-campaign limits and as the engine-wide
 * default bound from {@code popup.global-cap.*}. A null or zero limit means no limit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalCapConfig {

    private Integer maxPerSession;
    private Integer maxPerDay;
    private Long cooldownSeconds;

    @JsonIgnore
    public boolean hasLimits() {
        return (maxPerSession != null && maxPerSession > 0)
            || (maxPerDay != null && maxPerDay > 0)
            || (cooldownSeconds != null && cooldownSeconds > 0);
    }

    /**
     * The same limits, read against the visitor's global counters.
     */
    public FrequencyCapConfig asCapConfig() {
        return FrequencyCapConfig.builder()
            .maxPerSession(maxPerSession)
            .maxPerDay(maxPerDay)
            .cooldownSeconds(cooldownSeconds)
            .build();
    }
}
