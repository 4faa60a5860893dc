package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One shown popup. Ephemeral: stores keep it only for the impression TTL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpressionRecord {

    private String campaignId;
    private String visitorId;
    private String sessionId;
    private String triggerFireId;
    private Instant timestamp;

    public String dedupeKey() {
        return campaignId + ":" + visitorId + ":" + triggerFireId;
    }
}
