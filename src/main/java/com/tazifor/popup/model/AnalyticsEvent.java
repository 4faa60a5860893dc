package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyticsEvent {

    private EventType type;
    private String campaignId;
    private String experimentId;
    private String variantKey;
    private String visitorId;
    private String sessionId;
    private String pageUrl;
    private Instant timestamp;

    public enum EventType {
        VIEW,
        CLICK,
        CLOSE,
        SUBMIT,
        COUPON_ISSUED
    }
}
