package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sent by the storefront after a popup was actually rendered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpressionReport {

    private String campaignId;
    private String triggerFireId;
    private VisitorContext visitor;

    /**
     * Result of an impression report. {@code duplicate} is true for a retried report.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Ack {
        private boolean recorded;
        private boolean duplicate;
    }
}
