package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A shopper interaction with a shown popup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignAction {

    private String campaignId;
    private ActionType type;
    private VisitorContext visitor;

    /**
     * Form fields for SUBMIT (email, phone, consent...).
     */
    private Map<String, String> leadFields;

    public enum ActionType {
        CLICK,
        CLOSE,
        SUBMIT
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Result {
        private boolean accepted;
        private boolean discountIssued;
        private String discountCode;
        private DiscountRequirement.DeliveryMode deliveryMode;
    }
}
