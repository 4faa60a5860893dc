package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whether a campaign's call-to-action needs a generated discount code.
 *
 * The engine never issues codes itself; it only decides if issuance must happen
 * before the action completes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountRequirement {

    private boolean enabled;
    private DeliveryMode deliveryMode;
    private boolean requiresLead;     // Code is only issued after a lead submission

    public enum DeliveryMode {
        SHOW_CODE,
        AUTO_APPLY
    }
}
