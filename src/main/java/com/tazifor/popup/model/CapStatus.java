package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whether a campaign could show to a visitor right now, as far as frequency caps
 * go. Read-only: producing it never consumes a cap slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapStatus {

    private String campaignId;
    private String capKey;
    private boolean allowed;
    private String reason;      // null when allowed
}
