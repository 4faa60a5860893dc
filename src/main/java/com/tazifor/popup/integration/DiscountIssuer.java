package com.tazifor.popup.integration;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.VisitorContext;

/**
 * Generates discount codes for campaigns whose call-to-action requires one.
 */
public interface DiscountIssuer {

    /**
     * @return the issued code
     */
    String issue(String storeId, Campaign campaign, VisitorContext visitor);
}
