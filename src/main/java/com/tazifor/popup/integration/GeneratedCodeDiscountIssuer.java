package com.tazifor.popup.integration;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.VisitorContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;

/**
 * Issues random single-use codes with a fixed prefix, e.g. {@code POP-7K2Q9XAB}.
 *
 * Codes are only generated here; registering them with the store's checkout is
 * left to whatever replaces this bean in a real deployment.
 */
@Slf4j
public class GeneratedCodeDiscountIssuer implements DiscountIssuer {

    private static final int CODE_LENGTH = 8;

    private final String prefix;

    public GeneratedCodeDiscountIssuer(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String issue(String storeId, Campaign campaign, VisitorContext visitor) {
        String code = prefix + "-" + RandomStringUtils.randomAlphanumeric(CODE_LENGTH).toUpperCase();
        log.info("Issued discount code for store {} campaign {}", storeId, campaign.getId());
        return code;
    }
}
