package com.tazifor.popup.service;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Surface;
import lombok.Value;

/**
 * A campaign that passed targeting, experiment resolution and had a trigger fire.
 */
@Value
public class Candidate {
    Campaign campaign;
    String triggerFireId;

    public Surface getSurface() {
        return campaign.getEffectiveSurface();
    }
}
