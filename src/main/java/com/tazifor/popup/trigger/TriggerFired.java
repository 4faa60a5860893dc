package com.tazifor.popup.trigger;

import com.tazifor.popup.model.Surface;
import com.tazifor.popup.model.TriggerFire;
import lombok.Value;

import java.time.Instant;

/**
 * Message published when a campaign's trigger condition is met on a page view.
 */
@Value
public class TriggerFired {

    String campaignId;
    Surface surface;
    String fireId;
    Instant firedAt;

    public TriggerFire toTriggerFire() {
        return new TriggerFire(campaignId, fireId, firedAt);
    }
}
