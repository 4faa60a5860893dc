package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A trigger fire reported by the client with an eligibility request.
 *
 * {@code fireId} is unique per fire and makes reservations and impression
 * reports safe to retry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerFire {

    private String campaignId;
    private String fireId;
    private Instant firedAt;
}
