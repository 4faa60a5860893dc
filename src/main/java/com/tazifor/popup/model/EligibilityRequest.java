package com.tazifor.popup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Eligibility Request
 *
 * Sent by the storefront once one or more triggers have fired.
 * When {@code surface} is set only that surface is resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EligibilityRequest {

    private VisitorContext visitor;
    private List<TriggerFire> triggerFires;
    private Surface surface;
}
