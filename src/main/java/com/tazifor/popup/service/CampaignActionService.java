package com.tazifor.popup.service;

import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.integration.AnalyticsSink;
import com.tazifor.popup.integration.DiscountIssuer;
import com.tazifor.popup.integration.LeadSink;
import com.tazifor.popup.model.AnalyticsEvent;
import com.tazifor.popup.model.AnalyticsEvent.EventType;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.CampaignAction;
import com.tazifor.popup.model.CampaignAction.ActionType;
import com.tazifor.popup.model.DiscountRequirement;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * CampaignActionService - shopper interactions with a shown popup
 *
 * CLICK / CLOSE: analytics only.
 * SUBMIT: lead forwarded to the {@link LeadSink}, then analytics.
 *
 * DISCOUNTS:
 * When the campaign's call-to-action carries a discount, a code is issued on
 * CLICK, or only on SUBMIT when the discount requires a lead. An issuer failure
 * never fails the action itself.
 */
@Slf4j
@Service
public class CampaignActionService {

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private DiscountIssuer discountIssuer;

    @Autowired
    private LeadSink leadSink;

    @Autowired
    private AnalyticsSink analyticsSink;

    @Autowired
    private Clock clock;

    public CampaignAction.Result handle(String storeId, CampaignAction action) {
        VisitorContext visitor = EligibilityService.requireIdentity(action.getVisitor());
        if (action.getType() == null) {
            throw new IllegalArgumentException("action type is required");
        }
        Campaign campaign = campaignRepository.findCampaign(storeId, action.getCampaignId())
            .orElseThrow(() -> new CampaignNotFoundException(action.getCampaignId()));

        if (action.getType() == ActionType.SUBMIT) {
            leadSink.submit(storeId, campaign.getId(), visitor, action.getLeadFields());
        }
        publish(EventType.valueOf(action.getType().name()), campaign, visitor);

        CampaignAction.Result.ResultBuilder result = CampaignAction.Result.builder().accepted(true);
        DiscountRequirement discount = campaign.getDiscount();
        if (requiresIssuance(discount, action.getType())) {
            try {
                String code = discountIssuer.issue(storeId, campaign, visitor);
                publish(EventType.COUPON_ISSUED, campaign, visitor);
                result.discountIssued(true)
                    .discountCode(code)
                    .deliveryMode(discount.getDeliveryMode() != null
                        ? discount.getDeliveryMode()
                        : DiscountRequirement.DeliveryMode.SHOW_CODE);
            } catch (RuntimeException e) {
                log.warn("Discount issuance failed for campaign {}: {}", campaign.getId(), e.getMessage());
            }
        }
        return result.build();
    }

    /**
     * CLICK/CLOSE passthrough from the storefront.
     */
    public void track(String storeId, AnalyticsEvent event) {
        if (event.getType() != EventType.CLICK && event.getType() != EventType.CLOSE) {
            throw new IllegalArgumentException("Only CLICK and CLOSE events are accepted, got " + event.getType());
        }
        Campaign campaign = campaignRepository.findCampaign(storeId, event.getCampaignId())
            .orElseThrow(() -> new CampaignNotFoundException(event.getCampaignId()));

        analyticsSink.publish(event.toBuilder()
            .experimentId(campaign.getExperimentId())
            .variantKey(campaign.getVariantKey())
            .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
            .build());
    }

    static boolean requiresIssuance(DiscountRequirement discount, ActionType type) {
        if (discount == null || !discount.isEnabled()) {
            return false;
        }
        return discount.isRequiresLead() ? type == ActionType.SUBMIT : type != ActionType.CLOSE;
    }

    private void publish(EventType type, Campaign campaign, VisitorContext visitor) {
        analyticsSink.publish(AnalyticsEvent.builder()
            .type(type)
            .campaignId(campaign.getId())
            .experimentId(campaign.getExperimentId())
            .variantKey(campaign.getVariantKey())
            .visitorId(visitor.getVisitorId())
            .sessionId(visitor.getSessionId())
            .pageUrl(visitor.getPageUrl())
            .timestamp(clock.instant())
            .build());
    }
}
