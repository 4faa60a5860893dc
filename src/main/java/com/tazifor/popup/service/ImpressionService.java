package com.tazifor.popup.service;

import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.impression.ImpressionStore;
import com.tazifor.popup.integration.AnalyticsSink;
import com.tazifor.popup.model.AnalyticsEvent;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.ImpressionRecord;
import com.tazifor.popup.model.ImpressionReport;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * ImpressionService - records that a popup was actually rendered
 *
 * IDEMPOTENT per (campaignId, visitorId, triggerFireId): a retried report is
 * acknowledged as a duplicate and VIEW is emitted only once.
 *
 * The cap slot was already taken when the decision was made, so nothing here
 * touches frequency counters.
 */
@Slf4j
@Service
public class ImpressionService {

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private ImpressionStore impressionStore;

    @Autowired
    private AnalyticsSink analyticsSink;

    @Autowired
    private Clock clock;

    public ImpressionReport.Ack record(String storeId, ImpressionReport report) {
        VisitorContext visitor = EligibilityService.requireIdentity(report.getVisitor());
        if (StringUtils.isBlank(report.getTriggerFireId())) {
            throw new IllegalArgumentException("triggerFireId is required");
        }
        Campaign campaign = campaignRepository.findCampaign(storeId, report.getCampaignId())
            .orElseThrow(() -> new CampaignNotFoundException(report.getCampaignId()));

        Instant now = clock.instant();
        ImpressionRecord record = ImpressionRecord.builder()
            .campaignId(campaign.getId())
            .visitorId(visitor.getVisitorId())
            .sessionId(visitor.getSessionId())
            .triggerFireId(report.getTriggerFireId())
            .timestamp(now)
            .build();

        boolean recorded;
        try {
            recorded = impressionStore.recordIfAbsent(record);
        } catch (TransientStoreException e) {
            // fail open: a retried report may emit VIEW twice
            log.warn("Impression store unavailable, emitting VIEW for campaign {} without dedupe: {}",
                campaign.getId(), e.getMessage());
            recorded = true;
        }

        if (!recorded) {
            log.debug("Duplicate impression report {}", record.dedupeKey());
            return ImpressionReport.Ack.builder().recorded(false).duplicate(true).build();
        }

        analyticsSink.publish(AnalyticsEvent.builder()
            .type(AnalyticsEvent.EventType.VIEW)
            .campaignId(campaign.getId())
            .experimentId(campaign.getExperimentId())
            .variantKey(campaign.getVariantKey())
            .visitorId(visitor.getVisitorId())
            .sessionId(visitor.getSessionId())
            .pageUrl(visitor.getPageUrl())
            .timestamp(now)
            .build());

        return ImpressionReport.Ack.builder().recorded(true).duplicate(false).build();
    }
}
