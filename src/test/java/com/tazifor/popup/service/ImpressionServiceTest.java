package com.tazifor.popup.service;

import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.InvalidVisitorContextException;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.impression.ImpressionStore;
import com.tazifor.popup.integration.AnalyticsSink;
import com.tazifor.popup.model.AnalyticsEvent;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.ImpressionRecord;
import com.tazifor.popup.model.ImpressionReport;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.repository.CampaignRepository;
import com.tazifor.popup.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class ImpressionServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private ImpressionStore impressionStore;

    @Mock
    private AnalyticsSink analyticsSink;

    @Spy
    private Clock clock = MutableClock.at("2026-03-10T12:00:00Z");

    @InjectMocks
    private ImpressionService impressionService;

    @Test
    public void recordShouldEmitViewWithExperimentAttribution() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign()));
        given(impressionStore.recordIfAbsent(any())).willReturn(true);

        // when
        ImpressionReport.Ack ack = impressionService.record("store-1", report());

        // then
        assertThat(ack.isRecorded()).isTrue();
        assertThat(ack.isDuplicate()).isFalse();

        ArgumentCaptor<ImpressionRecord> record = ArgumentCaptor.forClass(ImpressionRecord.class);
        verify(impressionStore).recordIfAbsent(record.capture());
        assertThat(record.getValue().dedupeKey()).isEqualTo("c1:v1:fire-1");

        ArgumentCaptor<AnalyticsEvent> event = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(analyticsSink).publish(event.capture());
        assertThat(event.getValue().getType()).isEqualTo(AnalyticsEvent.EventType.VIEW);
        assertThat(event.getValue().getExperimentId()).isEqualTo("exp-1");
        assertThat(event.getValue().getVariantKey()).isEqualTo("B");
        assertThat(event.getValue().getTimestamp()).isEqualTo(Instant.parse("2026-03-10T12:00:00Z"));
    }

    @Test
    public void recordShouldAcknowledgeRetriedReportWithoutSecondView() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign()));
        given(impressionStore.recordIfAbsent(any())).willReturn(false);

        // when
        ImpressionReport.Ack ack = impressionService.record("store-1", report());

        // then
        assertThat(ack.isDuplicate()).isTrue();
        assertThat(ack.isRecorded()).isFalse();
        verify(analyticsSink, never()).publish(any());
    }

    @Test
    public void recordShouldEmitViewWhenStoreIsUnavailable() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign()));
        given(impressionStore.recordIfAbsent(any())).willThrow(new TransientStoreException("down"));

        // when
        ImpressionReport.Ack ack = impressionService.record("store-1", report());

        // then
        assertThat(ack.isRecorded()).isTrue();
        verify(analyticsSink).publish(any());
    }

    @Test
    public void recordShouldRejectUnknownCampaign() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.empty());

        // when and then
        assertThatThrownBy(() -> impressionService.record("store-1", report()))
            .isInstanceOf(CampaignNotFoundException.class);
        verifyNoInteractions(impressionStore, analyticsSink);
    }

    @Test
    public void recordShouldRequireVisitorIdentityAndFireId() {
        // given
        ImpressionReport anonymous = report();
        anonymous.setVisitor(VisitorContext.builder().visitorId("v1").build());
        ImpressionReport withoutFire = report();
        withoutFire.setTriggerFireId(" ");

        // when and then
        assertThatThrownBy(() -> impressionService.record("store-1", anonymous))
            .isInstanceOf(InvalidVisitorContextException.class);
        assertThatThrownBy(() -> impressionService.record("store-1", withoutFire))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("triggerFireId");
    }

    private static ImpressionReport report() {
        return ImpressionReport.builder()
            .campaignId("c1")
            .triggerFireId("fire-1")
            .visitor(VisitorContext.builder().visitorId("v1").sessionId("s1").build())
            .build();
    }

    private static Campaign campaign() {
        return Campaign.builder()
            .id("c1")
            .storeId("store-1")
            .status(Campaign.CampaignStatus.ACTIVE)
            .experimentId("exp-1")
            .variantKey("B")
            .build();
    }
}
