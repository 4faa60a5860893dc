package com.tazifor.popup.service;

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
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class CampaignActionServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private DiscountIssuer discountIssuer;

    @Mock
    private LeadSink leadSink;

    @Mock
    private AnalyticsSink analyticsSink;

    @Spy
    private Clock clock = MutableClock.at("2026-03-10T12:00:00Z");

    @InjectMocks
    private CampaignActionService campaignActionService;

    @Test
    public void clickShouldIssueDiscountWhenNoLeadIsRequired() {
        // given
        Campaign campaign = campaign(DiscountRequirement.builder().enabled(true).build());
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign));
        given(discountIssuer.issue(eq("store-1"), eq(campaign), any())).willReturn("POP-ABCD1234");

        // when
        CampaignAction.Result result = campaignActionService.handle("store-1", action(ActionType.CLICK));

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.isDiscountIssued()).isTrue();
        assertThat(result.getDiscountCode()).isEqualTo("POP-ABCD1234");
        assertThat(result.getDeliveryMode()).isEqualTo(DiscountRequirement.DeliveryMode.SHOW_CODE);

        ArgumentCaptor<AnalyticsEvent> events = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(analyticsSink, times(2)).publish(events.capture());
        assertThat(events.getAllValues()).extracting(AnalyticsEvent::getType)
            .containsExactly(EventType.CLICK, EventType.COUPON_ISSUED);
    }

    @Test
    public void clickShouldNotIssueDiscountThatRequiresLead() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(
            campaign(DiscountRequirement.builder().enabled(true).requiresLead(true).build())));

        // when
        CampaignAction.Result result = campaignActionService.handle("store-1", action(ActionType.CLICK));

        // then
        assertThat(result.isDiscountIssued()).isFalse();
        verifyNoInteractions(discountIssuer);
    }

    @Test
    public void submitShouldForwardLeadAndIssueDiscount() {
        // given
        Campaign campaign = campaign(DiscountRequirement.builder()
            .enabled(true)
            .requiresLead(true)
            .deliveryMode(DiscountRequirement.DeliveryMode.AUTO_APPLY)
            .build());
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign));
        given(discountIssuer.issue(eq("store-1"), eq(campaign), any())).willReturn("POP-LEAD0001");
        CampaignAction action = action(ActionType.SUBMIT);
        action.setLeadFields(Map.of("email", "shopper@example.com"));

        // when
        CampaignAction.Result result = campaignActionService.handle("store-1", action);

        // then
        verify(leadSink).submit(eq("store-1"), eq("c1"), any(), eq(Map.of("email", "shopper@example.com")));
        assertThat(result.getDiscountCode()).isEqualTo("POP-LEAD0001");
        assertThat(result.getDeliveryMode()).isEqualTo(DiscountRequirement.DeliveryMode.AUTO_APPLY);
    }

    @Test
    public void closeShouldNeverIssueDiscount() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(
            campaign(DiscountRequirement.builder().enabled(true).build())));

        // when
        CampaignAction.Result result = campaignActionService.handle("store-1", action(ActionType.CLOSE));

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.isDiscountIssued()).isFalse();
        verifyNoInteractions(discountIssuer);
    }

    @Test
    public void issuerFailureShouldNotFailAction() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(
            campaign(DiscountRequirement.builder().enabled(true).build())));
        given(discountIssuer.issue(any(), any(), any())).willThrow(new IllegalStateException("issuer down"));

        // when
        CampaignAction.Result result = campaignActionService.handle("store-1", action(ActionType.CLICK));

        // then
        assertThat(result.isAccepted()).isTrue();
        assertThat(result.isDiscountIssued()).isFalse();
        assertThat(result.getDiscountCode()).isNull();
    }

    @Test
    public void trackShouldEnrichClickWithExperimentAndTimestamp() {
        // given
        given(campaignRepository.findCampaign("store-1", "c1")).willReturn(Optional.of(campaign(null)));
        AnalyticsEvent click = AnalyticsEvent.builder().type(EventType.CLICK).campaignId("c1").visitorId("v1").build();

        // when
        campaignActionService.track("store-1", click);

        // then
        ArgumentCaptor<AnalyticsEvent> event = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(analyticsSink).publish(event.capture());
        assertThat(event.getValue().getExperimentId()).isEqualTo("exp-1");
        assertThat(event.getValue().getVariantKey()).isEqualTo("A");
        assertThat(event.getValue().getTimestamp()).isEqualTo(Instant.parse("2026-03-10T12:00:00Z"));
    }

    @Test
    public void trackShouldRejectViewEvents() {
        // given
        AnalyticsEvent view = AnalyticsEvent.builder().type(EventType.VIEW).campaignId("c1").build();

        // when and then
        assertThatThrownBy(() -> campaignActionService.track("store-1", view))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(analyticsSink);
    }

    private static CampaignAction action(ActionType type) {
        return CampaignAction.builder()
            .campaignId("c1")
            .type(type)
            .visitor(VisitorContext.builder().visitorId("v1").sessionId("s1").build())
            .build();
    }

    private static Campaign campaign(DiscountRequirement discount) {
        return Campaign.builder()
            .id("c1")
            .storeId("store-1")
            .status(Campaign.CampaignStatus.ACTIVE)
            .experimentId("exp-1")
            .variantKey("A")
            .discount(discount)
            .build();
    }
}
