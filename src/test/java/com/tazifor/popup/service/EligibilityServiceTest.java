package com.tazifor.popup.service;

import com.tazifor.popup.capping.CapDecision;
import com.tazifor.popup.capping.DenialReason;
import com.tazifor.popup.capping.FrequencyCapStore;
import com.tazifor.popup.config.PopupEngineProperties;
import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.InvalidVisitorContextException;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.experiment.ExperimentAssigner;
import com.tazifor.popup.experiment.StickyAssignmentService;
import com.tazifor.popup.experiment.VariantFallbackPolicy;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.CampaignManifest;
import com.tazifor.popup.model.CapStatus;
import com.tazifor.popup.model.DeviceClass;
import com.tazifor.popup.model.EligibilityRequest;
import com.tazifor.popup.model.EligibilityResponse;
import com.tazifor.popup.model.EligibilityResponse.NoCampaignReason;
import com.tazifor.popup.model.EligibilityResponse.SurfaceDecision;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.FrequencyCapConfig;
import com.tazifor.popup.model.GlobalCapConfig;
import com.tazifor.popup.model.Surface;
import com.tazifor.popup.model.TargetRules;
import com.tazifor.popup.model.TriggerFire;
import com.tazifor.popup.model.Variant;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.repository.CampaignRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class EligibilityServiceTest {

    private static final String STORE_ID = "store-1";

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private FrequencyCapStore frequencyCapStore;

    @Spy
    private TargetingService targetingService;

    @Spy
    private PriorityResolver priorityResolver;

    @Spy
    private StickyAssignmentService assignmentService =
        new StickyAssignmentService(new ExperimentAssigner(), null, VariantFallbackPolicy.CONTROL_VARIANT);

    @Spy
    private PopupEngineProperties properties = new PopupEngineProperties();

    @InjectMocks
    private EligibilityService eligibilityService;

    @Test
    public void evaluateShouldRejectVisitorWithoutSession() {
        // given
        EligibilityRequest request = EligibilityRequest.builder()
            .visitor(VisitorContext.builder().visitorId("v1").build())
            .triggerFires(fires("c1"))
            .surface(Surface.CENTER_MODAL)
            .build();

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request);

        // then
        assertThat(response.getReason()).isEqualTo(NoCampaignReason.INVALID_VISITOR_CONTEXT);
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign()).isNull();
        verifyNoInteractions(campaignRepository, frequencyCapStore);
    }

    @Test
    public void evaluateShouldReportStoreWithoutActiveCampaigns() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("c1")));

        // then
        assertThat(response.getReason()).isEqualTo(NoCampaignReason.NO_ACTIVE_CAMPAIGNS);
        assertThat(response.getDecisions()).isEmpty();
    }

    @Test
    public void evaluateShouldReturnHighestPriorityAndReserveOnlyForWinner() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("low", 1, Surface.CENTER_MODAL),
            campaign("high", 100, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("low", "high")));

        // then
        SurfaceDecision decision = response.decisionFor(Surface.CENTER_MODAL);
        assertThat(decision.getCampaign().getId()).isEqualTo("high");
        assertThat(decision.getTriggerFireId()).isEqualTo("fire-high");
        assertThat(response.getReason()).isNull();
        verify(frequencyCapStore).checkAndReserve(eq("cmp:high"), eq("v1"), eq("s1"), eq("fire-high"), any());
        verify(frequencyCapStore, never()).checkAndReserve(eq("cmp:low"), anyString(), anyString(), anyString(), any());
    }

    @Test
    public void evaluateShouldHandSurfaceToNextCandidateWhenWinnerIsCapped() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("low", 1, Surface.CENTER_MODAL),
            campaign("high", 100, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willAnswer(invocation -> "cmp:high".equals(invocation.getArgument(0))
                ? CapDecision.denied(DenialReason.SESSION_LIMIT_REACHED)
                : CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("low", "high")));

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("low");
    }

    @Test
    public void evaluateShouldReturnEmptyDecisionWhenEveryCandidateIsCapped() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("only", 5, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.denied(DenialReason.COOLDOWN_ACTIVE));
        EligibilityRequest request = request(fires("only"));
        request.setSurface(Surface.CENTER_MODAL);

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request);

        // then
        assertThat(response.getDecisions()).hasSize(1);
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign()).isNull();
        assertThat(response.getReason()).isNull();
    }

    @Test
    public void evaluateShouldFailOpenWhenCapStoreIsUnavailable() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("c1", 5, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willThrow(new TransientStoreException("timeout"));

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("c1")));

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("c1");
        assertThat(response.getReason()).isNull();
    }

    @Test
    public void evaluateShouldIgnoreCampaignsWithoutTriggerFire() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("fired", 1, Surface.CENTER_MODAL),
            campaign("silent", 100, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("fired")));

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("fired");
    }

    @Test
    public void evaluateShouldResolveEachSurfaceIndependently() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("modal", 100, Surface.CENTER_MODAL),
            campaign("banner", 1, Surface.BANNER)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("modal", "banner")));

        // then
        assertThat(response.getDecisions()).extracting(SurfaceDecision::getSurface)
            .containsExactlyInAnyOrder(Surface.CENTER_MODAL, Surface.BANNER);
        assertThat(response.decisionFor(Surface.BANNER).getCampaign().getId()).isEqualTo("banner");
    }

    @Test
    public void evaluateShouldOnlyResolveRequestedSurface() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("modal", 100, Surface.CENTER_MODAL)));
        EligibilityRequest request = request(fires("modal"));
        request.setSurface(Surface.BANNER);

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request);

        // then
        assertThat(response.getDecisions()).containsExactly(SurfaceDecision.none(Surface.BANNER));
        verifyNoInteractions(frequencyCapStore);
    }

    @Test
    public void evaluateShouldSkipCampaignFailingTargeting() {
        // given
        Campaign mobileOnly = campaign("mobile", 100, Surface.CENTER_MODAL).toBuilder()
            .targetRules(TargetRules.builder()
                .device(TargetRules.DeviceTargeting.builder().deviceClasses(Set.of(DeviceClass.MOBILE)).build())
                .build())
            .build();
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            mobileOnly, campaign("any", 1, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("mobile", "any")));

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("any");
    }

    @Test
    public void evaluateShouldGenerateFireIdWhenClientSendsNone() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("c1", 5, Surface.CENTER_MODAL)));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());
        List<TriggerFire> fires = List.of(TriggerFire.builder().campaignId("c1").build());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires));

        // then
        ArgumentCaptor<String> fireId = ArgumentCaptor.forClass(String.class);
        verify(frequencyCapStore).checkAndReserve(eq("cmp:c1"), eq("v1"), eq("s1"), fireId.capture(), any());
        assertThat(fireId.getValue()).isNotBlank();
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getTriggerFireId()).isEqualTo(fireId.getValue());
    }

    @Test
    public void evaluateShouldShareCapKeyAndFallBackToControlForPausedVariant() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            variantCampaign("arm-a", "A")));
        given(campaignRepository.findExperiment(STORE_ID, "exp-1")).willReturn(Optional.of(experiment()));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());
        EligibilityRequest request = request(fires("arm-a"));
        request.getVisitor().setAssignments(Map.of("exp-1", "B"));

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request);

        // then
        SurfaceDecision decision = response.decisionFor(Surface.CENTER_MODAL);
        assertThat(decision.getCampaign().getId()).isEqualTo("arm-a");
        assertThat(decision.getExperimentId()).isEqualTo("exp-1");
        assertThat(decision.getVariantKey()).isEqualTo("A");
        assertThat(response.getAssignments()).containsEntry("exp-1", "B");
        verify(frequencyCapStore).checkAndReserve(eq("exp:exp-1"), anyString(), anyString(), anyString(), any());
    }

    @Test
    public void evaluateShouldOnlyConsiderAssignedVariant() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            variantCampaign("arm-a", "A"), variantCampaign("arm-b", "B")));
        given(campaignRepository.findExperiment(STORE_ID, "exp-1")).willReturn(Optional.of(experiment()));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());
        EligibilityRequest request = request(fires("arm-a", "arm-b"));
        request.getVisitor().setAssignments(Map.of("exp-1", "B"));

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request);

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("arm-b");
    }

    @Test
    public void evaluateShouldSkipCampaignsOfInactiveExperiment() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            variantCampaign("arm-a", "A"), campaign("plain", 1, Surface.CENTER_MODAL)));
        given(campaignRepository.findExperiment(STORE_ID, "exp-1")).willReturn(Optional.of(
            experiment().toBuilder().status(Experiment.ExperimentStatus.COMPLETED).build()));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("arm-a", "plain")));

        // then
        assertThat(response.decisionFor(Surface.CENTER_MODAL).getCampaign().getId()).isEqualTo("plain");
        assertThat(response.getAssignments()).isEmpty();
    }

    @Test
    public void evaluateShouldReturnTechnicalErrorOnUnexpectedFailure() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willThrow(new IllegalStateException("boom"));

        // when
        EligibilityResponse response = eligibilityService.evaluate(STORE_ID, request(fires("c1")));

        // then
        assertThat(response.getReason()).isEqualTo(NoCampaignReason.TECHNICAL_ERROR);
        assertThat(response.getDecisions()).isEmpty();
    }

    @Test
    public void manifestShouldListTargetedCampaignsWithoutTouchingCaps() {
        // given
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(
            campaign("low", 1, Surface.BANNER),
            campaign("high", 100, Surface.CENTER_MODAL)));

        // when
        CampaignManifest manifest = eligibilityService.manifest(STORE_ID, visitor());

        // then
        assertThat(manifest.getCampaigns()).extracting(CampaignManifest.Entry::getCampaignId)
            .containsExactly("high", "low");
        assertThat(manifest.getCampaigns().get(1).getSurface()).isEqualTo(Surface.BANNER);
        verifyNoInteractions(frequencyCapStore);
    }

    @Test
    public void manifestShouldBeEmptyForInvalidVisitor() {
        // when
        CampaignManifest manifest = eligibilityService.manifest(STORE_ID, VisitorContext.builder().sessionId("s1").build());

        // then
        assertThat(manifest.getCampaigns()).isEmpty();
        verifyNoInteractions(campaignRepository);
    }

    @Test
    public void evaluateShouldApplyGlobalDefaultToCampaignsRespectingGlobalLimits() {
        // given
        properties.setGlobalCap(GlobalCapConfig.builder().maxPerSession(2).build());
        Campaign respecting = campaign("c1", 10, Surface.CENTER_MODAL).toBuilder()
            .frequencyCap(FrequencyCapConfig.builder().maxPerSession(1).respectGlobalLimits(true).build())
            .build();
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(respecting));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        eligibilityService.evaluate(STORE_ID, request(fires("c1")));

        // then
        ArgumentCaptor<FrequencyCapConfig> cfg = ArgumentCaptor.forClass(FrequencyCapConfig.class);
        verify(frequencyCapStore).checkAndReserve(eq("cmp:c1"), eq("v1"), eq("s1"), eq("fire-c1"), cfg.capture());
        assertThat(cfg.getValue().getMaxPerSession()).isEqualTo(1);
        assertThat(cfg.getValue().getCrossCampaignLimits().getMaxPerSession()).isEqualTo(2);
    }

    @Test
    public void evaluateShouldKeepCampaignOwnCrossCampaignLimits() {
        // given
        properties.setGlobalCap(GlobalCapConfig.builder().maxPerSession(2).build());
        GlobalCapConfig own = GlobalCapConfig.builder().maxPerDay(5).build();
        Campaign campaign = campaign("c1", 10, Surface.CENTER_MODAL).toBuilder()
            .frequencyCap(FrequencyCapConfig.builder().respectGlobalLimits(true).crossCampaignLimits(own).build())
            .build();
        given(campaignRepository.findActiveCampaigns(STORE_ID)).willReturn(List.of(campaign));
        given(frequencyCapStore.checkAndReserve(anyString(), anyString(), anyString(), anyString(), any()))
            .willReturn(CapDecision.allowed());

        // when
        eligibilityService.evaluate(STORE_ID, request(fires("c1")));

        // then
        ArgumentCaptor<FrequencyCapConfig> cfg = ArgumentCaptor.forClass(FrequencyCapConfig.class);
        verify(frequencyCapStore).checkAndReserve(anyString(), anyString(), anyString(), anyString(), cfg.capture());
        assertThat(cfg.getValue().getCrossCampaignLimits()).isSameAs(own);
    }

    @Test
    public void capStatusShouldReportDenialWithoutReserving() {
        // given
        given(campaignRepository.findCampaign(STORE_ID, "c1"))
            .willReturn(Optional.of(campaign("c1", 10, Surface.CENTER_MODAL)));
        given(frequencyCapStore.check(eq("cmp:c1"), eq("v1"), eq("s1"), any()))
            .willReturn(CapDecision.denied(DenialReason.SESSION_LIMIT_REACHED));

        // when
        CapStatus status = eligibilityService.capStatus(STORE_ID, "c1", "v1", "s1");

        // then
        assertThat(status.isAllowed()).isFalse();
        assertThat(status.getCapKey()).isEqualTo("cmp:c1");
        assertThat(status.getReason()).isEqualTo("SESSION_LIMIT_REACHED");
        verify(frequencyCapStore, never()).checkAndReserve(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    public void capStatusShouldRejectUnknownCampaignAndMissingIdentity() {
        // given
        given(campaignRepository.findCampaign(STORE_ID, "missing")).willReturn(Optional.empty());

        // when and then
        assertThatThrownBy(() -> eligibilityService.capStatus(STORE_ID, "missing", "v1", "s1"))
            .isInstanceOf(CampaignNotFoundException.class);
        assertThatThrownBy(() -> eligibilityService.capStatus(STORE_ID, "c1", "v1", " "))
            .isInstanceOf(InvalidVisitorContextException.class);
        verifyNoInteractions(frequencyCapStore);
    }

    private static EligibilityRequest request(List<TriggerFire> fires) {
        return EligibilityRequest.builder()
            .visitor(visitor())
            .triggerFires(fires)
            .build();
    }

    private static VisitorContext visitor() {
        return VisitorContext.builder()
            .visitorId("v1")
            .sessionId("s1")
            .deviceClass(DeviceClass.DESKTOP)
            .pageUrl("https://shop.example/")
            .build();
    }

    private static List<TriggerFire> fires(String... campaignIds) {
        return Arrays.stream(campaignIds)
            .map(id -> new TriggerFire(id, "fire-" + id, Instant.parse("2026-03-10T12:00:00Z")))
            .collect(Collectors.toList());
    }

    private static Campaign campaign(String id, int priority, Surface surface) {
        return Campaign.builder()
            .id(id)
            .storeId(STORE_ID)
            .status(Campaign.CampaignStatus.ACTIVE)
            .priority(priority)
            .surface(surface)
            .frequencyCap(FrequencyCapConfig.builder().maxPerSession(1).build())
            .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
            .build();
    }

    private static Campaign variantCampaign(String id, String variantKey) {
        return campaign(id, 10, Surface.CENTER_MODAL).toBuilder()
            .experimentId("exp-1")
            .variantKey(variantKey)
            .build();
    }

    private static Experiment experiment() {
        return Experiment.builder()
            .id("exp-1")
            .storeId(STORE_ID)
            .status(Experiment.ExperimentStatus.ACTIVE)
            .variants(List.of(
                Variant.builder().variantKey("A").control(true).build(),
                Variant.builder().variantKey("B").build()))
            .trafficAllocation(Map.of("A", 50, "B", 50))
            .build();
    }
}
