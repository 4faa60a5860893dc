package com.tazifor.popup.service;

import com.tazifor.popup.capping.CapDecision;
import com.tazifor.popup.capping.FrequencyCapStore;
import com.tazifor.popup.config.PopupEngineProperties;
import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.InvalidVisitorContextException;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.experiment.StickyAssignmentService;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.CampaignManifest;
import com.tazifor.popup.model.CapStatus;
import com.tazifor.popup.model.EligibilityRequest;
import com.tazifor.popup.model.EligibilityResponse;
import com.tazifor.popup.model.EligibilityResponse.NoCampaignReason;
import com.tazifor.popup.model.EligibilityResponse.SurfaceDecision;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.FrequencyCapConfig;
import com.tazifor.popup.model.Surface;
import com.tazifor.popup.model.TriggerFire;
import com.tazifor.popup.model.VisitorContext;
import com.tazifor.popup.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * EligibilityService - which popup (if any) shows on each surface
 *
 * FLOW:
 * 1. Validate visitor identity (no identity, no campaign)
 * 2. Load the store's active campaigns (cached catalog)
 * 3. Filter by targeting
 * 4. Resolve experiments: sticky variant, fallback if its campaign is inactive
 * 5. Keep campaigns whose trigger fired on the client
 * 6. Rank per surface (priority desc, createdAt asc, id asc)
 * 7. Walk each ranked list and atomically reserve a cap slot for the first
 *    candidate the cap store allows
 *
 * RESERVATION:
 * Only the campaign that is returned consumes an impression. A higher-priority
 * campaign that is capped out hands the surface to the next one.
 *
 * FAILURE MODES:
 * - Cap store unreachable: fail open (Allowed), WARN logged
 * - Anything else: "no campaign" with TECHNICAL_ERROR; the storefront never sees an error
 */
@Slf4j
@Service
public class EligibilityService {

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private TargetingService targetingService;

    @Autowired
    private StickyAssignmentService assignmentService;

    @Autowired
    private PriorityResolver priorityResolver;

    @Autowired
    private FrequencyCapStore frequencyCapStore;

    @Autowired
    private PopupEngineProperties properties;

    public EligibilityResponse evaluate(String storeId, EligibilityRequest request) {
        long startTime = System.nanoTime();
        Surface requestedSurface = request.getSurface();

        try {
            // STEP 1: Identity
            VisitorContext visitor = requireIdentity(request.getVisitor());

            // STEP 2-4: Catalog, targeting, experiments
            List<Campaign> active = campaignRepository.findActiveCampaigns(storeId);
            if (active.isEmpty()) {
                return EligibilityResponse.noCampaign(requestedSurface, NoCampaignReason.NO_ACTIVE_CAMPAIGNS);
            }
            Map<String, String> assignments = new LinkedHashMap<>();
            List<Campaign> eligible = eligibleCampaigns(storeId, active, visitor, assignments);

            // STEP 5: Trigger fires
            Map<String, TriggerFire> fires = firesByCampaign(request.getTriggerFires());
            List<Candidate> candidates = eligible.stream()
                .filter(campaign -> fires.containsKey(campaign.getId()))
                .filter(campaign -> requestedSurface == null || campaign.getEffectiveSurface() == requestedSurface)
                .map(campaign -> new Candidate(campaign, fires.get(campaign.getId()).getFireId()))
                .collect(Collectors.toList());

            // STEP 6-7: Rank and reserve
            List<SurfaceDecision> decisions = new ArrayList<>();
            Map<Surface, List<Candidate>> ranked = priorityResolver.rankBySurface(candidates);
            ranked.forEach((surface, list) ->
                firstAllowed(list, visitor).ifPresent(winner -> decisions.add(toDecision(winner))));

            if (requestedSurface != null && decisions.isEmpty()) {
                decisions.add(SurfaceDecision.none(requestedSurface));
            }

            long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
            log.debug("Eligibility {}ms | store {} | {} active, {} eligible, {} fired | winners {}",
                latencyMs, storeId, active.size(), eligible.size(), candidates.size(),
                decisions.stream()
                    .map(d -> d.getSurface() + "=" + (d.getCampaign() != null ? d.getCampaign().getId() : "none"))
                    .collect(Collectors.toList()));

            return EligibilityResponse.builder()
                .decisions(decisions)
                .assignments(assignments)
                .build();

        } catch (InvalidVisitorContextException e) {
            log.debug("No campaign for store {}: {}", storeId, e.getMessage());
            return EligibilityResponse.noCampaign(requestedSurface, NoCampaignReason.INVALID_VISITOR_CONTEXT);
        } catch (RuntimeException e) {
            log.error("Eligibility evaluation failed for store {}", storeId, e);
            return EligibilityResponse.noCampaign(requestedSurface, NoCampaignReason.TECHNICAL_ERROR);
        }
    }

    /**
     * Preflight: targeted campaigns (one variant per experiment) with the trigger
     * configuration the storefront must watch. Touches no cap counters.
     */
    public CampaignManifest manifest(String storeId, VisitorContext visitor) {
        if (visitor == null || !visitor.hasIdentity()) {
            log.debug("Empty manifest for store {}: visitorId and sessionId are required", storeId);
            return CampaignManifest.builder().campaigns(List.of()).assignments(Map.of()).build();
        }
        Map<String, String> assignments = new LinkedHashMap<>();

        List<CampaignManifest.Entry> entries = eligibleCampaigns(storeId,
                campaignRepository.findActiveCampaigns(storeId), visitor, assignments).stream()
            .sorted(PriorityResolver.PRIORITY_ORDER)
            .map(campaign -> CampaignManifest.Entry.builder()
                .campaignId(campaign.getId())
                .surface(campaign.getEffectiveSurface())
                .priority(campaign.getEffectivePriority())
                .triggerConfig(campaign.getTriggerConfig())
                .deviceTargeting(campaign.getTargetRules() != null ? campaign.getTargetRules().getDevice() : null)
                .build())
            .collect(Collectors.toList());

        return CampaignManifest.builder()
            .campaigns(entries)
            .assignments(assignments)
            .build();
    }

    /**
     * Cap diagnostics: would the cap store allow this campaign for this visitor
     * now? Reads counters only.
     */
    public CapStatus capStatus(String storeId, String campaignId, String visitorId, String sessionId) {
        if (StringUtils.isAnyBlank(visitorId, sessionId)) {
            throw new InvalidVisitorContextException("visitorId and sessionId are required");
        }
        Campaign campaign = campaignRepository.findCampaign(storeId, campaignId)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));

        CapDecision decision = frequencyCapStore.check(
            campaign.getCapTrackingKey(), visitorId, sessionId, capConfigOf(campaign));
        return CapStatus.builder()
            .campaignId(campaignId)
            .capKey(campaign.getCapTrackingKey())
            .allowed(decision.isAllowed())
            .reason(decision.getReason() != null ? decision.getReason().name() : null)
            .build();
    }

    /**
     * Targeted campaigns after experiment resolution. Records every assignment
     * made (or reused) into {@code assignments}.
     */
    List<Campaign> eligibleCampaigns(String storeId,
                                     List<Campaign> active,
                                     VisitorContext visitor,
                                     Map<String, String> assignments) {
        List<Campaign> targeted = active.stream()
            .filter(campaign -> targetingService.matchesTargeting(campaign, visitor))
            .collect(Collectors.toList());

        List<Campaign> eligible = new ArrayList<>();
        Map<String, List<Campaign>> byExperiment = new LinkedHashMap<>();
        for (Campaign campaign : targeted) {
            if (campaign.isInExperiment()) {
                byExperiment.computeIfAbsent(campaign.getExperimentId(), id -> new ArrayList<>()).add(campaign);
            } else {
                eligible.add(campaign);
            }
        }

        byExperiment.forEach((experimentId, arms) ->
            resolveExperiment(storeId, experimentId, active, visitor, assignments)
                .ifPresent(variantKey -> arms.stream()
                    .filter(campaign -> variantKey.equals(campaign.getVariantKey()))
                    .forEach(eligible::add)));

        return eligible;
    }

    /**
     * @return the variant whose campaign may show, empty if the experiment is
     *         ineligible for this visitor
     */
    private Optional<String> resolveExperiment(String storeId,
                                               String experimentId,
                                               List<Campaign> active,
                                               VisitorContext visitor,
                                               Map<String, String> assignments) {
        Optional<Experiment> experiment = campaignRepository.findExperiment(storeId, experimentId)
            .filter(Experiment::isActive);
        if (experiment.isEmpty()) {
            log.debug("Experiment {} is not active, skipping its campaigns", experimentId);
            return Optional.empty();
        }

        String assigned = assignmentService.assign(experiment.get(), visitor);
        assignments.put(experimentId, assigned);

        Set<String> activeVariants = active.stream()
            .filter(campaign -> experimentId.equals(campaign.getExperimentId()))
            .map(Campaign::getVariantKey)
            .filter(StringUtils::isNotBlank)
            .collect(Collectors.toSet());
        return assignmentService.effectiveVariant(experiment.get(), assigned, activeVariants);
    }

    private Optional<Candidate> firstAllowed(List<Candidate> ranked, VisitorContext visitor) {
        for (Candidate candidate : ranked) {
            Campaign campaign = candidate.getCampaign();
            CapDecision decision;
            try {
                decision = frequencyCapStore.checkAndReserve(
                    campaign.getCapTrackingKey(),
                    visitor.getVisitorId(),
                    visitor.getSessionId(),
                    candidate.getTriggerFireId(),
                    capConfigOf(campaign));
            } catch (TransientStoreException e) {
                log.warn("Frequency cap store unavailable, allowing campaign {}: {}",
                    campaign.getId(), e.getMessage());
                decision = CapDecision.failedOpen();
            }

            if (decision.isAllowed()) {
                return Optional.of(candidate);
            }
            log.debug("Campaign {} capped for visitor {}: {}",
                campaign.getId(), visitor.getVisitorId(), decision.getReason());
        }
        return Optional.empty();
    }

    private FrequencyCapConfig capConfigOf(Campaign campaign) {
        return campaign.getEffectiveFrequencyCap().withGlobalDefault(properties.getGlobalCap());
    }

    private static SurfaceDecision toDecision(Candidate winner) {
        Campaign campaign = winner.getCampaign();
        return SurfaceDecision.builder()
            .surface(winner.getSurface())
            .campaign(campaign)
            .experimentId(campaign.getExperimentId())
            .variantKey(campaign.getVariantKey())
            .triggerFireId(winner.getTriggerFireId())
            .discountRequired(campaign.getDiscount() != null && campaign.getDiscount().isEnabled())
            .build();
    }

    private static Map<String, TriggerFire> firesByCampaign(List<TriggerFire> fires) {
        Map<String, TriggerFire> byCampaign = new LinkedHashMap<>();
        if (fires != null) {
            for (TriggerFire fire : fires) {
                if (fire == null || fire.getCampaignId() == null) {
                    continue;
                }
                if (StringUtils.isBlank(fire.getFireId())) {
                    // older clients send no fire id; such fires are not retry-safe
                    fire = fire.toBuilder().fireId(UUID.randomUUID().toString()).build();
                }
                byCampaign.putIfAbsent(fire.getCampaignId(), fire);
            }
        }
        return byCampaign;
    }

    static VisitorContext requireIdentity(VisitorContext visitor) {
        if (visitor == null || !visitor.hasIdentity()) {
            throw new InvalidVisitorContextException("visitorId and sessionId are required");
        }
        return visitor;
    }
}
