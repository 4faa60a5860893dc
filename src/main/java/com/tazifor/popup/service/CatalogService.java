package com.tazifor.popup.service;

import com.tazifor.popup.exception.CampaignNotFoundException;
import com.tazifor.popup.exception.ConfigException;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Campaign.CampaignStatus;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.Experiment.ExperimentStatus;
import com.tazifor.popup.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * CatalogService - catalog sync from the authoring side
 *
 * Campaigns and experiments arrive fully formed. The engine only stamps store id
 * and timestamps and validates anything that is (or becomes) ACTIVE, so invalid
 * configuration never reaches eligibility.
 */
@Slf4j
@Service
public class CatalogService {

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private CampaignActivationValidator validator;

    @Autowired
    private Clock clock;

    public Campaign upsertCampaign(String storeId, Campaign campaign) {
        if (StringUtils.isBlank(campaign.getId())) {
            throw new ConfigException("campaign id is required");
        }
        Instant now = clock.instant();
        Optional<Campaign> existing = campaignRepository.findCampaign(storeId, campaign.getId());

        Campaign toSave = campaign.toBuilder()
            .storeId(storeId)
            .status(campaign.getStatus() != null ? campaign.getStatus() : CampaignStatus.DRAFT)
            .createdAt(existing.map(Campaign::getCreatedAt)
                .orElse(campaign.getCreatedAt() != null ? campaign.getCreatedAt() : now))
            .updatedAt(now)
            .build();

        if (toSave.isActive()) {
            validateCampaign(storeId, toSave);
        }
        campaignRepository.saveCampaign(toSave);
        log.info("Campaign {} saved for store {} ({})", toSave.getId(), storeId, toSave.getStatus());
        return toSave;
    }

    public Experiment upsertExperiment(String storeId, Experiment experiment) {
        if (StringUtils.isBlank(experiment.getId())) {
            throw new ConfigException("experiment id is required");
        }
        Optional<Experiment> existing = campaignRepository.findExperiment(storeId, experiment.getId());

        Experiment toSave = experiment.toBuilder()
            .storeId(storeId)
            .status(experiment.getStatus() != null ? experiment.getStatus() : ExperimentStatus.DRAFT)
            .createdAt(existing.map(Experiment::getCreatedAt)
                .orElse(experiment.getCreatedAt() != null ? experiment.getCreatedAt() : clock.instant()))
            .build();

        if (toSave.isActive()) {
            validator.validateExperiment(toSave);
        }
        campaignRepository.saveExperiment(toSave);
        log.info("Experiment {} saved for store {} ({})", toSave.getId(), storeId, toSave.getStatus());
        return toSave;
    }

    public Campaign activateCampaign(String storeId, String campaignId) {
        Campaign campaign = requireCampaign(storeId, campaignId);
        Campaign activated = campaign.toBuilder()
            .status(CampaignStatus.ACTIVE)
            .updatedAt(clock.instant())
            .build();
        validateCampaign(storeId, activated);
        campaignRepository.saveCampaign(activated);
        log.info("Campaign {} activated for store {}", campaignId, storeId);
        return activated;
    }

    public Campaign deactivateCampaign(String storeId, String campaignId) {
        Campaign paused = requireCampaign(storeId, campaignId).toBuilder()
            .status(CampaignStatus.PAUSED)
            .updatedAt(clock.instant())
            .build();
        campaignRepository.saveCampaign(paused);
        log.info("Campaign {} deactivated for store {}", campaignId, storeId);
        return paused;
    }

    public Experiment activateExperiment(String storeId, String experimentId) {
        Experiment experiment = campaignRepository.findExperiment(storeId, experimentId)
            .orElseThrow(() -> new ConfigException("experiment " + experimentId + " does not exist"));
        Experiment activated = experiment.toBuilder().status(ExperimentStatus.ACTIVE).build();
        validator.validateExperiment(activated);
        campaignRepository.saveExperiment(activated);
        log.info("Experiment {} activated for store {}", experimentId, storeId);
        return activated;
    }

    private void validateCampaign(String storeId, Campaign campaign) {
        Optional<Experiment> experiment = campaign.isInExperiment()
            ? campaignRepository.findExperiment(storeId, campaign.getExperimentId())
            : Optional.empty();
        validator.validateCampaign(campaign, experiment);
    }

    private Campaign requireCampaign(String storeId, String campaignId) {
        return campaignRepository.findCampaign(storeId, campaignId)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }
}
