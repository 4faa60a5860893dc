package com.tazifor.popup.repository;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Experiment;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the campaign catalog, plus the write calls used by catalog sync.
 */
public interface CampaignRepository {

    List<Campaign> findActiveCampaigns(String storeId);

    Optional<Campaign> findCampaign(String storeId, String campaignId);

    Optional<Experiment> findExperiment(String storeId, String experimentId);

    Campaign saveCampaign(Campaign campaign);

    Experiment saveExperiment(Experiment experiment);
}
