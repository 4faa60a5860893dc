package com.tazifor.popup.repository;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Experiment;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryCampaignRepository implements CampaignRepository {

    private final Map<String, Campaign> campaigns = new ConcurrentHashMap<>();
    private final Map<String, Experiment> experiments = new ConcurrentHashMap<>();

    @Override
    public List<Campaign> findActiveCampaigns(String storeId) {
        return campaigns.values().stream()
            .filter(campaign -> storeId.equals(campaign.getStoreId()))
            .filter(Campaign::isActive)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Campaign> findCampaign(String storeId, String campaignId) {
        return Optional.ofNullable(campaigns.get(keyOf(storeId, campaignId)));
    }

    @Override
    public Optional<Experiment> findExperiment(String storeId, String experimentId) {
        return Optional.ofNullable(experiments.get(keyOf(storeId, experimentId)));
    }

    @Override
    public Campaign saveCampaign(Campaign campaign) {
        campaigns.put(keyOf(campaign.getStoreId(), campaign.getId()), campaign);
        return campaign;
    }

    @Override
    public Experiment saveExperiment(Experiment experiment) {
        experiments.put(keyOf(experiment.getStoreId(), experiment.getId()), experiment);
        return experiment;
    }

    private static String keyOf(String storeId, String id) {
        return storeId + ":" + id;
    }
}
