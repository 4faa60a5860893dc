package com.tazifor.popup.repository;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Experiment;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * AerospikeCampaignRepository - catalog with a local read cache
 *
 * STORAGE:
 * Each campaign/experiment is one record whose "data" bin holds its JSON, keyed
 * by "storeId:id". "store" and "status" bins are kept alongside for ad-hoc queries.
 *
 * CACHE:
 * Eligibility reads every active campaign of a store on every request, so the
 * whole catalog is held in memory and rescanned once the TTL has passed.
 * Writes go through to Aerospike and update the cache immediately.
 */
@Slf4j
public class AerospikeCampaignRepository implements CampaignRepository {

    static final String CAMPAIGN_SET = "campaigns";
    static final String EXPERIMENT_SET = "experiments";

    private final IAerospikeClient client;
    private final WritePolicy writePolicy;
    private final String namespace;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long cacheTtlMillis;

    private final Map<String, Campaign> campaignCache = new ConcurrentHashMap<>();
    private final Map<String, Experiment> experimentCache = new ConcurrentHashMap<>();
    private volatile long lastCacheRefresh = 0;

    public AerospikeCampaignRepository(IAerospikeClient client,
                                       WritePolicy writePolicy,
                                       String namespace,
                                       ObjectMapper objectMapper,
                                       Clock clock,
                                       Duration cacheTtl) {
        this.client = client;
        this.writePolicy = writePolicy;
        this.namespace = namespace;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cacheTtlMillis = cacheTtl.toMillis();
    }

    @Override
    public List<Campaign> findActiveCampaigns(String storeId) {
        refreshCacheIfNeeded();
        return campaignCache.values().stream()
            .filter(campaign -> storeId.equals(campaign.getStoreId()))
            .filter(Campaign::isActive)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<Campaign> findCampaign(String storeId, String campaignId) {
        refreshCacheIfNeeded();
        return Optional.ofNullable(campaignCache.get(keyOf(storeId, campaignId)));
    }

    @Override
    public Optional<Experiment> findExperiment(String storeId, String experimentId) {
        refreshCacheIfNeeded();
        return Optional.ofNullable(experimentCache.get(keyOf(storeId, experimentId)));
    }

    @Override
    public Campaign saveCampaign(Campaign campaign) {
        String id = keyOf(campaign.getStoreId(), campaign.getId());
        write(CAMPAIGN_SET, id, campaign, campaign.getStoreId(), String.valueOf(campaign.getStatus()));
        campaignCache.put(id, campaign);
        return campaign;
    }

    @Override
    public Experiment saveExperiment(Experiment experiment) {
        String id = keyOf(experiment.getStoreId(), experiment.getId());
        write(EXPERIMENT_SET, id, experiment, experiment.getStoreId(), String.valueOf(experiment.getStatus()));
        experimentCache.put(id, experiment);
        return experiment;
    }

    /**
     * Rescan both sets if the cache is older than its TTL.
     *
     * Double-checked so that concurrent requests trigger a single scan.
     */
    void refreshCacheIfNeeded() {
        long now = clock.millis();
        if (lastCacheRefresh != 0 && now - lastCacheRefresh < cacheTtlMillis) {
            return;
        }
        synchronized (this) {
            if (lastCacheRefresh != 0 && now - lastCacheRefresh < cacheTtlMillis) {
                return;
            }
            try {
                load(CAMPAIGN_SET, Campaign.class, campaignCache, c -> keyOf(c.getStoreId(), c.getId()));
                load(EXPERIMENT_SET, Experiment.class, experimentCache, e -> keyOf(e.getStoreId(), e.getId()));
                log.info("Catalog cache refreshed: {} campaigns, {} experiments",
                    campaignCache.size(), experimentCache.size());
            } catch (AerospikeException e) {
                // keep serving the previous snapshot; retry after the next TTL
                log.warn("Catalog cache refresh failed: {}", e.getMessage());
            }
            lastCacheRefresh = now;
        }
    }

    private <T> void load(String set, Class<T> type, Map<String, T> cache, Function<T, String> keyFn) {
        ScanPolicy policy = new ScanPolicy();
        policy.maxRecords = 10_000;

        Map<String, T> loaded = new ConcurrentHashMap<>();
        client.scanAll(policy, namespace, set, (key, record) -> {
            T value = fromRecord(record, type);
            if (value != null) {
                loaded.put(keyFn.apply(value), value);
            }
        });

        cache.keySet().retainAll(loaded.keySet());
        cache.putAll(loaded);
    }

    private void write(String set, String id, Object value, String storeId, String status) {
        try {
            Key key = new Key(namespace, set, id);
            client.put(writePolicy, key,
                new Bin("data", objectMapper.writeValueAsString(value)),
                new Bin("store", storeId),
                new Bin("status", status));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + id, e);
        } catch (AerospikeException e) {
            throw new TransientStoreException("Catalog write failed for " + id, e);
        }
    }

    private <T> T fromRecord(Record record, Class<T> type) {
        try {
            return objectMapper.readValue(record.getString("data"), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable {} record: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    private static String keyOf(String storeId, String id) {
        return storeId + ":" + id;
    }
}
