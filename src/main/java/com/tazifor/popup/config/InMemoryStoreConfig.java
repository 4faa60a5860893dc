package com.tazifor.popup.config;

import com.tazifor.popup.capping.FrequencyCapStore;
import com.tazifor.popup.capping.InMemoryFrequencyCapStore;
import com.tazifor.popup.experiment.ExperimentAssignmentStore;
import com.tazifor.popup.experiment.InMemoryExperimentAssignmentStore;
import com.tazifor.popup.impression.ImpressionStore;
import com.tazifor.popup.impression.InMemoryImpressionStore;
import com.tazifor.popup.repository.CampaignRepository;
import com.tazifor.popup.repository.InMemoryCampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single-node backend: every store lives in this JVM. Active when {@code popup.store=memory}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "popup", name = "store", havingValue = "memory")
public class InMemoryStoreConfig {

    @Bean
    public FrequencyCapStore frequencyCapStore(PopupEngineProperties properties, Clock clock) {
        log.info("Using in-memory stores (max {} entries each)", properties.getMemoryMaxEntries());
        return new InMemoryFrequencyCapStore(clock, properties.getSessionTtl(), properties.getMemoryMaxEntries());
    }

    @Bean
    public ExperimentAssignmentStore experimentAssignmentStore(PopupEngineProperties properties, Clock clock) {
        return new InMemoryExperimentAssignmentStore(clock, properties.getAssignmentTtl(),
            properties.getMemoryMaxEntries());
    }

    @Bean
    public ImpressionStore impressionStore(PopupEngineProperties properties, Clock clock) {
        return new InMemoryImpressionStore(clock, properties.getImpressionTtl(), properties.getMemoryMaxEntries());
    }

    @Bean
    public CampaignRepository campaignRepository() {
        return new InMemoryCampaignRepository();
    }
}
