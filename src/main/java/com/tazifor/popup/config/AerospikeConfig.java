package com.tazifor.popup.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Host;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.CommitLevel;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.popup.capping.AerospikeFrequencyCapStore;
import com.tazifor.popup.capping.FrequencyCapStore;
import com.tazifor.popup.experiment.AerospikeExperimentAssignmentStore;
import com.tazifor.popup.experiment.ExperimentAssignmentStore;
import com.tazifor.popup.impression.AerospikeImpressionStore;
import com.tazifor.popup.impression.ImpressionStore;
import com.tazifor.popup.repository.AerospikeCampaignRepository;
import com.tazifor.popup.repository.CampaignRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Aerospike Configuration
 *
 * Client tuned for the storefront hot path: short timeouts, because a slow
 * store must never delay a page. Active when {@code popup.store=aerospike}
 * (the default).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "popup", name = "store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeConfig {

    @Value("${aerospike.hosts:localhost:3000}")
    private String hosts;

    @Value("${aerospike.namespace:popup}")
    private String namespace;

    @Value("${aerospike.timeout-ms:50}")
    private int timeoutMs;

    @Bean(destroyMethod = "close")
    public IAerospikeClient aerospikeClient() {
        ClientPolicy policy = new ClientPolicy();
        policy.maxConnsPerNode = 300;
        policy.connPoolsPerNode = 1;
        policy.readPolicyDefault.totalTimeout = timeoutMs;
        policy.writePolicyDefault.totalTimeout = timeoutMs;

        AerospikeClient client = new AerospikeClient(policy, parseHosts(hosts));

        log.info("Connected to Aerospike {} (namespace {}, {} nodes)",
            hosts, namespace, client.getNodes().length);
        return client;
    }

    /**
     * Write policy for cap counters: committed on the master before we answer.
     */
    @Bean("capWritePolicy")
    public WritePolicy capWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = timeoutMs;
        policy.sendKey = true;
        policy.commitLevel = CommitLevel.COMMIT_MASTER;
        return policy;
    }

    @Bean("defaultWritePolicy")
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = timeoutMs;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public FrequencyCapStore frequencyCapStore(IAerospikeClient client,
                                               @Qualifier("capWritePolicy") WritePolicy capWritePolicy,
                                               PopupEngineProperties properties,
                                               Clock clock) {
        return new AerospikeFrequencyCapStore(client, capWritePolicy, namespace, clock,
            properties.getSessionTtl(), properties.getStoreMaxRetries());
    }

    @Bean
    public ExperimentAssignmentStore experimentAssignmentStore(IAerospikeClient client,
                                                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                                               PopupEngineProperties properties) {
        return new AerospikeExperimentAssignmentStore(client, writePolicy, namespace, properties.getAssignmentTtl());
    }

    @Bean
    public ImpressionStore impressionStore(IAerospikeClient client,
                                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                           PopupEngineProperties properties) {
        return new AerospikeImpressionStore(client, writePolicy, namespace, properties.getImpressionTtl());
    }

    @Bean
    public CampaignRepository campaignRepository(IAerospikeClient client,
                                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                                 ObjectMapper objectMapper,
                                                 PopupEngineProperties properties,
                                                 Clock clock) {
        return new AerospikeCampaignRepository(client, writePolicy, namespace, objectMapper, clock,
            properties.getCampaignCacheTtl());
    }

    static Host[] parseHosts(String hosts) {
        List<Host> hostList = new ArrayList<>();
        for (String hostPart : hosts.split(",")) {
            String[] parts = hostPart.trim().split(":");
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 3000;
            hostList.add(new Host(parts[0], port));
        }
        return hostList.toArray(new Host[0]);
    }
}
