package com.tazifor.popup.impression;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.tazifor.popup.exception.TransientStoreException;
import com.tazifor.popup.model.ImpressionRecord;

import java.time.Duration;

/**
 * Impression ledger in Aerospike.
 *
 * IDEMPOTENCY: the record key is the dedupe key and writes are CREATE_ONLY, so a
 * retried report fails with KEY_EXISTS_ERROR instead of counting twice.
 */
public class AerospikeImpressionStore implements ImpressionStore {

    static final String IMPRESSION_SET = "impressions";

    private final IAerospikeClient client;
    private final WritePolicy defaultWritePolicy;
    private final String namespace;
    private final Duration ttl;

    public AerospikeImpressionStore(IAerospikeClient client,
                                    WritePolicy defaultWritePolicy,
                                    String namespace,
                                    Duration ttl) {
        this.client = client;
        this.defaultWritePolicy = defaultWritePolicy;
        this.namespace = namespace;
        this.ttl = ttl;
    }

    @Override
    public boolean recordIfAbsent(ImpressionRecord record) {
        WritePolicy policy = new WritePolicy(defaultWritePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.expiration = (int) Math.min(Integer.MAX_VALUE, ttl.toSeconds());

        try {
            client.put(policy, new Key(namespace, IMPRESSION_SET, record.dedupeKey()),
                new Bin("cid", record.getCampaignId()),
                new Bin("vid", record.getVisitorId()),
                new Bin("sid", record.getSessionId()),
                new Bin("fire", record.getTriggerFireId()),
                new Bin("ts", record.getTimestamp().toEpochMilli()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw new TransientStoreException("Impression write failed for campaign " + record.getCampaignId(), e);
        }
    }
}
