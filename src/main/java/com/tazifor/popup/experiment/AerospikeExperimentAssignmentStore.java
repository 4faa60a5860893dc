package com.tazifor.popup.experiment;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.tazifor.popup.exception.TransientStoreException;

import java.time.Duration;
import java.util.Optional;

/**
 * Assignment mirror in Aerospike, one record per (visitor, experiment).
 *
 * FIRST WRITER WINS: records are written CREATE_ONLY. When two tabs race, the
 * loser gets KEY_EXISTS_ERROR and adopts the stored variant.
 */
public class AerospikeExperimentAssignmentStore implements ExperimentAssignmentStore {

    static final String ASSIGNMENT_SET = "assignments";
    private static final String VARIANT_BIN = "variant";

    private final IAerospikeClient client;
    private final WritePolicy defaultWritePolicy;
    private final String namespace;
    private final Duration ttl;

    public AerospikeExperimentAssignmentStore(IAerospikeClient client,
                                              WritePolicy defaultWritePolicy,
                                              String namespace,
                                              Duration ttl) {
        this.client = client;
        this.defaultWritePolicy = defaultWritePolicy;
        this.namespace = namespace;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> find(String experimentId, String visitorId) {
        try {
            Record record = client.get(null, keyOf(experimentId, visitorId), VARIANT_BIN);
            return record == null ? Optional.empty() : Optional.ofNullable(record.getString(VARIANT_BIN));
        } catch (AerospikeException e) {
            throw new TransientStoreException("Assignment read failed for experiment " + experimentId, e);
        }
    }

    @Override
    public String putIfAbsent(String experimentId, String visitorId, String variantKey) {
        WritePolicy policy = new WritePolicy(defaultWritePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.expiration = (int) Math.min(Integer.MAX_VALUE, ttl.toSeconds());

        try {
            client.put(policy, keyOf(experimentId, visitorId), new Bin(VARIANT_BIN, variantKey));
            return variantKey;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return find(experimentId, visitorId).orElse(variantKey);
            }
            throw new TransientStoreException("Assignment write failed for experiment " + experimentId, e);
        }
    }

    private Key keyOf(String experimentId, String visitorId) {
        return new Key(namespace, ASSIGNMENT_SET, visitorId + ":" + experimentId);
    }
}
