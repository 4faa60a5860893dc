package com.tazifor.popup.experiment;

import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.Variant;
import org.apache.commons.codec.digest.MurmurHash3;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * ExperimentAssigner - deterministic variant bucketing
 *
 * HOW IT WORKS:
 * 1. Hash "experimentId:visitorId" with MurmurHash3 (x86, 32 bit)
 * 2. Read the hash as unsigned and scale it into [0, 100)
 * 3. Walk the variants sorted by variantKey, accumulating their allocation
 * 4. The first variant whose cumulative boundary exceeds the bucket wins
 *
 * EXAMPLE: A=50, B=50
 *   bucket 12.7 -> A  (12.7 < 50)
 *   bucket 50.0 -> B  (50.0 < 100)
 *
 * Same inputs always give the same variant, on any node and after any restart.
 * Stickiness across allocation changes is handled by {@link StickyAssignmentService},
 * not here.
 */
public class ExperimentAssigner {

    private static final double HASH_SPACE = 4294967296.0; // 2^32

    public String assign(Experiment experiment, String visitorId) {
        List<Variant> variants = experiment.getCanonicalVariants();
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("Experiment " + experiment.getId() + " has no variants");
        }
        return variantForBucket(experiment, bucketOf(experiment.getId(), visitorId));
    }

    /**
     * Bucket in [0, 100) for this (experiment, visitor).
     */
    public double bucketOf(String experimentId, String visitorId) {
        byte[] input = (experimentId + ":" + visitorId).getBytes(StandardCharsets.UTF_8);
        long unsigned = Integer.toUnsignedLong(MurmurHash3.hash32x86(input));
        return unsigned / HASH_SPACE * 100.0;
    }

    String variantForBucket(Experiment experiment, double bucket) {
        List<Variant> variants = experiment.getCanonicalVariants();
        int cumulative = 0;
        for (Variant variant : variants) {
            cumulative += experiment.allocationOf(variant.getVariantKey());
            if (bucket < cumulative) {
                return variant.getVariantKey();
            }
        }
        // allocations sum to 100 on an activated experiment; guard against rounding at the top edge
        return variants.get(variants.size() - 1).getVariantKey();
    }
}
