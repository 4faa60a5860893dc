package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A/B(/C...) test definition.
 *
 * The experiment exclusively owns its variants. Campaigns point back at it only
 * through {@code (experimentId, variantKey)}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Experiment {

    private String id;
    private String storeId;
    private String name;
    private ExperimentStatus status;

    private List<Variant> variants;

    /**
     * Percentage per variantKey. Must sum to 100, checked when the experiment is activated.
     */
    private Map<String, Integer> trafficAllocation;

    private Instant createdAt;

    public enum ExperimentStatus {
        DRAFT,
        ACTIVE,
        COMPLETED
    }

    @JsonIgnore
    public boolean isActive() {
        return status == ExperimentStatus.ACTIVE;
    }

    /**
     * Variants sorted by variantKey, the order buckets are laid out in.
     */
    @JsonIgnore
    public List<Variant> getCanonicalVariants() {
        if (variants == null) {
            return List.of();
        }
        return variants.stream()
            .sorted(Comparator.comparing(Variant::getVariantKey))
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public Optional<Variant> getControlVariant() {
        if (variants == null) {
            return Optional.empty();
        }
        return variants.stream().filter(Variant::isControl).findFirst();
    }

    public boolean hasVariant(String variantKey) {
        return variants != null && variantKey != null
            && variants.stream().anyMatch(v -> variantKey.equals(v.getVariantKey()));
    }

    public int allocationOf(String variantKey) {
        if (trafficAllocation == null) {
            return 0;
        }
        Integer percent = trafficAllocation.get(variantKey);
        return percent != null ? percent : 0;
    }
}
