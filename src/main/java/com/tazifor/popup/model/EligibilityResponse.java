package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Eligibility Response
 *
 * One decision per resolved surface, plus the experiment tokens the client must
 * persist so later page views reuse the same variants.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EligibilityResponse {

    private List<SurfaceDecision> decisions;
    private Map<String, String> assignments;

    /**
     * Set when nothing could be selected for a reason other than "no candidate won".
     */
    private NoCampaignReason reason;

    /**
     * Decision for one display surface. {@code campaign} is null when nothing shows.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SurfaceDecision {
        private Surface surface;
        private Campaign campaign;
        private String experimentId;
        private String variantKey;
        private String triggerFireId;
        private boolean discountRequired;

        public static SurfaceDecision none(Surface surface) {
            return SurfaceDecision.builder().surface(surface).build();
        }
    }

    public enum NoCampaignReason {
        INVALID_VISITOR_CONTEXT,
        NO_ACTIVE_CAMPAIGNS,
        TECHNICAL_ERROR
    }

    public static EligibilityResponse noCampaign(Surface surface, NoCampaignReason reason) {
        return EligibilityResponse.builder()
            .decisions(surface != null ? List.of(SurfaceDecision.none(surface)) : List.of())
            .assignments(Map.of())
            .reason(reason)
            .build();
    }

    public SurfaceDecision decisionFor(Surface surface) {
        if (decisions == null) {
            return null;
        }
        return decisions.stream()
            .filter(d -> d.getSurface() == surface)
            .findFirst()
            .orElse(null);
    }
}
