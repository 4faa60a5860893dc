package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Targeting Rules
 *
 * Every section is optional. A missing (or disabled) section matches every request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetRules {

    private PageTargeting page;
    private AudienceTargeting audience;
    private DeviceTargeting device;
    private GeoTargeting geo;

    /**
     * Page targeting: URL wildcard patterns plus product/collection predicates.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageTargeting {
        private List<String> includePatterns;   // '*' and '?' wildcards, full-URL match
        private List<String> excludePatterns;   // Exclusion wins over inclusion
        private Set<String> productTags;        // Any tag on the current product
        private Set<String> collectionIds;      // Numeric ids or GIDs
    }

    /**
     * Audience targeting: new vs. returning plus session-attribute conditions.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AudienceTargeting {
        private VisitorType visitorType;
        private List<SessionCondition> sessionConditions;
        private LogicOperator conditionOperator;

        @JsonIgnore
        public LogicOperator getEffectiveOperator() {
            return conditionOperator != null ? conditionOperator : LogicOperator.AND;
        }
    }

    public enum VisitorType {
        ALL,
        NEW,
        RETURNING
    }

    /**
     * Condition over one session attribute, e.g. {@code cartValue gte 50}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionCondition {
        private String field;
        private ConditionOperator operator;
        private Object value;
    }

    public enum ConditionOperator {
        EQ, NE, GT, GTE, LT, LTE, IN, NIN
    }

    /**
     * Device targeting. An empty set allows every device class.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeviceTargeting {
        private Set<DeviceClass> deviceClasses;

        public boolean allows(DeviceClass deviceClass) {
            if (deviceClasses == null || deviceClasses.isEmpty()) {
                return true;
            }
            return deviceClass != null && deviceClasses.contains(deviceClass);
        }
    }

    /**
     * Country targeting by ISO-3166 alpha-2 code.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GeoTargeting {
        private GeoMode mode;
        private Set<String> countries;
    }

    public enum GeoMode {
        INCLUDE,
        EXCLUDE
    }
}
