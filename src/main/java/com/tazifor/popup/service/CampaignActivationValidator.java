package com.tazifor.popup.service;

import com.tazifor.popup.exception.ConfigException;
import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Experiment;
import com.tazifor.popup.model.FrequencyCapConfig;
import com.tazifor.popup.model.GlobalCapConfig;
import com.tazifor.popup.model.TargetRules;
import com.tazifor.popup.model.Variant;
import com.tazifor.popup.trigger.TriggerConfig;
import com.tazifor.popup.trigger.TriggerSpec;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * CampaignActivationValidator
 *
 * Runs when a campaign or experiment is switched to ACTIVE. Everything that can
 * be wrong with a configuration is caught here, so the decision path never has
 * to reject anything. All violations are collected and reported together.
 */
@Component
public class CampaignActivationValidator {

    private static final int ALLOCATION_TOTAL = 100;

    /**
     * @param experiment the experiment the campaign references, if it has one
     * @throws ConfigException listing every violation found
     */
    public void validateCampaign(Campaign campaign, Optional<Experiment> experiment) {
        List<String> violations = new ArrayList<>();

        if (StringUtils.isBlank(campaign.getId())) {
            violations.add("campaign id is required");
        }
        if (StringUtils.isBlank(campaign.getStoreId())) {
            violations.add("storeId is required");
        }
        if (campaign.getPriority() != null && campaign.getPriority() < 0) {
            violations.add("priority must not be negative");
        }

        checkFrequencyCap(campaign.getFrequencyCap(), violations);
        checkTargetRules(campaign.getTargetRules(), violations);
        checkTriggers(campaign.getTriggerConfig(), violations);

        if (campaign.isInExperiment()) {
            if (StringUtils.isBlank(campaign.getVariantKey())) {
                violations.add("variantKey is required for a campaign in experiment " + campaign.getExperimentId());
            } else if (experiment.isEmpty()) {
                violations.add("experiment " + campaign.getExperimentId() + " does not exist");
            } else if (!experiment.get().hasVariant(campaign.getVariantKey())) {
                violations.add("experiment " + campaign.getExperimentId()
                    + " has no variant " + campaign.getVariantKey());
            }
        }

        throwIfAny(violations);
    }

    /**
     * @throws ConfigException listing every violation found
     */
    public void validateExperiment(Experiment experiment) {
        List<String> violations = new ArrayList<>();

        if (StringUtils.isBlank(experiment.getId())) {
            violations.add("experiment id is required");
        }
        List<Variant> variants = experiment.getVariants() != null ? experiment.getVariants() : List.of();
        if (variants.isEmpty()) {
            violations.add("experiment needs at least one variant");
        }

        Set<String> keys = new HashSet<>();
        for (Variant variant : variants) {
            if (StringUtils.isBlank(variant.getVariantKey())) {
                violations.add("variantKey is required");
            } else if (!keys.add(variant.getVariantKey())) {
                violations.add("duplicate variantKey " + variant.getVariantKey());
            }
        }
        long controls = variants.stream().filter(Variant::isControl).count();
        if (controls > 1) {
            violations.add("at most one control variant is allowed, found " + controls);
        }

        if (experiment.getTrafficAllocation() == null) {
            violations.add("trafficAllocation is required");
        } else {
            int total = 0;
            for (Map.Entry<String, Integer> entry : experiment.getTrafficAllocation().entrySet()) {
                Integer percent = entry.getValue();
                if (!keys.contains(entry.getKey())) {
                    violations.add("trafficAllocation names unknown variant " + entry.getKey());
                }
                if (percent == null || percent < 0 || percent > ALLOCATION_TOTAL) {
                    violations.add("allocation of " + entry.getKey() + " must be between 0 and 100");
                } else {
                    total += percent;
                }
            }
            if (total != ALLOCATION_TOTAL) {
                violations.add("trafficAllocation must sum to 100, got " + total);
            }
        }

        throwIfAny(violations);
    }

    private void checkFrequencyCap(FrequencyCapConfig cap, List<String> violations) {
        if (cap == null) {
            return;
        }
        checkNotNegative("maxPerSession", cap.getMaxPerSession(), violations);
        checkNotNegative("maxPerHour", cap.getMaxPerHour(), violations);
        checkNotNegative("maxPerDay", cap.getMaxPerDay(), violations);
        checkNotNegative("maxPerWeek", cap.getMaxPerWeek(), violations);
        checkNotNegative("maxPerMonth", cap.getMaxPerMonth(), violations);
        checkNotNegative("cooldownSeconds", cap.getCooldownSeconds(), violations);

        GlobalCapConfig global = cap.getCrossCampaignLimits();
        if (global != null) {
            checkNotNegative("crossCampaignLimits.maxPerSession", global.getMaxPerSession(), violations);
            checkNotNegative("crossCampaignLimits.maxPerDay", global.getMaxPerDay(), violations);
            checkNotNegative("crossCampaignLimits.cooldownSeconds", global.getCooldownSeconds(), violations);
        }
    }

    private static void checkNotNegative(String field, Number value, List<String> violations) {
        if (value != null && value.longValue() < 0) {
            violations.add(field + " must not be negative");
        }
    }

    private void checkTargetRules(TargetRules rules, List<String> violations) {
        if (rules == null) {
            return;
        }
        TargetRules.PageTargeting page = rules.getPage();
        if (page != null) {
            checkPatterns("includePatterns", page.getIncludePatterns(), violations);
            checkPatterns("excludePatterns", page.getExcludePatterns(), violations);
        }

        TargetRules.AudienceTargeting audience = rules.getAudience();
        if (audience != null && audience.getSessionConditions() != null) {
            for (TargetRules.SessionCondition condition : audience.getSessionConditions()) {
                checkCondition(condition, violations);
            }
        }

        TargetRules.GeoTargeting geo = rules.getGeo();
        if (geo != null && geo.getCountries() != null && !geo.getCountries().isEmpty()) {
            if (geo.getMode() == null) {
                violations.add("geo mode (INCLUDE/EXCLUDE) is required when countries are listed");
            }
            geo.getCountries().stream()
                .filter(code -> code == null || !code.matches("[A-Za-z]{2}"))
                .forEach(code -> violations.add("invalid country code " + code));
        }
    }

    private void checkPatterns(String name, List<String> patterns, List<String> violations) {
        if (patterns != null && patterns.stream().anyMatch(StringUtils::isBlank)) {
            violations.add(name + " must not contain blank patterns");
        }
    }

    private void checkCondition(TargetRules.SessionCondition condition, List<String> violations) {
        if (condition == null || StringUtils.isBlank(condition.getField()) || condition.getOperator() == null) {
            violations.add("session condition needs a field and an operator");
            return;
        }
        switch (condition.getOperator()) {
            case GT, GTE, LT, LTE -> {
                Object value = condition.getValue();
                boolean numeric = value instanceof Number
                    || (value instanceof String text && NumberUtils.isParsable(text.trim()));
                if (!numeric) {
                    violations.add("condition on " + condition.getField() + " needs a numeric value");
                }
            }
            default -> {
                if (condition.getValue() == null) {
                    violations.add("condition on " + condition.getField() + " needs a value");
                }
            }
        }
    }

    private void checkTriggers(TriggerConfig config, List<String> violations) {
        if (config == null || config.isEmpty()) {
            return;
        }
        for (TriggerSpec spec : config.getTriggers()) {
            if (spec == null) {
                violations.add("trigger entry must not be empty");
                continue;
            }
            switch (spec.getType()) {
                case SCROLL_DEPTH -> {
                    Integer depth = ((TriggerSpec.ScrollDepth) spec).getDepthPercentage();
                    if (depth != null && (depth < 0 || depth > 100)) {
                        violations.add("scroll depthPercentage must be between 0 and 100");
                    }
                }
                case CART_VALUE -> {
                    TriggerSpec.CartValue cart = (TriggerSpec.CartValue) spec;
                    if (cart.getMinValue() != null && cart.getMaxValue() != null
                        && cart.getMinValue() > cart.getMaxValue()) {
                        violations.add("cart minValue must not exceed maxValue");
                    }
                }
                case TIME_DELAY -> {
                    Long delay = ((TriggerSpec.TimeDelay) spec).getDelaySeconds();
                    if (delay != null && delay < 0) {
                        violations.add("time delaySeconds must not be negative");
                    }
                }
                case IDLE_TIMER -> {
                    Long idle = ((TriggerSpec.IdleTimer) spec).getIdleSeconds();
                    if (idle != null && idle <= 0) {
                        violations.add("idleSeconds must be positive");
                    }
                }
                default -> {
                    // no constraints beyond the defaults
                }
            }
        }
    }

    private static void throwIfAny(List<String> violations) {
        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
    }
}
