package com.tazifor.popup.service;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.TargetRules;
import com.tazifor.popup.model.VisitorContext;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TargetingService - Targeting Matcher
 *
 * Pure predicate: does this page view satisfy a campaign's target rules?
 * No side effects, no store access, safe to call from any thread.
 *
 * ORDERING (cheapest first, FAIL FAST):
 * 1. Device class (enum set lookup)
 * 2. Geo (country set lookup)
 * 3. Audience (visitor type, session-attribute conditions)
 * 4. Page (URL wildcards, product tags, collections)
 *
 * A missing section matches every request.
 */
@Service
public class TargetingService {

    private static final String GID_SEPARATOR = "/";

    // Compiled URL patterns. The set of distinct patterns is bounded by the catalog.
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public boolean matchesTargeting(Campaign campaign, VisitorContext context) {
        return matches(campaign.getTargetRules(), context);
    }

    public boolean matches(TargetRules rules, VisitorContext context) {
        if (rules == null) {
            return true;
        }
        if (rules.getDevice() != null && !rules.getDevice().allows(context.getDeviceClass())) {
            return false;
        }
        if (!matchesGeo(rules.getGeo(), context)) {
            return false;
        }
        if (!matchesAudience(rules.getAudience(), context)) {
            return false;
        }
        return matchesPage(rules.getPage(), context);
    }

    /**
     * Geo Targeting
     *
     * INCLUDE: country must be listed. EXCLUDE: country must not be listed.
     * Geo rules are skipped when the visitor's country is unknown.
     */
    boolean matchesGeo(TargetRules.GeoTargeting geo, VisitorContext context) {
        if (geo == null || geo.getCountries() == null || geo.getCountries().isEmpty()) {
            return true;
        }
        String country = context.getCountry();
        if (StringUtils.isBlank(country)) {
            return true;
        }
        boolean listed = geo.getCountries().stream().anyMatch(country::equalsIgnoreCase);
        return geo.getMode() == TargetRules.GeoMode.EXCLUDE ? !listed : listed;
    }

    boolean matchesAudience(TargetRules.AudienceTargeting audience, VisitorContext context) {
        if (audience == null) {
            return true;
        }
        TargetRules.VisitorType visitorType = audience.getVisitorType();
        if (visitorType == TargetRules.VisitorType.NEW && context.isReturningVisitor()) {
            return false;
        }
        if (visitorType == TargetRules.VisitorType.RETURNING && !context.isReturningVisitor()) {
            return false;
        }

        Map<String, Object> attributes = context.getSessionAttributes() != null
            ? context.getSessionAttributes()
            : Map.of();
        return audience.getEffectiveOperator().combine(audience.getSessionConditions(),
            condition -> matchesCondition(condition, attributes));
    }

    /**
     * Page Targeting
     *
     * EXCLUSION WINS: a URL matching any exclude pattern is rejected even if it
     * also matches an include pattern.
     */
    boolean matchesPage(TargetRules.PageTargeting page, VisitorContext context) {
        if (page == null) {
            return true;
        }
        String url = StringUtils.defaultString(context.getPageUrl());

        if (page.getExcludePatterns() != null
            && page.getExcludePatterns().stream().anyMatch(p -> matchesPattern(url, p))) {
            return false;
        }
        if (page.getIncludePatterns() != null && !page.getIncludePatterns().isEmpty()
            && page.getIncludePatterns().stream().noneMatch(p -> matchesPattern(url, p))) {
            return false;
        }

        if (page.getProductTags() != null && !page.getProductTags().isEmpty()) {
            Set<String> tags = context.getProductTags();
            if (tags == null || page.getProductTags().stream().noneMatch(tags::contains)) {
                return false;
            }
        }

        if (page.getCollectionIds() != null && !page.getCollectionIds().isEmpty()) {
            String collection = trailingId(context.getCollectionId());
            if (collection == null || page.getCollectionIds().stream()
                .map(TargetingService::trailingId)
                .noneMatch(collection::equals)) {
                return false;
            }
        }

        return true;
    }

    /**
     * Full-URL wildcard match: {@code *} is any run of characters, {@code ?} any
     * single character, everything else is literal.
     */
    boolean matchesPattern(String url, String pattern) {
        if (pattern == null) {
            return false;
        }
        return patternCache.computeIfAbsent(pattern, TargetingService::compileWildcard)
            .matcher(url)
            .matches();
    }

    static Pattern compileWildcard(String wildcard) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : wildcard.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /**
     * Session Condition Evaluation
     *
     * Numbers (or numeric strings) compare numerically, anything else compares
     * as text. A missing attribute fails every operator except NE and NIN.
     */
    boolean matchesCondition(TargetRules.SessionCondition condition, Map<String, Object> attributes) {
        if (condition == null || condition.getField() == null || condition.getOperator() == null) {
            return false;
        }
        Object actual = attributes.get(condition.getField());
        Object expected = condition.getValue();

        if (actual == null) {
            return condition.getOperator() == TargetRules.ConditionOperator.NE
                || condition.getOperator() == TargetRules.ConditionOperator.NIN;
        }

        return switch (condition.getOperator()) {
            case EQ -> valueEquals(actual, expected);
            case NE -> !valueEquals(actual, expected);
            case GT -> compare(actual, expected, sign -> sign > 0);
            case GTE -> compare(actual, expected, sign -> sign >= 0);
            case LT -> compare(actual, expected, sign -> sign < 0);
            case LTE -> compare(actual, expected, sign -> sign <= 0);
            case IN -> toList(expected).stream().anyMatch(v -> valueEquals(actual, v));
            case NIN -> toList(expected).stream().noneMatch(v -> valueEquals(actual, v));
        };
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        Double a = asNumber(actual);
        Double b = asNumber(expected);
        if (a != null && b != null) {
            return a.compareTo(b) == 0;
        }
        return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
    }

    // ordering operators only apply to numbers
    private static boolean compare(Object actual, Object expected, IntPredicate test) {
        Double a = asNumber(actual);
        Double b = asNumber(expected);
        return a != null && b != null && test.test(Double.compare(a, b));
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && NumberUtils.isParsable(text.trim())) {
            return NumberUtils.createDouble(text.trim());
        }
        return null;
    }

    private static List<?> toList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof String text) {
            return Arrays.stream(StringUtils.split(text, ','))
                .map(String::trim)
                .collect(Collectors.toList());
        }
        return value != null ? List.of(value) : List.of();
    }

    /**
     * "gid://shop/Collection/123" and "123" both become "123".
     */
    static String trailingId(String id) {
        if (StringUtils.isBlank(id)) {
            return null;
        }
        return id.contains(GID_SEPARATOR) ? StringUtils.substringAfterLast(id, GID_SEPARATOR) : id.trim();
    }
}
