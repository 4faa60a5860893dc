package com.tazifor.popup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Set;

/**
 * Visitor/Session Context
 *
 * Everything the engine knows about the current page view. It is passed
 * explicitly through every evaluation call; the engine keeps no per-visitor
 * state outside the cap store and the assignment mirror.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VisitorContext {

    // ===== Identity =====
    private String visitorId;        // Durable anonymous id
    private String sessionId;        // Renewed after inactivity

    // ===== Visitor =====
    private boolean returningVisitor;
    private DeviceClass deviceClass;
    private String country;

    // ===== Page =====
    private String pageUrl;
    private Set<String> productTags;
    private String collectionId;

    /**
     * Free-form session attributes (cartValue, visitCount, pageType...) used by
     * audience session conditions.
     */
    private Map<String, Object> sessionAttributes;

    /**
     * Client-held experiment tokens: experimentId to variantKey.
     */
    private Map<String, String> assignments;

    @JsonIgnore
    public boolean hasIdentity() {
        return StringUtils.isNotBlank(visitorId) && StringUtils.isNotBlank(sessionId);
    }
}
