package com.tazifor.popup.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.popup.model.AnalyticsEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each event as one JSON log line under the "analytics" logger category.
 */
@Slf4j(topic = "analytics")
public class LoggingAnalyticsSink implements AnalyticsSink {

    private final ObjectMapper objectMapper;

    public LoggingAnalyticsSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(AnalyticsEvent event) {
        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable {} event for campaign {}: {}",
                event.getType(), event.getCampaignId(), e.getMessage());
        }
    }
}
