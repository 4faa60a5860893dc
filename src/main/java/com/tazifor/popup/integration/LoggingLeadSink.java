package com.tazifor.popup.integration;

import com.tazifor.popup.model.VisitorContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Logs lead submissions without their field values.
 */
@Slf4j
public class LoggingLeadSink implements LeadSink {

    @Override
    public void submit(String storeId, String campaignId, VisitorContext visitor, Map<String, String> fields) {
        log.info("Lead for store {} campaign {} visitor {} with fields {}",
            storeId, campaignId, visitor.getVisitorId(), fields != null ? fields.keySet() : "[]");
    }
}
