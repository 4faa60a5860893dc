package com.tazifor.popup.integration;

import com.tazifor.popup.model.VisitorContext;

import java.util.Map;

/**
 * Receives visitor-submitted form data (email, phone, consent...).
 */
public interface LeadSink {

    void submit(String storeId, String campaignId, VisitorContext visitor, Map<String, String> fields);
}
