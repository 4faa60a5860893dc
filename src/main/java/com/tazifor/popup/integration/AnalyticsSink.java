package com.tazifor.popup.integration;

import com.tazifor.popup.model.AnalyticsEvent;

/**
 * Destination for popup analytics events. Transport is the sink's concern.
 */
public interface AnalyticsSink {

    void publish(AnalyticsEvent event);
}
