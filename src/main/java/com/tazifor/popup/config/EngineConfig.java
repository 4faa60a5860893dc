package com.tazifor.popup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.popup.experiment.ExperimentAssigner;
import com.tazifor.popup.experiment.ExperimentAssignmentStore;
import com.tazifor.popup.experiment.StickyAssignmentService;
import com.tazifor.popup.integration.AnalyticsSink;
import com.tazifor.popup.integration.DiscountIssuer;
import com.tazifor.popup.integration.GeneratedCodeDiscountIssuer;
import com.tazifor.popup.integration.LeadSink;
import com.tazifor.popup.integration.LoggingAnalyticsSink;
import com.tazifor.popup.integration.LoggingLeadSink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine wiring that does not depend on the store backend.
 *
 * The integration beans are defaults; a deployment replaces them by declaring
 * its own {@link AnalyticsSink}, {@link LeadSink} or {@link DiscountIssuer}.
 */
@Configuration
@EnableConfigurationProperties(PopupEngineProperties.class)
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExperimentAssigner experimentAssigner() {
        return new ExperimentAssigner();
    }

    @Bean
    public StickyAssignmentService stickyAssignmentService(ExperimentAssigner assigner,
                                                           ExperimentAssignmentStore assignmentStore,
                                                           PopupEngineProperties properties) {
        return new StickyAssignmentService(assigner,
            properties.isMirrorAssignments() ? assignmentStore : null,
            properties.getVariantFallback());
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalyticsSink analyticsSink(ObjectMapper objectMapper) {
        return new LoggingAnalyticsSink(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeadSink leadSink() {
        return new LoggingLeadSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public DiscountIssuer discountIssuer(@Value("${popup.discount-code-prefix:POP}") String prefix) {
        return new GeneratedCodeDiscountIssuer(prefix);
    }
}
