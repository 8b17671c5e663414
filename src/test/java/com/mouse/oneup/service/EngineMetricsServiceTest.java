package com.mouse.oneup.service;

import com.mouse.oneup.enums.LeadEngineType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EngineMetricsService Tests")
class EngineMetricsServiceTest {

    @Test
    @DisplayName("getMetrics_countsEachOutcome")
    void getMetrics_countsEachOutcome() {
        EngineMetricsService metrics = new EngineMetricsService();

        metrics.recordPriced(LeadEngineType.EXACT_DP);
        metrics.recordPriced(LeadEngineType.EXACT_DP);
        metrics.recordPriced(LeadEngineType.MONTE_CARLO);
        metrics.recordInsufficientData();
        metrics.recordDegenerate();
        metrics.recordSkipped();

        Map<String, Object> snapshot = metrics.getMetrics();
        assertThat(snapshot)
                .containsEntry("priced", 3)
                .containsEntry("insufficientData", 1)
                .containsEntry("degenerate", 1)
                .containsEntry("failed", 0)
                .containsEntry("skipped", 1)
                .containsEntry("priced.EXACT_DP", 2)
                .containsEntry("priced.MONTE_CARLO", 1)
                .containsEntry("successRate", 75.0);
    }

    @Test
    @DisplayName("getMetrics_onlyFailures_zeroRate")
    void getMetrics_onlyFailures_zeroRate() {
        EngineMetricsService metrics = new EngineMetricsService();
        metrics.recordFailure();
        metrics.logMetrics();

        assertThat(metrics.getMetrics()).containsEntry("failed", 1).containsEntry("successRate", 0.0);
    }
}
